package org.msgsearch.search;

import org.msgsearch.search.bootstrap.SearchBootstrap;

public class SearchApp {
    public static void main(String[] args) {
        SearchBootstrap.run();
    }
}
