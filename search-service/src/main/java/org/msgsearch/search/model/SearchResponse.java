package org.msgsearch.search.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public record SearchResponse(
		int total,
		int page,
		@SerializedName("page_size") int pageSize,
		List<SearchResult> results
) {
	public static SearchResponse fromPage(SearchPage page) {
		return new SearchResponse(
				page.totalMatches(),
				page.page(),
				page.pageSize(),
				page.items().stream().map(SearchResult::fromMessage).toList()
		);
	}
}
