package org.msgsearch.search.model;

import org.msgsearch.core.model.Message;

import java.util.List;

/**
 * One page of ranked results.
 *
 * @param items messages on this page, best match first
 * @param totalMatches number of matching messages across all pages
 * @param page requested 1-based page
 * @param pageSize effective page size after clamping
 * @param ready false when no index has been published yet
 */
public record SearchPage(
		List<Message> items,
		int totalMatches,
		int page,
		int pageSize,
		boolean ready
) {
	public static SearchPage notReady(int page, int pageSize) {
		return new SearchPage(List.of(), 0, page, pageSize, false);
	}

	public static SearchPage empty(int page, int pageSize) {
		return new SearchPage(List.of(), 0, page, pageSize, true);
	}
}
