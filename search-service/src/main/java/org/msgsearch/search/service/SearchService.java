package org.msgsearch.search.service;

import org.msgsearch.core.model.Message;
import org.msgsearch.core.text.Tokenizer;
import org.msgsearch.search.index.IndexSnapshot;
import org.msgsearch.search.index.SnapshotHolder;
import org.msgsearch.search.model.SearchPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers paginated token-overlap queries against the active index snapshot.
 *
 * <p>A message matches when it contains any query token. Results are ranked by the number of distinct query
 * tokens they contain, then by the configured {@link TieBreak}. Never blocks on I/O.</p>
 */
public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private static final Pattern UUID_PATTERN = Pattern.compile(
			"^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

	private final SnapshotHolder snapshots;
	private final int maxPageSize;
	private final TieBreak tieBreak;

	public SearchService(SnapshotHolder snapshots, int maxPageSize, TieBreak tieBreak) {
		if (maxPageSize < 1) {
			throw new IllegalArgumentException("maxPageSize must be >= 1");
		}
		this.snapshots = snapshots;
		this.maxPageSize = maxPageSize;
		this.tieBreak = tieBreak;
	}

	/**
	 * Search the active snapshot. Before the first publish this returns an empty page flagged not ready.
	 *
	 * @throws InvalidPaginationException if {@code page < 1} or {@code pageSize < 1}
	 */
	public SearchPage search(String query, int page, int pageSize) {
		int effectivePageSize = validate(page, pageSize);

		Optional<IndexSnapshot> snapshot = snapshots.current();
		if (snapshot.isEmpty()) {
			logger.debug("Search for '{}' before first index publish", query);
			return SearchPage.notReady(page, effectivePageSize);
		}
		return search(query, page, effectivePageSize, snapshot.get());
	}

	/**
	 * Search a specific snapshot.
	 *
	 * @throws InvalidPaginationException if {@code page < 1} or {@code pageSize < 1}
	 */
	public SearchPage search(String query, int page, int pageSize, IndexSnapshot snapshot) {
		int effectivePageSize = validate(page, pageSize);

		List<String> ranked;
		if (query != null && UUID_PATTERN.matcher(query.trim()).matches()) {
			ranked = lookupIdentifier(query.trim(), snapshot);
		} else {
			Set<String> tokens = Tokenizer.distinctTokens(query);
			if (tokens.isEmpty()) {
				return SearchPage.empty(page, effectivePageSize);
			}
			ranked = rank(tokens, snapshot);
		}

		List<Message> items = slice(ranked, page, effectivePageSize).stream()
				.map(snapshot::message)
				.collect(Collectors.toList());

		logger.debug("Query '{}' matched {} messages (page {}, size {})", query, ranked.size(), page, effectivePageSize);
		return new SearchPage(items, ranked.size(), page, effectivePageSize, true);
	}

	private int validate(int page, int pageSize) {
		if (page < 1) {
			throw new InvalidPaginationException("page must be >= 1 but was " + page);
		}
		if (pageSize < 1) {
			throw new InvalidPaginationException("page_size must be >= 1 but was " + pageSize);
		}
		return Math.min(pageSize, maxPageSize);
	}

	private List<String> rank(Set<String> queryTokens, IndexSnapshot snapshot) {
		Map<String, Integer> matchCounts = new HashMap<>();
		for (String token : queryTokens) {
			for (String id : snapshot.postings(token)) {
				matchCounts.merge(id, 1, Integer::sum);
			}
		}

		Comparator<String> secondary = tieBreak.comparator(snapshot);
		Comparator<String> ordering = Comparator.<String>comparingInt(matchCounts::get).reversed()
				.thenComparing(secondary);

		List<String> ids = new ArrayList<>(matchCounts.keySet());
		ids.sort(ordering);
		return ids;
	}

	/**
	 * Exact match on message id or user id, in upstream order.
	 */
	private List<String> lookupIdentifier(String identifier, IndexSnapshot snapshot) {
		List<String> ids = new ArrayList<>();
		for (Message message : snapshot.messages()) {
			if (identifier.equalsIgnoreCase(message.id()) || identifier.equalsIgnoreCase(message.userId())) {
				ids.add(message.id());
			}
		}
		return ids;
	}

	private static <T> List<T> slice(List<T> ranked, int page, int pageSize) {
		long from = (long) (page - 1) * pageSize;
		if (from >= ranked.size()) {
			return List.of();
		}
		int to = (int) Math.min(from + pageSize, ranked.size());
		return ranked.subList((int) from, to);
	}

	public int getMaxPageSize() {
		return maxPageSize;
	}

	/**
	 * Statistics of the active snapshot.
	 */
	public SearchStats getStats() {
		return snapshots.current()
				.map(snapshot -> new SearchStats(true, snapshot.stats()))
				.orElseGet(() -> new SearchStats(false, IndexSnapshot.empty().stats()));
	}

	public record SearchStats(boolean ready, IndexSnapshot.IndexStats index) {}
}
