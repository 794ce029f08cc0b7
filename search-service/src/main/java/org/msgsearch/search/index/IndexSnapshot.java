package org.msgsearch.search.index;

import org.msgsearch.core.model.Message;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One immutable generation of the inverted index: the message table and the postings table, built together.
 *
 * <p>Instances are never modified after construction, so any number of threads can read one without locking.
 * Every identifier in a postings set is guaranteed to be present in the message table.</p>
 */
public final class IndexSnapshot {
	private static final IndexSnapshot EMPTY = new IndexSnapshot(Map.of(), Map.of(), 0L, Instant.EPOCH);

	private final Map<String, Message> messages;
	private final Map<String, Set<String>> postings;
	private final Map<String, Integer> upstreamOrder;
	private final long generation;
	private final Instant builtAt;
	private final int totalPostings;

	/**
	 * @param messages message table in upstream order
	 * @param postings token to identifiers; the sets are copied
	 * @throws IllegalStateException if a postings set references an identifier missing from {@code messages}
	 */
	public IndexSnapshot(Map<String, Message> messages, Map<String, Set<String>> postings,
						 long generation, Instant builtAt) {
		Map<String, Message> messageTable = new LinkedHashMap<>(messages);
		Map<String, Integer> order = new LinkedHashMap<>();
		for (String id : messageTable.keySet()) {
			order.put(id, order.size());
		}

		Map<String, Set<String>> postingsTable = new LinkedHashMap<>();
		int mappings = 0;
		for (Map.Entry<String, Set<String>> entry : postings.entrySet()) {
			for (String id : entry.getValue()) {
				if (!messageTable.containsKey(id)) {
					throw new IllegalStateException(
							"Postings for token '" + entry.getKey() + "' reference unknown message " + id);
				}
			}
			postingsTable.put(entry.getKey(), Set.copyOf(entry.getValue()));
			mappings += entry.getValue().size();
		}

		this.messages = Collections.unmodifiableMap(messageTable);
		this.postings = Collections.unmodifiableMap(postingsTable);
		this.upstreamOrder = Collections.unmodifiableMap(order);
		this.generation = generation;
		this.builtAt = builtAt;
		this.totalPostings = mappings;
	}

	public static IndexSnapshot empty() {
		return EMPTY;
	}

	/**
	 * Identifiers of the messages containing the token, empty if the token is unknown.
	 */
	public Set<String> postings(String token) {
		return postings.getOrDefault(token, Set.of());
	}

	public Message message(String id) {
		return messages.get(id);
	}

	/**
	 * Messages in upstream order.
	 */
	public Collection<Message> messages() {
		return messages.values();
	}

	/**
	 * Position of the message in the upstream listing, or {@link Integer#MAX_VALUE} if unknown.
	 */
	public int upstreamPosition(String id) {
		return upstreamOrder.getOrDefault(id, Integer.MAX_VALUE);
	}

	public int size() {
		return messages.size();
	}

	public boolean isEmpty() {
		return messages.isEmpty();
	}

	public int uniqueTokens() {
		return postings.size();
	}

	public int totalPostings() {
		return totalPostings;
	}

	public long generation() {
		return generation;
	}

	public Instant builtAt() {
		return builtAt;
	}

	public IndexStats stats() {
		return new IndexStats(size(), uniqueTokens(), totalPostings, generation, builtAt);
	}

	public record IndexStats(int documents, int uniqueTokens, int totalPostings, long generation, Instant builtAt) {}
}
