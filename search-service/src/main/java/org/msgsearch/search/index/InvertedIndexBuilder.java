package org.msgsearch.search.index;

import org.msgsearch.core.model.Message;
import org.msgsearch.core.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a complete {@link IndexSnapshot} from a list of messages.
 *
 * <p>Each call produces a new snapshot with the next generation number. Nothing built here is visible to
 * readers until it is published through {@link SnapshotHolder}.</p>
 */
public class InvertedIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

	static final String GENERATED_ID_PREFIX = "auto-";

	private final AtomicLong generations = new AtomicLong();
	private final Clock clock;

	public InvertedIndexBuilder() {
		this(Clock.systemUTC());
	}

	public InvertedIndexBuilder(Clock clock) {
		this.clock = clock;
	}

	/**
	 * Index all messages. Duplicate identifiers keep the last content and the first upstream position;
	 * messages without an identifier get {@code auto-<position>}, suffixed with {@code -<n>} when upstream
	 * already uses that identifier.
	 */
	public IndexSnapshot build(List<Message> messages) {
		long start = System.nanoTime();
		Set<String> takenIds = new HashSet<>();
		for (Message message : messages) {
			if (message != null && message.hasId()) {
				takenIds.add(message.id());
			}
		}

		Map<String, Message> table = new LinkedHashMap<>();
		int position = 0;
		int duplicates = 0;

		for (Message message : messages) {
			if (message == null) {
				position++;
				continue;
			}
			Message indexed = message.hasId() ? message : message.withId(generateId(position, takenIds));
			if (table.put(indexed.id(), indexed) != null) {
				duplicates++;
			}
			position++;
		}

		Map<String, Set<String>> postings = new HashMap<>();
		for (Message message : table.values()) {
			indexMessage(message, postings);
		}

		IndexSnapshot snapshot = new IndexSnapshot(table, postings, generations.incrementAndGet(), clock.instant());

		long elapsedMs = (System.nanoTime() - start) / 1_000_000;
		logger.info("Built index generation {}: {} messages, {} unique tokens, {} duplicates replaced in {} ms",
				snapshot.generation(), snapshot.size(), snapshot.uniqueTokens(), duplicates, elapsedMs);
		return snapshot;
	}

	private static String generateId(int position, Set<String> takenIds) {
		String base = GENERATED_ID_PREFIX + position;
		String candidate = base;
		for (int suffix = 1; !takenIds.add(candidate); suffix++) {
			candidate = base + "-" + suffix;
		}
		return candidate;
	}

	private void indexMessage(Message message, Map<String, Set<String>> postings) {
		Set<String> uniqueTokens = Tokenizer.distinctTokens(message.searchableText());

		for (String token : uniqueTokens) {
			postings.computeIfAbsent(token, t -> new HashSet<>()).add(message.id());
		}

		logger.debug("Indexed message {} with {} unique tokens", message.id(), uniqueTokens.size());
	}
}
