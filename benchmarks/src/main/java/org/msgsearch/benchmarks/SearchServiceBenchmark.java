package org.msgsearch.benchmarks;

import org.msgsearch.core.model.Message;
import org.msgsearch.search.index.IndexSnapshot;
import org.msgsearch.search.index.InvertedIndexBuilder;
import org.msgsearch.search.index.SnapshotHolder;
import org.msgsearch.search.service.SearchService;
import org.msgsearch.search.service.TieBreak;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the in-memory index
 * Tests: full rebuild, single-token query, multi-token query, deep page
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SearchServiceBenchmark {

	private static final String[] VOCABULARY = {
			"book", "table", "dinner", "flight", "paris", "tokyo", "hotel", "suite", "friday", "tonight",
			"please", "reserve", "private", "jet", "car", "service", "tickets", "concert", "opera", "villa",
			"restaurant", "seats", "upgrade", "confirm", "cancel", "change", "reservation", "spa", "yacht", "chef"
	};
	private static final String[] NAMES = {
			"Sophia Al-Farsi", "Fatima El-Tahir", "Armand Dupont", "Hans Muller", "Layla Kawaguchi",
			"Amina Van Den Berg", "Vikram Desai", "Lily O'Sullivan", "Lorenzo Cavalli", "Thiago Monteiro"
	};

	private List<Message> messages;
	private SearchService searchService;

	@Param({"1000", "10000", "50000"})
	private int messageCount;

	@Setup(Level.Trial)
	public void setup() {
		Random random = new Random(42);
		messages = new ArrayList<>(messageCount);
		for (int i = 0; i < messageCount; i++) {
			StringBuilder text = new StringBuilder();
			int words = 6 + random.nextInt(10);
			for (int w = 0; w < words; w++) {
				text.append(VOCABULARY[random.nextInt(VOCABULARY.length)]).append(' ');
			}
			messages.add(new Message(
					String.format("msg-%06d", i),
					"user-" + (i % NAMES.length),
					NAMES[i % NAMES.length],
					"2025-01-01T00:00:00Z",
					text.toString().trim()
			));
		}

		SnapshotHolder holder = new SnapshotHolder();
		holder.publish(new InvertedIndexBuilder().build(messages));
		searchService = new SearchService(holder, 100, TieBreak.ID);

		System.out.println("Index ready: " + messageCount + " messages");
	}

	/**
	 * Benchmark: Build a complete snapshot from scratch
	 */
	@Benchmark
	public void buildSnapshot(Blackhole blackhole) {
		IndexSnapshot snapshot = new InvertedIndexBuilder().build(messages);
		blackhole.consume(snapshot.uniqueTokens());
	}

	/**
	 * Benchmark: Single-token query, first page
	 */
	@Benchmark
	public void singleTokenQuery(Blackhole blackhole) {
		blackhole.consume(searchService.search("paris", 1, 10));
	}

	/**
	 * Benchmark: Multi-token OR query, first page
	 */
	@Benchmark
	public void multiTokenQuery(Blackhole blackhole) {
		blackhole.consume(searchService.search("book a private jet to Paris on Friday", 1, 10));
	}

	/**
	 * Benchmark: Deep page of a broad query
	 */
	@Benchmark
	public void deepPage(Blackhole blackhole) {
		blackhole.consume(searchService.search("please book", 50, 20));
	}
}
