package org.msgsearch.search.service;

import org.junit.jupiter.api.Test;
import org.msgsearch.core.model.Message;
import org.msgsearch.search.index.IndexSnapshot;
import org.msgsearch.search.index.InvertedIndexBuilder;
import org.msgsearch.search.index.SnapshotHolder;
import org.msgsearch.search.model.SearchPage;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ConcurrentSearchTest {

	private static Message message(String id, String text) {
		return new Message(id, null, null, null, text);
	}

	@Test
	public void testQueriesDuringPublishSeeWholeSnapshots() throws Exception {
		InvertedIndexBuilder builder = new InvertedIndexBuilder();
		IndexSnapshot oldSnapshot = builder.build(List.of(
				message("1", "alpha"),
				message("2", "alpha beta")
		));
		IndexSnapshot newSnapshot = builder.build(List.of(
				message("1", "alpha"),
				message("2", "alpha beta"),
				message("3", "alpha"),
				message("4", "beta alpha")
		));
		List<String> oldResult = List.of("2", "1");
		List<String> newResult = List.of("2", "4", "1", "3");

		SnapshotHolder holder = new SnapshotHolder();
		holder.publish(oldSnapshot);
		SearchService service = new SearchService(holder, 100, TieBreak.ID);

		int readers = 8;
		ExecutorService pool = Executors.newFixedThreadPool(readers);
		CountDownLatch startGate = new CountDownLatch(1);
		AtomicBoolean publishing = new AtomicBoolean(true);
		Queue<String> violations = new ConcurrentLinkedQueue<>();

		for (int r = 0; r < readers; r++) {
			pool.submit(() -> {
				startGate.await();
				while (publishing.get()) {
					SearchPage page = service.search("alpha beta", 1, 10);
					List<String> ids = page.items().stream().map(Message::id).collect(Collectors.toList());
					boolean isOld = ids.equals(oldResult) && page.totalMatches() == 2;
					boolean isNew = ids.equals(newResult) && page.totalMatches() == 4;
					if (!isOld && !isNew) {
						violations.add(ids + " total=" + page.totalMatches());
					}
				}
				return null;
			});
		}

		startGate.countDown();
		for (int i = 0; i < 2_000; i++) {
			holder.publish(i % 2 == 0 ? newSnapshot : oldSnapshot);
		}
		publishing.set(false);
		pool.shutdown();
		assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

		assertTrue(violations.isEmpty(), "Mixed snapshot observed: " + violations.peek());
	}
}
