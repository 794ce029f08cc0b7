package org.msgsearch.search.refresh;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.msgsearch.core.model.Message;
import org.msgsearch.search.index.IndexSnapshot;
import org.msgsearch.search.index.InvertedIndexBuilder;
import org.msgsearch.search.index.SnapshotHolder;
import org.msgsearch.search.model.SearchPage;
import org.msgsearch.search.service.SearchService;
import org.msgsearch.search.service.TieBreak;
import org.msgsearch.search.upstream.MessageFetcher;
import org.msgsearch.search.upstream.UpstreamUnavailableException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class IndexRefresherTest {

	private static final List<Message> MESSAGES = List.of(
			new Message("1", "u1", "Ann", null, "hello world"),
			new Message("2", "u2", "Bob", null, "hello there")
	);

	private final SnapshotHolder holder = new SnapshotHolder();
	private final List<IndexRefresher> refreshers = new ArrayList<>();

	@AfterEach
	public void tearDown() {
		refreshers.forEach(IndexRefresher::stop);
	}

	private IndexRefresher refresher(MessageFetcher fetcher, Duration fetchTimeout) {
		IndexRefresher refresher = new IndexRefresher(fetcher, new InvertedIndexBuilder(), holder,
				Duration.ofHours(1), fetchTimeout);
		refreshers.add(refresher);
		return refresher;
	}

	private static void await(CountDownLatch latch) throws UpstreamUnavailableException {
		try {
			latch.await(30, TimeUnit.SECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new UpstreamUnavailableException("interrupted", e);
		}
	}

	private static void awaitReady(SnapshotHolder holder) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 5_000;
		while (!holder.isReady() && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
		assertTrue(holder.isReady(), "snapshot was not published in time");
	}

	@Test
	public void testSuccessfulCyclePublishes() {
		IndexRefresher refresher = refresher(() -> MESSAGES, Duration.ofSeconds(5));

		assertEquals(IndexRefresher.CycleResult.PUBLISHED, refresher.runCycle());

		IndexSnapshot snapshot = holder.current().orElseThrow();
		assertEquals(2, snapshot.size());
		RefreshStatus status = refresher.getStatus();
		assertEquals(RefreshState.IDLE, status.state());
		assertEquals(1, status.successfulCycles());
		assertNotNull(status.lastSuccess());
		assertNull(status.lastError());
	}

	@Test
	public void testFailedCycleKeepsPreviousSnapshot() {
		AtomicReference<Boolean> upstreamDown = new AtomicReference<>(false);
		IndexRefresher refresher = refresher(() -> {
			if (upstreamDown.get()) {
				throw new UpstreamUnavailableException("connection refused");
			}
			return MESSAGES;
		}, Duration.ofSeconds(5));
		SearchService search = new SearchService(holder, 100, TieBreak.ID);

		refresher.runCycle();
		IndexSnapshot before = holder.current().orElseThrow();
		IndexSnapshot.IndexStats statsBefore = before.stats();
		SearchPage pageBefore = search.search("hello", 1, 10);

		upstreamDown.set(true);
		assertEquals(IndexRefresher.CycleResult.FAILED, refresher.runCycle());

		assertSame(before, holder.current().orElseThrow());
		assertEquals(statsBefore, holder.current().orElseThrow().stats());
		assertEquals(pageBefore, search.search("hello", 1, 10));

		RefreshStatus status = refresher.getStatus();
		assertEquals(RefreshState.IDLE, status.state());
		assertEquals(1, status.failedCycles());
		assertEquals("connection refused", status.lastError());
		assertNotNull(status.lastFailure());
		assertNotNull(status.lastSuccess());
	}

	@Test
	public void testFailureBeforeFirstPublishLeavesServiceNotReady() {
		IndexRefresher refresher = refresher(() -> {
			throw new UpstreamUnavailableException("HTTP 403");
		}, Duration.ofSeconds(5));

		assertEquals(IndexRefresher.CycleResult.FAILED, refresher.runCycle());
		assertFalse(holder.isReady());
	}

	@Test
	public void testUnexpectedFetcherErrorIsContained() {
		IndexRefresher refresher = refresher(() -> {
			throw new IllegalStateException("bad payload");
		}, Duration.ofSeconds(5));

		assertEquals(IndexRefresher.CycleResult.FAILED, refresher.runCycle());
		assertTrue(refresher.getStatus().lastError().contains("bad payload"));
	}

	@Test
	public void testHungFetchTimesOut() {
		IndexRefresher refresher = refresher(() -> {
			await(new CountDownLatch(1));
			return MESSAGES;
		}, Duration.ofMillis(200));

		long start = System.nanoTime();
		assertEquals(IndexRefresher.CycleResult.FAILED, refresher.runCycle());
		long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		assertTrue(elapsedMs < 5_000, "timeout took " + elapsedMs + " ms");
		assertTrue(refresher.getStatus().lastError().contains("timed out"));
		assertFalse(refresher.isRunning());
	}

	@Test
	public void testCyclesDoNotOverlap() throws Exception {
		CountDownLatch fetchStarted = new CountDownLatch(1);
		CountDownLatch releaseFetch = new CountDownLatch(1);
		IndexRefresher refresher = refresher(() -> {
			fetchStarted.countDown();
			await(releaseFetch);
			return MESSAGES;
		}, Duration.ofSeconds(10));

		AtomicReference<IndexRefresher.CycleResult> firstResult = new AtomicReference<>();
		Thread first = new Thread(() -> firstResult.set(refresher.runCycle()));
		first.start();
		assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));

		assertTrue(refresher.isRunning());
		assertEquals(RefreshState.FETCHING, refresher.getStatus().state());
		assertEquals(IndexRefresher.CycleResult.SKIPPED, refresher.runCycle());
		assertFalse(refresher.triggerNow());

		releaseFetch.countDown();
		first.join(5_000);

		assertEquals(IndexRefresher.CycleResult.PUBLISHED, firstResult.get());
		assertEquals(2, refresher.getStatus().skippedTriggers());
		assertEquals(1, refresher.getStatus().successfulCycles());
	}

	@Test
	public void testStartRefreshesImmediately() throws Exception {
		IndexRefresher refresher = refresher(() -> MESSAGES, Duration.ofSeconds(5));

		refresher.start(true);

		awaitReady(holder);
		assertEquals(2, holder.current().orElseThrow().size());
	}

	@Test
	public void testTriggerNowRunsInBackground() throws Exception {
		IndexRefresher refresher = refresher(() -> MESSAGES, Duration.ofSeconds(5));

		assertTrue(refresher.triggerNow());

		awaitReady(holder);
	}

	@Test
	public void testAcceptedTriggerOwnsTheNextCycle() throws Exception {
		CountDownLatch releaseFetch = new CountDownLatch(1);
		AtomicInteger fetches = new AtomicInteger();
		IndexRefresher refresher = refresher(() -> {
			fetches.incrementAndGet();
			await(releaseFetch);
			return MESSAGES;
		}, Duration.ofSeconds(10));

		assertTrue(refresher.triggerNow());
		// whether or not the queued cycle has started yet, it is already claimed
		assertTrue(refresher.isRunning());
		assertFalse(refresher.triggerNow());
		assertEquals(IndexRefresher.CycleResult.SKIPPED, refresher.runCycle());

		releaseFetch.countDown();
		awaitReady(holder);

		assertEquals(1, fetches.get());
		assertEquals(2, refresher.getStatus().skippedTriggers());
	}

	@Test
	public void testTriggerAfterStopIsRejected() {
		IndexRefresher refresher = refresher(() -> MESSAGES, Duration.ofSeconds(5));
		refresher.stop();

		assertFalse(refresher.triggerNow());
		assertFalse(refresher.isRunning());
	}
}
