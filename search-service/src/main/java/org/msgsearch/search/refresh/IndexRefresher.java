package org.msgsearch.search.refresh;

import org.msgsearch.core.model.Message;
import org.msgsearch.search.index.IndexSnapshot;
import org.msgsearch.search.index.InvertedIndexBuilder;
import org.msgsearch.search.index.SnapshotHolder;
import org.msgsearch.search.upstream.MessageFetcher;
import org.msgsearch.search.upstream.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Periodically fetches all messages, builds a fresh snapshot and publishes it.
 *
 * <p>Cycles run on a single scheduler thread and never overlap; a trigger that arrives while a cycle runs is
 * skipped. The fetch runs on its own executor so it can be abandoned after the configured timeout. A failed
 * cycle leaves the active snapshot in place.</p>
 */
public class IndexRefresher {
	private static final Logger logger = LoggerFactory.getLogger(IndexRefresher.class);

	private final MessageFetcher fetcher;
	private final InvertedIndexBuilder builder;
	private final SnapshotHolder snapshots;
	private final Duration interval;
	private final Duration fetchTimeout;
	private final Clock clock;

	private final ScheduledExecutorService scheduler;
	private final ExecutorService fetchExecutor;
	private final AtomicBoolean running = new AtomicBoolean(false);

	private final AtomicLong successfulCycles = new AtomicLong();
	private final AtomicLong failedCycles = new AtomicLong();
	private final AtomicLong skippedTriggers = new AtomicLong();
	private volatile RefreshState state = RefreshState.IDLE;
	private volatile RefreshStatus lastOutcome = new RefreshStatus(RefreshState.IDLE, null, null, null, 0, 0, 0);

	public IndexRefresher(MessageFetcher fetcher, InvertedIndexBuilder builder, SnapshotHolder snapshots,
						  Duration interval, Duration fetchTimeout) {
		this(fetcher, builder, snapshots, interval, fetchTimeout, Clock.systemUTC());
	}

	public IndexRefresher(MessageFetcher fetcher, InvertedIndexBuilder builder, SnapshotHolder snapshots,
						  Duration interval, Duration fetchTimeout, Clock clock) {
		this.fetcher = fetcher;
		this.builder = builder;
		this.snapshots = snapshots;
		this.interval = interval;
		this.fetchTimeout = fetchTimeout;
		this.clock = clock;
		this.scheduler = Executors.newSingleThreadScheduledExecutor(namedDaemon("index-refresher"));
		this.fetchExecutor = Executors.newCachedThreadPool(namedDaemon("upstream-fetch"));
	}

	/**
	 * Schedule cycles at a fixed delay.
	 *
	 * @param refreshNow run the first cycle immediately instead of after one interval
	 */
	public void start(boolean refreshNow) {
		long initialDelay = refreshNow ? 0 : interval.toMillis();
		scheduler.scheduleWithFixedDelay(() -> guarded(this::runCycle), initialDelay, interval.toMillis(), TimeUnit.MILLISECONDS);
		logger.info("Index refresher started (interval={}s, fetch timeout={}s, refresh now={})",
				interval.toSeconds(), fetchTimeout.toSeconds(), refreshNow);
	}

	/**
	 * Queue a cycle on the refresher thread. The cycle is claimed before it is queued, so a scheduled cycle
	 * that fires in between is skipped instead of running first.
	 *
	 * @return false if a cycle is already running or queued, in which case nothing is queued
	 */
	public boolean triggerNow() {
		if (!running.compareAndSet(false, true)) {
			skippedTriggers.incrementAndGet();
			logger.info("Refresh requested while a cycle is running, skipping");
			return false;
		}
		try {
			scheduler.execute(() -> guarded(this::runClaimedCycle));
			return true;
		} catch (RejectedExecutionException e) {
			running.set(false);
			logger.warn("Refresh requested after shutdown");
			return false;
		}
	}

	/**
	 * Run one fetch-build-publish cycle on the calling thread.
	 */
	public CycleResult runCycle() {
		if (!running.compareAndSet(false, true)) {
			skippedTriggers.incrementAndGet();
			logger.info("Refresh cycle already running, skipping trigger");
			return CycleResult.SKIPPED;
		}
		return runClaimedCycle();
	}

	// caller holds the running flag
	private CycleResult runClaimedCycle() {
		long start = System.nanoTime();
		try {
			state = RefreshState.FETCHING;
			List<Message> messages = fetchWithTimeout();

			state = RefreshState.BUILDING;
			IndexSnapshot snapshot = builder.build(messages);

			state = RefreshState.PUBLISHING;
			IndexSnapshot previous = snapshots.publish(snapshot);

			successfulCycles.incrementAndGet();
			lastOutcome = outcome(RefreshState.IDLE, clock.instant(), lastOutcome.lastFailure(), lastOutcome.lastError());
			logger.info("Published index generation {} ({} messages, previous generation {}) in {} ms",
					snapshot.generation(), snapshot.size(),
					previous == null ? "none" : previous.generation(),
					(System.nanoTime() - start) / 1_000_000);
			return CycleResult.PUBLISHED;

		} catch (UpstreamUnavailableException e) {
			fail(e.getMessage());
			logger.warn("Refresh cycle failed, keeping current index: {}", e.getMessage());
			return CycleResult.FAILED;

		} catch (RuntimeException e) {
			fail(e.toString());
			logger.error("Refresh cycle failed unexpectedly, keeping current index", e);
			return CycleResult.FAILED;

		} finally {
			state = RefreshState.IDLE;
			running.set(false);
		}
	}

	private static void guarded(Supplier<CycleResult> cycle) {
		try {
			cycle.get();
		} catch (Throwable t) {
			// an escaping throwable would cancel the schedule
			logger.error("Unexpected error in refresh schedule", t);
		}
	}

	private List<Message> fetchWithTimeout() throws UpstreamUnavailableException {
		Future<List<Message>> future = fetchExecutor.submit(fetcher::fetchAll);
		try {
			return future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);

		} catch (TimeoutException e) {
			future.cancel(true);
			throw new UpstreamUnavailableException("Fetch timed out after " + fetchTimeout.toMillis() + " ms", e);

		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new UpstreamUnavailableException("Interrupted while waiting for fetch", e);

		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof UpstreamUnavailableException unavailable) {
				throw unavailable;
			}
			throw new UpstreamUnavailableException("Fetch failed: " + cause, cause);
		}
	}

	private void fail(String message) {
		state = RefreshState.FAILED;
		failedCycles.incrementAndGet();
		lastOutcome = outcome(RefreshState.FAILED, lastOutcome.lastSuccess(), clock.instant(), message);
	}

	private RefreshStatus outcome(RefreshState outcomeState, Instant success, Instant failure,
								  String error) {
		return new RefreshStatus(outcomeState, success, failure, error,
				successfulCycles.get(), failedCycles.get(), skippedTriggers.get());
	}

	/**
	 * Current phase plus the outcome of the most recent cycle.
	 */
	public RefreshStatus getStatus() {
		RefreshStatus last = lastOutcome;
		return new RefreshStatus(state, last.lastSuccess(), last.lastFailure(), last.lastError(),
				successfulCycles.get(), failedCycles.get(), skippedTriggers.get());
	}

	public boolean isRunning() {
		return running.get();
	}

	/**
	 * Stop scheduling and wait briefly for a running cycle.
	 */
	public void stop() {
		scheduler.shutdown();
		try {
			if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
				scheduler.shutdownNow();
			}
		} catch (InterruptedException e) {
			scheduler.shutdownNow();
			Thread.currentThread().interrupt();
		}
		fetchExecutor.shutdownNow();
		logger.info("Index refresher stopped");
	}

	private static ThreadFactory namedDaemon(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	public enum CycleResult {
		PUBLISHED,
		FAILED,
		SKIPPED
	}
}
