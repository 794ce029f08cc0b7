package org.msgsearch.search.refresh;

import java.time.Instant;

/**
 * Point-in-time view of the refresher.
 *
 * @param lastSuccess end of the last published cycle, {@code null} if none yet
 * @param lastFailure end of the last failed cycle, {@code null} if none yet
 * @param lastError message of the last failure, {@code null} if none yet
 */
public record RefreshStatus(
		RefreshState state,
		Instant lastSuccess,
		Instant lastFailure,
		String lastError,
		long successfulCycles,
		long failedCycles,
		long skippedTriggers
) {}
