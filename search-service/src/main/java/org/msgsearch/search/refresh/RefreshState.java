package org.msgsearch.search.refresh;

/**
 * Phases of one refresh cycle. A cycle runs IDLE, FETCHING, BUILDING, PUBLISHING and back to IDLE;
 * a failure in any phase passes through FAILED on the way back to IDLE.
 */
public enum RefreshState {
	IDLE,
	FETCHING,
	BUILDING,
	PUBLISHING,
	FAILED
}
