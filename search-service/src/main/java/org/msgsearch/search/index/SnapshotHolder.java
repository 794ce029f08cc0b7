package org.msgsearch.search.index;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link IndexSnapshot}. Publishing is a single reference swap; readers take the current
 * reference once per query and keep using it even if a newer snapshot is published meanwhile.
 */
public class SnapshotHolder {
	private final AtomicReference<IndexSnapshot> active = new AtomicReference<>();

	/**
	 * The active snapshot, or empty before the first publish.
	 */
	public Optional<IndexSnapshot> current() {
		return Optional.ofNullable(active.get());
	}

	/**
	 * Make the snapshot active.
	 *
	 * @return the snapshot it replaced, or {@code null} on first publish
	 */
	public IndexSnapshot publish(IndexSnapshot snapshot) {
		if (snapshot == null) {
			throw new IllegalArgumentException("snapshot must not be null");
		}
		return active.getAndSet(snapshot);
	}

	public boolean isReady() {
		return active.get() != null;
	}
}
