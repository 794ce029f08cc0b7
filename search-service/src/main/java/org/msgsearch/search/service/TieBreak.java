package org.msgsearch.search.service;

import org.msgsearch.search.index.IndexSnapshot;

import java.util.Comparator;
import java.util.Locale;

/**
 * Secondary ordering among results with the same number of matching query tokens.
 */
public enum TieBreak {
	/** Identifier in natural string order. */
	ID {
		@Override
		public Comparator<String> comparator(IndexSnapshot snapshot) {
			return Comparator.naturalOrder();
		}
	},
	/** Position in the upstream listing the snapshot was built from. */
	UPSTREAM {
		@Override
		public Comparator<String> comparator(IndexSnapshot snapshot) {
			return Comparator.<String>comparingInt(snapshot::upstreamPosition)
					.thenComparing(Comparator.<String>naturalOrder());
		}
	};

	public abstract Comparator<String> comparator(IndexSnapshot snapshot);

	/**
	 * Parse a configuration value ({@code id} or {@code upstream}, case-insensitive).
	 *
	 * @throws IllegalArgumentException for any other value
	 */
	public static TieBreak fromConfig(String value) {
		return TieBreak.valueOf(value.trim().toUpperCase(Locale.ROOT));
	}
}
