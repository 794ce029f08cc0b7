package org.msgsearch.core.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercases text and splits it on every run of characters outside {@code [a-z0-9]}.
 *
 * <p>Indexing and query parsing both go through this class so that a query token always
 * matches the postings key it was indexed under.</p>
 */
public final class Tokenizer {
	private static final Pattern SPLIT_PATTERN = Pattern.compile("[^a-z0-9]+");

	private Tokenizer() {}

	/**
	 * Tokenize text, keeping repeated tokens in order of appearance.
	 */
	public static List<String> tokenize(String text) {
		if (text == null || text.isEmpty()) {
			return List.of();
		}

		String[] parts = SPLIT_PATTERN.split(text.toLowerCase(Locale.ROOT));
		List<String> tokens = new ArrayList<>(parts.length);
		for (String part : parts) {
			if (!part.isEmpty()) {
				tokens.add(part);
			}
		}
		return List.copyOf(tokens);
	}

	/**
	 * Distinct tokens of the text, in order of first appearance.
	 */
	public static Set<String> distinctTokens(String text) {
		return new LinkedHashSet<>(tokenize(text));
	}
}
