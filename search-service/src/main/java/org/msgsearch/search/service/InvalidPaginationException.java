package org.msgsearch.search.service;

/**
 * Thrown when a search asks for a page or page size below 1.
 */
public class InvalidPaginationException extends IllegalArgumentException {
	public InvalidPaginationException(String message) {
		super(message);
	}
}
