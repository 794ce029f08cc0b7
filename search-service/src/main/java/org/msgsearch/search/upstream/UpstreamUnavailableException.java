package org.msgsearch.search.upstream;

import java.io.IOException;

/**
 * Indicates the messages API could not deliver a complete, well-formed record set.
 */
public class UpstreamUnavailableException extends IOException {
	public UpstreamUnavailableException(String message) {
		super(message);
	}

	public UpstreamUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
