package org.msgsearch.search.upstream;

import org.msgsearch.core.model.Message;

import java.util.List;

public interface MessageFetcher {
	/**
	 * Fetch the complete current set of messages from upstream.
	 * @return all messages, in upstream order
	 * @throws UpstreamUnavailableException if the set could not be fetched completely
	 */
	List<Message> fetchAll() throws UpstreamUnavailableException;
}
