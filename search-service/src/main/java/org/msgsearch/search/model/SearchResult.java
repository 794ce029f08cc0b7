package org.msgsearch.search.model;

import com.google.gson.annotations.SerializedName;
import org.msgsearch.core.model.Message;

/**
 * A message as returned by the search API, using the upstream field names.
 */
public record SearchResult(
		String id,
		@SerializedName("user_id") String userId,
		@SerializedName("user_name") String userName,
		String timestamp,
		String message
) {
	public static SearchResult fromMessage(Message message) {
		return new SearchResult(
				message.id(),
				message.userId(),
				message.userName(),
				message.timestamp(),
				message.text()
		);
	}
}
