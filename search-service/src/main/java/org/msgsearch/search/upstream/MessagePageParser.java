package org.msgsearch.search.upstream;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.msgsearch.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Normalizes one page of the messages API into a list of {@link Message}s.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>a JSON array of messages</li>
 *   <li>an object with an {@code items}, {@code messages}, {@code data} or {@code results} array and an
 *   optional {@code total}</li>
 *   <li>an object mapping identifiers to message objects</li>
 * </ul></p>
 */
public class MessagePageParser {
	private static final Logger logger = LoggerFactory.getLogger(MessagePageParser.class);

	private static final String[] LIST_KEYS = {"items", "messages", "data", "results"};

	/**
	 * Parse a page body.
	 *
	 * @throws com.google.gson.JsonParseException if the body is not valid JSON
	 * @throws UpstreamUnavailableException if the JSON has none of the accepted shapes
	 */
	public MessagePage parse(String body) throws UpstreamUnavailableException {
		JsonElement root = JsonParser.parseString(body);

		if (root.isJsonArray()) {
			return new MessagePage(readArray(root.getAsJsonArray()), null);
		}
		if (!root.isJsonObject()) {
			throw new UpstreamUnavailableException("Unexpected response shape from messages endpoint: " + shapeOf(root));
		}

		JsonObject object = root.getAsJsonObject();
		for (String key : LIST_KEYS) {
			JsonElement list = object.get(key);
			if (list != null && list.isJsonArray()) {
				return new MessagePage(readArray(list.getAsJsonArray()), readTotal(object));
			}
		}

		return new MessagePage(readIdMapping(object), null);
	}

	private List<Message> readArray(JsonArray array) {
		List<Message> messages = new ArrayList<>(array.size());
		int skipped = 0;
		for (JsonElement element : array) {
			if (element.isJsonObject()) {
				messages.add(readMessage(element.getAsJsonObject(), null));
			} else {
				skipped++;
			}
		}
		if (skipped > 0) {
			logger.warn("Skipped {} non-object entries in messages page", skipped);
		}
		return messages;
	}

	private List<Message> readIdMapping(JsonObject object) throws UpstreamUnavailableException {
		List<Message> messages = new ArrayList<>(object.size());
		for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
			if (!entry.getValue().isJsonObject()) {
				throw new UpstreamUnavailableException(
						"Unexpected response shape from messages endpoint: field '" + entry.getKey() + "' is not a message");
			}
			messages.add(readMessage(entry.getValue().getAsJsonObject(), entry.getKey()));
		}
		return messages;
	}

	private Message readMessage(JsonObject json, String fallbackId) {
		String id = readString(json, "id");
		if (id == null) {
			id = readString(json, "_id");
		}
		if (id == null) {
			id = fallbackId;
		}
		return new Message(
				id,
				readString(json, "user_id"),
				readString(json, "user_name"),
				readString(json, "timestamp"),
				readString(json, "message")
		);
	}

	private static String readString(JsonObject json, String field) {
		JsonElement value = json.get(field);
		if (value == null || !value.isJsonPrimitive()) {
			return null;
		}
		return value.getAsString();
	}

	private static Integer readTotal(JsonObject object) {
		JsonElement total = object.get("total");
		if (total == null || !total.isJsonPrimitive() || !total.getAsJsonPrimitive().isNumber()) {
			return null;
		}
		return total.getAsInt();
	}

	private static String shapeOf(JsonElement element) {
		if (element.isJsonNull()) {
			return "null";
		}
		return element.isJsonPrimitive() ? "primitive" : element.getClass().getSimpleName();
	}

	/**
	 * @param total total number of messages upstream, when the page reports it
	 */
	public record MessagePage(List<Message> items, Integer total) {}
}
