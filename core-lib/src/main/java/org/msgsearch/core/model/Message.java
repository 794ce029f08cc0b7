package org.msgsearch.core.model;

import org.jetbrains.annotations.NotNull;

/**
 * A single upstream message. Only {@code id} is required to be non-null once the message is indexed.
 */
public record Message(
        String id,
        String userId,
        String userName,
        String timestamp,
        String text
) {

    /**
     * Text that is tokenized for this message: author name followed by the message body.
     */
    public String searchableText() {
        if (userName == null || userName.isEmpty()) {
            return text == null ? "" : text;
        }
        if (text == null || text.isEmpty()) {
            return userName;
        }
        return userName + " " + text;
    }

    public Message withId(String newId) {
        return new Message(newId, userId, userName, timestamp, text);
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("Message{id='%s', user='%s', ts='%s', text='%s'}",
                id, userName, timestamp, text);
    }
}
