package org.chatvault.archive.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single conversation message as returned by the remote API.
 * <p>
 * Thread roots carry {@code thread_ts == ts}; replies carry the root's {@code ts} in
 * {@code thread_ts}.
 *
 * @param type       Message type, usually {@code "message"}.
 * @param subtype    Optional subtype (e.g. {@code "bot_message"}).
 * @param user       Author user ID.
 * @param botId      Author bot ID, for bot messages.
 * @param text       Message text.
 * @param timestamp  Message timestamp, {@code "<seconds>.<micros>"}.
 * @param threadTimestamp Timestamp of the thread root, if the message belongs to a thread.
 * @param replyCount Number of replies, set on thread roots.
 * @param files      Files attached to the message.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
    @JsonProperty("type") String type,
    @JsonProperty("subtype") String subtype,
    @JsonProperty("user") String user,
    @JsonProperty("bot_id") String botId,
    @JsonProperty("text") String text,
    @JsonProperty("ts") String timestamp,
    @JsonProperty("thread_ts") String threadTimestamp,
    @JsonProperty("reply_count") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int replyCount,
    @JsonProperty("files") List<SlackFile> files
) {

    public Message {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Creates a plain user message.
     */
    public static Message of(String user, String timestamp, String text) {
        return new Message("message", null, user, null, text, timestamp, null, 0, List.of());
    }

    /**
     * Creates a thread root with the given reply count.
     */
    public static Message threadRoot(String user, String timestamp, String text, int replyCount) {
        return new Message("message", null, user, null, text, timestamp, timestamp, replyCount, List.of());
    }

    /**
     * Creates a reply within the thread rooted at {@code threadTimestamp}.
     */
    public static Message reply(String user, String timestamp, String threadTimestamp, String text) {
        return new Message("message", null, user, null, text, timestamp, threadTimestamp, 0, List.of());
    }

    /**
     * Returns a copy of this message with the given attachments.
     */
    public Message withFiles(List<SlackFile> attached) {
        return new Message(type, subtype, user, botId, text, timestamp, threadTimestamp, replyCount, attached);
    }

    /**
     * @return true if this message is the root of a thread with at least one reply.
     */
    @JsonIgnore
    public boolean isThreadParent() {
        return threadTimestamp != null && threadTimestamp.equals(timestamp) && replyCount > 0;
    }
}
