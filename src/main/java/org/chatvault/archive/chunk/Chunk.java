package org.chatvault.archive.chunk;

import java.util.List;

import org.chatvault.archive.model.Bookmark;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;
import org.chatvault.archive.model.StarredItem;
import org.chatvault.archive.model.User;
import org.chatvault.archive.model.WorkspaceInfo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recorded API response.
 * <p>
 * The header fields ({@code type}, {@code timestamp}, {@code channelId}, {@code count}) are
 * present on every chunk; which payload field is populated depends on {@link #type()}. Use the
 * per-type factory methods to build chunks, they populate only the payload of that variant.
 * Payload accessors never return {@code null}: absent lists are empty.
 *
 * @param type         Kind of response recorded.
 * @param timestamp    Capture time, epoch nanoseconds. Stamped by the {@link Recorder}.
 * @param channelId    Conversation the chunk belongs to, if any.
 * @param count        Number of messages or files in the chunk.
 * @param threadTs     Thread timestamp, for thread chunks.
 * @param last         True on the terminal chunk of a channel's or thread's pagination.
 * @param numThreads   Threads discovered in a message page.
 * @param channel      Channel metadata (channel info and file chunks).
 * @param channelUsers Member IDs (channel users chunks).
 * @param parent       Thread root or file-owning message (thread and file chunks).
 * @param messages     Messages (message and thread chunks).
 * @param files        Files (file chunks).
 * @param users        Users (user chunks).
 * @param channels     Channels (channel list chunks).
 * @param workspaceInfo Workspace identity (workspace info chunks).
 * @param starredItems Starred items.
 * @param bookmarks    Channel bookmarks.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Chunk(
    @JsonProperty("t") @JsonInclude(JsonInclude.Include.NON_NULL) ChunkType type,
    @JsonProperty("ts") @JsonInclude(JsonInclude.Include.ALWAYS) long timestamp,
    @JsonProperty("id") String channelId,
    @JsonProperty("n") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int count,
    @JsonProperty("r") String threadTs,
    @JsonProperty("l") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean last,
    @JsonProperty("nt") @JsonInclude(JsonInclude.Include.NON_DEFAULT) int numThreads,
    @JsonProperty("ci") Channel channel,
    @JsonProperty("cu") List<String> channelUsers,
    @JsonProperty("p") Message parent,
    @JsonProperty("m") List<Message> messages,
    @JsonProperty("f") List<SlackFile> files,
    @JsonProperty("u") List<User> users,
    @JsonProperty("ch") List<Channel> channels,
    @JsonProperty("w") WorkspaceInfo workspaceInfo,
    @JsonProperty("st") List<StarredItem> starredItems,
    @JsonProperty("b") List<Bookmark> bookmarks
) {

    public Chunk {
        channelUsers = copy(channelUsers);
        messages = copy(messages);
        files = copy(files);
        users = copy(users);
        channels = copy(channels);
        starredItems = copy(starredItems);
        bookmarks = copy(bookmarks);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    // ==================== Factories ====================

    /**
     * A page of channel history.
     */
    public static Chunk messages(String channelId, int numThreads, boolean last, List<Message> messages) {
        return new Chunk(ChunkType.MESSAGES, 0, channelId, messages.size(), null, last, numThreads,
            null, null, null, messages, null, null, null, null, null, null);
    }

    /**
     * A page of thread replies. The thread timestamp is taken from the parent.
     */
    public static Chunk threadMessages(String channelId, Message parent, boolean last, List<Message> messages) {
        return new Chunk(ChunkType.THREAD_MESSAGES, 0, channelId, messages.size(), parent.threadTimestamp(), last, 0,
            null, null, parent, messages, null, null, null, null, null, null);
    }

    /**
     * Files attached to {@code parent} in {@code channel}.
     */
    public static Chunk files(Channel channel, Message parent, List<SlackFile> files) {
        return new Chunk(ChunkType.FILES, 0, channel.id(), files.size(), parent.threadTimestamp(), false, 0,
            channel, null, parent, null, files, null, null, null, null, null);
    }

    public static Chunk users(List<User> users) {
        return new Chunk(ChunkType.USERS, 0, null, 0, null, false, 0,
            null, null, null, null, null, users, null, null, null, null);
    }

    public static Chunk channels(List<Channel> channels) {
        return new Chunk(ChunkType.CHANNELS, 0, null, 0, null, false, 0,
            null, null, null, null, null, null, channels, null, null, null);
    }

    public static Chunk channelInfo(Channel channel) {
        return new Chunk(ChunkType.CHANNEL_INFO, 0, channel.id(), 0, null, false, 0,
            channel, null, null, null, null, null, null, null, null, null);
    }

    public static Chunk channelUsers(String channelId, List<String> userIds) {
        return new Chunk(ChunkType.CHANNEL_USERS, 0, channelId, 0, null, false, 0,
            null, userIds, null, null, null, null, null, null, null, null);
    }

    public static Chunk workspaceInfo(WorkspaceInfo info) {
        return new Chunk(ChunkType.WORKSPACE_INFO, 0, null, 0, null, false, 0,
            null, null, null, null, null, null, null, info, null, null);
    }

    public static Chunk starredItems(List<StarredItem> items) {
        return new Chunk(ChunkType.STARRED_ITEMS, 0, null, 0, null, false, 0,
            null, null, null, null, null, null, null, null, items, null);
    }

    public static Chunk bookmarks(String channelId, List<Bookmark> bookmarks) {
        return new Chunk(ChunkType.BOOKMARKS, 0, channelId, 0, null, false, 0,
            null, null, null, null, null, null, null, null, null, bookmarks);
    }

    /**
     * Returns a copy stamped with the given capture time.
     */
    public Chunk withTimestamp(long epochNanos) {
        return new Chunk(type, epochNanos, channelId, count, threadTs, last, numThreads, channel, channelUsers,
            parent, messages, files, users, channels, workspaceInfo, starredItems, bookmarks);
    }

    // ==================== Addressing ====================

    /**
     * Derives the group key of this chunk. Pure function of type, channel ID and parent.
     *
     * @return the group key
     * @throws UnsupportedAddressException if the type is missing, or a field the type is
     *                                     addressed by is absent
     */
    public GroupId groupId() {
        if (type == null) {
            throw new UnsupportedAddressException("chunk has no type");
        }
        return switch (type) {
            case MESSAGES -> GroupId.channel(requireChannelId());
            case THREAD_MESSAGES -> GroupId.thread(requireChannelId(), requireParentField(parentThreadTs()));
            case FILES -> GroupId.file(requireChannelId(), requireParentField(parentTs()));
            case CHANNEL_INFO -> GroupId.channelInfo(requireChannelId());
            case CHANNEL_USERS -> GroupId.channelUsers(requireChannelId());
            case USERS -> GroupId.USERS;
            case CHANNELS -> GroupId.CHANNELS;
            case WORKSPACE_INFO -> GroupId.WORKSPACE_INFO;
            case STARRED_ITEMS -> GroupId.STARRED_ITEMS;
            case BOOKMARKS -> GroupId.bookmarks(requireChannelId());
        };
    }

    private String requireChannelId() {
        if (channelId == null || channelId.isEmpty()) {
            throw new UnsupportedAddressException(type.displayName() + " chunk has no channel ID");
        }
        return channelId;
    }

    private String requireParentField(String value) {
        if (value == null || value.isEmpty()) {
            throw new UnsupportedAddressException(type.displayName() + " chunk for channel " + channelId
                + " has no parent timestamp");
        }
        return value;
    }

    private String parentThreadTs() {
        return parent == null ? null : parent.threadTimestamp();
    }

    private String parentTs() {
        return parent == null ? null : parent.timestamp();
    }

    /**
     * Returns the message timestamps of this chunk as epoch microseconds.
     *
     * @return one entry per message, in chunk order
     * @throws UnsupportedAddressException if the chunk does not carry messages
     * @throws IllegalArgumentException    if a message has a malformed timestamp
     */
    public long[] timestamps() {
        if (type != ChunkType.MESSAGES && type != ChunkType.THREAD_MESSAGES) {
            throw new UnsupportedAddressException("timestamps are not available for "
                + (type == null ? "untyped" : type.displayName()) + " chunks");
        }
        long[] result = new long[messages.size()];
        for (int i = 0; i < messages.size(); i++) {
            result[i] = Timestamps.toMicros(messages.get(i).timestamp());
        }
        return result;
    }

    @Override
    public String toString() {
        return (type == null ? "<untyped>" : type.displayName()) + ": " + groupIdOrPlaceholder();
    }

    private String groupIdOrPlaceholder() {
        try {
            return groupId().value();
        } catch (UnsupportedAddressException e) {
            return "<unaddressable>";
        }
    }
}
