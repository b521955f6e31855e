package org.chatvault.archive.chunk;

import java.util.Objects;

/**
 * Key under which chunks of the same logical entity are queued in a chunk log.
 * <p>
 * It may or may not be equal to the ID of the entity: plain channel message chunks use the
 * channel ID itself, every other kind is either one of the static keys below or a
 * {@code prefix:part[:part]} composite.
 */
public final class GroupId implements Comparable<GroupId> {

    /** All users of the workspace; one user list per archive. */
    public static final GroupId USERS = new GroupId("lusr");
    /** The channel list. */
    public static final GroupId CHANNELS = new GroupId("lch");
    /** Starred items of the archiving user. */
    public static final GroupId STARRED_ITEMS = new GroupId("ls");
    /** Workspace identity. */
    public static final GroupId WORKSPACE_INFO = new GroupId("iw");

    static final String THREAD_PREFIX = "t";
    static final String FILE_PREFIX = "f";
    static final String CHANNEL_INFO_PREFIX = "ic";
    static final String CHANNEL_USERS_PREFIX = "lcu";
    static final String BOOKMARKS_PREFIX = "lb";

    private static final char SEPARATOR = ':';
    private static final char CATEGORY_INFO = 'i';
    private static final char CATEGORY_LIST = 'l';

    private final String value;

    private GroupId(String value) {
        this.value = value;
    }

    /**
     * Wraps a raw key, e.g. one read back from a request or the command line.
     */
    public static GroupId of(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Group ID must not be empty");
        }
        switch (value) {
            case "lusr": return USERS;
            case "lch": return CHANNELS;
            case "ls": return STARRED_ITEMS;
            case "iw": return WORKSPACE_INFO;
            default: return new GroupId(value);
        }
    }

    public static GroupId channel(String channelId) {
        return of(channelId);
    }

    public static GroupId thread(String channelId, String threadTimestamp) {
        return composite(THREAD_PREFIX, channelId, threadTimestamp);
    }

    public static GroupId file(String channelId, String parentTimestamp) {
        return composite(FILE_PREFIX, channelId, parentTimestamp);
    }

    public static GroupId channelInfo(String channelId) {
        return composite(CHANNEL_INFO_PREFIX, channelId);
    }

    public static GroupId channelUsers(String channelId) {
        return composite(CHANNEL_USERS_PREFIX, channelId);
    }

    public static GroupId bookmarks(String channelId) {
        return composite(BOOKMARKS_PREFIX, channelId);
    }

    private static GroupId composite(String prefix, String... parts) {
        StringBuilder sb = new StringBuilder(prefix);
        for (String part : parts) {
            sb.append(SEPARATOR).append(part);
        }
        return new GroupId(sb.toString());
    }

    /**
     * @return true for channel info and workspace info keys.
     */
    public boolean isInfo() {
        return value.charAt(0) == CATEGORY_INFO && (this.equals(WORKSPACE_INFO) || value.indexOf(SEPARATOR) > 0);
    }

    /**
     * @return true for list keys: users, channels, starred items, channel members, bookmarks.
     */
    public boolean isList() {
        return value.charAt(0) == CATEGORY_LIST && (isStatic() || value.indexOf(SEPARATOR) > 0);
    }

    /**
     * @return true if this key addresses the message stream of a plain channel.
     */
    public boolean isChannel() {
        return !isStatic() && value.indexOf(SEPARATOR) < 0;
    }

    private boolean isStatic() {
        return this.equals(USERS) || this.equals(CHANNELS)
            || this.equals(STARRED_ITEMS) || this.equals(WORKSPACE_INFO);
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(GroupId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupId)) {
            return false;
        }
        return value.equals(((GroupId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
