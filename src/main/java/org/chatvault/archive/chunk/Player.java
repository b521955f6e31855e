package org.chatvault.archive.chunk;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.chatvault.archive.chunk.state.State;
import org.chatvault.archive.model.Bookmark;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;
import org.chatvault.archive.model.StarredItem;
import org.chatvault.archive.model.User;
import org.chatvault.archive.model.WorkspaceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;

/**
 * Indexed random-access reader over one chunk log.
 * <p>
 * The player keeps a cursor per {@link GroupId}: each {@link #next(GroupId)} returns the next
 * unread chunk of that key, in capture order, so paginated requests are answered page by page
 * as they were captured. It also supports draining a key completely and scanning the whole log.
 * <p>
 * Cursor states per key: unseen, partially consumed, exhausted. Exhausted is terminal until
 * {@link #reset()}.
 * <p>
 * <strong>Thread Safety:</strong> all methods are thread-safe. The channel position is shared
 * by every read, so "seek then decode" runs as one step under the write lock, as does every
 * cursor mutation and the full scan. Cursor queries take the read lock. Reads are therefore
 * serialized; the index itself is immutable.
 * <p>
 * The player owns its channel exclusively: nothing may append to the log while it is open.
 */
public class Player implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Player.class);

    private final SeekableByteChannel channel;
    private final ChunkIndex index;
    private final Map<GroupId, Integer> pointer = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong lastOffset = new AtomicLong();

    /**
     * Indexes the channel and creates a player over it.
     *
     * @param channel the log, positioned at its start. The player takes ownership.
     * @throws IOException if the log cannot be indexed
     */
    public Player(SeekableByteChannel channel) throws IOException {
        this.channel = channel;
        this.index = ChunkIndex.build(channel);
        log.debug("Player ready: {} records in {} groups", index.recordCount(), index.groupCount());
    }

    /**
     * Opens the log file at {@code path} read-only.
     *
     * @param path the log file
     * @return a player labelled with the file name
     * @throws IOException if the file cannot be opened or indexed
     */
    public static Player open(Path path) throws IOException {
        NamedChannel channel = NamedChannel.open(path);
        try {
            return new Player(channel);
        } catch (IOException | RuntimeException e) {
            try {
                channel.close();
            } catch (IOException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw e;
        }
    }

    // ==================== Core access ====================

    /**
     * Returns the next unread chunk of {@code id} and advances its cursor.
     *
     * @param id the group key
     * @return the chunk
     * @throws ChunkNotFoundException  if the log has no chunks for {@code id}
     * @throws ChunkExhaustedException if all chunks for {@code id} were already read
     * @throws ChunkDecodeException    if the record cannot be decoded
     * @throws IOException             if repositioning or reading the channel fails
     */
    public Chunk next(GroupId id) throws IOException, ChunkNotFoundException, ChunkExhaustedException {
        lock.writeLock().lock();
        try {
            List<Long> offsets = index.offsets(id);
            if (offsets == null) {
                throw new ChunkNotFoundException(id);
            }
            int ptr = pointer.getOrDefault(id, 0);
            if (ptr >= offsets.size()) {
                throw new ChunkExhaustedException(id);
            }
            long offset = offsets.get(ptr);
            Chunk chunk = readAt(offset);
            lastOffset.set(offset);
            pointer.put(id, ptr + 1);
            return chunk;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // the decoder cannot seek, a fresh one is created at the target offset
    private Chunk readAt(long offset) throws IOException {
        channel.position(offset);
        InputStream in = Channels.newInputStream(channel);
        try (JsonParser parser = ChunkCodec.parser(in)) {
            long at = ChunkCodec.nextRecord(parser, offset);
            if (at < 0) {
                throw new ChunkDecodeException(offset, new IOException("unexpected end of log"));
            }
            return ChunkCodec.read(parser, offset);
        }
    }

    /**
     * Returns true if {@code id} has unread chunks: it is in the log and its cursor is either
     * unseen or not yet at the end.
     */
    public boolean hasMore(GroupId id) {
        lock.readLock().lock();
        try {
            List<Long> offsets = index.offsets(id);
            if (offsets == null) {
                return false;
            }
            Integer ptr = pointer.get(id);
            if (ptr == null) {
                return true;
            }
            return ptr < offsets.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return byte offset of the record returned by the last {@link #next(GroupId)}
     */
    public long offset() {
        lock.readLock().lock();
        try {
            return lastOffset.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears every cursor and repositions the channel at the start. The index is kept.
     *
     * @throws IOException if the channel cannot be repositioned
     */
    public void reset() throws IOException {
        lock.writeLock().lock();
        try {
            pointer.clear();
            channel.position(0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Reads the whole log in file order, regardless of group, and calls {@code fn} for every
     * chunk. Resets all cursors first and leaves the channel at offset 0.
     *
     * @param fn the callback; an exception from it aborts the scan
     * @throws IOException if a record cannot be read or {@code fn} fails
     */
    public void forEach(ChunkConsumer fn) throws IOException {
        lock.writeLock().lock();
        try {
            reset();
            try {
                InputStream in = Channels.newInputStream(channel);
                try (JsonParser parser = ChunkCodec.parser(in)) {
                    long offset;
                    while ((offset = ChunkCodec.nextRecord(parser, 0)) >= 0) {
                        fn.accept(ChunkCodec.read(parser, offset));
                    }
                }
            } finally {
                channel.position(0);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resets the cursors and concatenates the payloads of every chunk of {@code id}.
     *
     * @param id      the group key
     * @param payload projection of the wanted payload
     * @return the payloads in file order
     * @throws ChunkNotFoundException if the log has no chunks for {@code id}
     * @throws IOException            if a record cannot be read
     */
    public <T> List<T> drainAll(GroupId id, Function<Chunk, List<T>> payload)
            throws IOException, ChunkNotFoundException {
        reset();
        List<T> result = new ArrayList<>();
        while (true) {
            try {
                result.addAll(payload.apply(next(id)));
            } catch (ChunkExhaustedException e) {
                return result;
            }
        }
    }

    // ==================== Typed accessors ====================

    /**
     * @return the next page of messages of the channel
     */
    public List<Message> messages(String channelId) throws IOException, ChunkLookupException {
        return next(GroupId.channel(channelId)).messages();
    }

    /**
     * @return the next page of replies of the thread
     */
    public List<Message> threadMessages(String channelId, String threadTs) throws IOException, ChunkLookupException {
        return next(GroupId.thread(channelId, threadTs)).messages();
    }

    /**
     * @return the next batch of files attached to the message {@code parentTs} of the channel
     */
    public List<SlackFile> files(String channelId, String parentTs) throws IOException, ChunkLookupException {
        return next(GroupId.file(channelId, parentTs)).files();
    }

    public List<User> users() throws IOException, ChunkLookupException {
        return next(GroupId.USERS).users();
    }

    public List<Channel> channels() throws IOException, ChunkLookupException {
        return next(GroupId.CHANNELS).channels();
    }

    /**
     * @return the next recorded channel info of the channel
     */
    public Channel channelInfo(String channelId) throws IOException, ChunkLookupException {
        return next(GroupId.channelInfo(channelId)).channel();
    }

    public List<String> channelUsers(String channelId) throws IOException, ChunkLookupException {
        return next(GroupId.channelUsers(channelId)).channelUsers();
    }

    public WorkspaceInfo workspaceInfo() throws IOException, ChunkLookupException {
        return next(GroupId.WORKSPACE_INFO).workspaceInfo();
    }

    public List<StarredItem> starredItems() throws IOException, ChunkLookupException {
        return next(GroupId.STARRED_ITEMS).starredItems();
    }

    public List<Bookmark> bookmarks(String channelId) throws IOException, ChunkLookupException {
        return next(GroupId.bookmarks(channelId)).bookmarks();
    }

    public boolean hasMoreMessages(String channelId) {
        return hasMore(GroupId.channel(channelId));
    }

    public boolean hasMoreThreads(String channelId, String threadTs) {
        return hasMore(GroupId.thread(channelId, threadTs));
    }

    public boolean hasMoreChannels() {
        return hasMore(GroupId.CHANNELS);
    }

    /**
     * @return true if there is an unread user chunk
     */
    public boolean hasUsers() {
        return hasMore(GroupId.USERS);
    }

    public boolean hasChannels() {
        return hasMore(GroupId.CHANNELS);
    }

    // ==================== Bulk extraction ====================

    public List<Message> allMessages(String channelId) throws IOException, ChunkNotFoundException {
        return drainAll(GroupId.channel(channelId), Chunk::messages);
    }

    public List<Message> allThreadMessages(String channelId, String threadTs)
            throws IOException, ChunkNotFoundException {
        return drainAll(GroupId.thread(channelId, threadTs), Chunk::messages);
    }

    public List<User> allUsers() throws IOException, ChunkNotFoundException {
        return drainAll(GroupId.USERS, Chunk::users);
    }

    public List<Channel> allChannels() throws IOException, ChunkNotFoundException {
        return drainAll(GroupId.CHANNELS, Chunk::channels);
    }

    /**
     * @return IDs of all channels with recorded messages, sorted
     */
    public List<String> listKnownChannelIds() {
        List<String> ids = new ArrayList<>();
        for (GroupId id : index.groupIds()) {
            if (id.isChannel()) {
                ids.add(id.value());
            }
        }
        ids.sort(null);
        return ids;
    }

    /**
     * Builds the state of the log with a full scan. Files are listed with an empty path:
     * the log does not tell whether they were downloaded.
     *
     * @return the state, labelled with the file name if the channel exposes one
     * @throws IOException if the log cannot be read
     */
    public State state() throws IOException {
        String name = "";
        if (channel instanceof NamedSource) {
            Path fileName = Paths.get(((NamedSource) channel).name()).getFileName();
            name = fileName == null ? "" : fileName.toString();
        }
        StateCollector collector = new StateCollector(new State(name));
        forEach(collector);
        return collector.state();
    }

    /**
     * @return the index of the log
     */
    public ChunkIndex index() {
        return index;
    }

    @Override
    public void close() throws IOException {
        lock.writeLock().lock();
        try {
            channel.close();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
