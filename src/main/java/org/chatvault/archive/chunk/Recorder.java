package org.chatvault.archive.chunk;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.chatvault.archive.chunk.state.State;
import org.chatvault.archive.model.Bookmark;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;
import org.chatvault.archive.model.StarredItem;
import org.chatvault.archive.model.User;
import org.chatvault.archive.model.WorkspaceInfo;
import org.chatvault.archive.stream.ConversationProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends chunks to a log, one newline-terminated JSON record per call.
 * <p>
 * Every record is encoded completely before anything is written, and handed to the sink in a
 * single write. If a write fails the recorder refuses further appends: the log may end in a
 * partial record and must not grow past it. After {@link #close()} the log can be decoded
 * record by record from offset 0.
 * <p>
 * The recorder keeps the {@link State} of what it wrote, so a capture run can save the state
 * without scanning the log again.
 * <p>
 * <strong>Thread Safety:</strong> appends are synchronized; concurrent callers get their
 * records written whole, in lock order.
 */
public class Recorder implements ConversationProcessor, Closeable {

    private static final Logger log = LoggerFactory.getLogger(Recorder.class);

    private final OutputStream out;
    private final Clock clock;
    private final StateCollector collector;

    private long bytesWritten;
    private long recordsWritten;
    private boolean closed;
    private IOException failure;

    /**
     * Creates a recorder writing to {@code out}, with an unnamed state.
     */
    public Recorder(OutputStream out) {
        this(out, "", Clock.systemUTC());
    }

    /**
     * @param out   the sink; the recorder takes ownership and closes it
     * @param name  label for the state, usually the log file name
     * @param clock source of capture timestamps
     */
    public Recorder(OutputStream out, String name, Clock clock) {
        this.out = out;
        this.clock = clock;
        this.collector = new StateCollector(new State(name));
    }

    /**
     * Creates a new log file, replacing an existing one.
     *
     * @param path the log file
     * @return a recorder whose state is labelled with the file name
     * @throws IOException if the file cannot be created
     */
    public static Recorder create(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(absolute,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
        log.info("Recording to {}", absolute);
        return new Recorder(out, absolute.getFileName().toString(), Clock.systemUTC());
    }

    /**
     * Stamps the chunk with the current time and appends it.
     *
     * @param chunk the chunk to append
     * @return byte offset at which the record starts
     * @throws UnsupportedAddressException if the chunk cannot be addressed; nothing is written
     * @throws RecorderClosedException     if the recorder was closed or a previous write failed
     * @throws IOException                 if the write fails
     */
    public synchronized long record(Chunk chunk) throws IOException {
        if (closed) {
            throw new RecorderClosedException("recorder is closed");
        }
        if (failure != null) {
            throw new RecorderClosedException("recorder aborted after a failed write", failure);
        }
        GroupId id = chunk.groupId();
        Chunk stamped = chunk.withTimestamp(epochNanos(clock.instant()));
        byte[] record = ChunkCodec.encode(stamped);

        long offset = bytesWritten;
        try {
            out.write(record);
        } catch (IOException e) {
            failure = e;
            log.error("Failed to write {} chunk at offset {}", id, offset);
            throw e;
        }
        bytesWritten += record.length;
        recordsWritten++;
        collector.accept(stamped);
        log.debug("Recorded {} at offset {} ({} bytes)", stamped, offset, record.length);
        return offset;
    }

    private static long epochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    @Override
    public void messages(String channelId, int numThreads, boolean isLast, List<Message> messages) throws IOException {
        record(Chunk.messages(channelId, numThreads, isLast, messages));
    }

    @Override
    public void threadMessages(String channelId, Message parent, boolean isLast, List<Message> replies)
            throws IOException {
        record(Chunk.threadMessages(channelId, parent, isLast, replies));
    }

    @Override
    public void files(Channel channel, Message parent, List<SlackFile> files) throws IOException {
        record(Chunk.files(channel, parent, files));
    }

    @Override
    public void users(List<User> users) throws IOException {
        record(Chunk.users(users));
    }

    @Override
    public void channels(List<Channel> channels) throws IOException {
        record(Chunk.channels(channels));
    }

    @Override
    public void channelInfo(Channel channel) throws IOException {
        record(Chunk.channelInfo(channel));
    }

    @Override
    public void channelUsers(String channelId, List<String> userIds) throws IOException {
        record(Chunk.channelUsers(channelId, userIds));
    }

    @Override
    public void workspaceInfo(WorkspaceInfo info) throws IOException {
        record(Chunk.workspaceInfo(info));
    }

    @Override
    public void starredItems(List<StarredItem> items) throws IOException {
        record(Chunk.starredItems(items));
    }

    @Override
    public void bookmarks(String channelId, List<Bookmark> bookmarks) throws IOException {
        record(Chunk.bookmarks(channelId, bookmarks));
    }

    /**
     * Flushes written records to the sink.
     */
    public synchronized void flush() throws IOException {
        if (!closed) {
            out.flush();
        }
    }

    /**
     * @return state of everything recorded so far
     */
    public synchronized State state() {
        return collector.state();
    }

    public synchronized long bytesWritten() {
        return bytesWritten;
    }

    public synchronized long recordsWritten() {
        return recordsWritten;
    }

    /**
     * Flushes and closes the sink. Closing twice is a no-op.
     */
    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.flush();
        } finally {
            out.close();
        }
        log.info("Recorder closed: {} records, {} bytes", recordsWritten, bytesWritten);
    }
}
