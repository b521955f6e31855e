package org.chatvault.archive.chunk.state;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Summary of what a chunk log contains: message timestamps per channel, reply timestamps per
 * thread and file IDs per channel.
 * <p>
 * A state is derived data. It is rebuilt from a full scan of the log and can always be thrown
 * away; it is saved next to the log so incremental runs can tell what was already captured
 * without re-reading it. File entries carry the local path the file was downloaded to, which
 * is empty when the state was built from the log alone.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. The state is built by a single scan and
 * read afterwards.
 */
public final class State {

    /** Format version of the saved artifact. */
    public static final int VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(State.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    @SerializedName("version")
    private int version = VERSION;

    @SerializedName("chunk_filename")
    private String chunkFilename;

    @SerializedName("channels")
    private SortedMap<String, ChannelState> channels = new TreeMap<>();

    /**
     * Everything captured for one channel.
     */
    public static final class ChannelState {

        @SerializedName("messages")
        private SortedSet<String> messages = new TreeSet<>();

        @SerializedName("threads")
        private SortedMap<String, SortedSet<String>> threads = new TreeMap<>();

        @SerializedName("files")
        private SortedMap<String, String> files = new TreeMap<>();

        public Set<String> getMessages() {
            return Collections.unmodifiableSet(messages);
        }

        public Map<String, SortedSet<String>> getThreads() {
            return Collections.unmodifiableMap(threads);
        }

        public Map<String, String> getFiles() {
            return Collections.unmodifiableMap(files);
        }
    }

    private State() {
        this("");
    }

    /**
     * Creates an empty state.
     *
     * @param chunkFilename base name of the log the state describes, may be empty
     */
    public State(String chunkFilename) {
        this.chunkFilename = chunkFilename == null ? "" : chunkFilename;
    }

    /**
     * Records a message. A missing timestamp is stored as the empty string.
     */
    public void addMessage(String channelId, String ts) {
        channel(channelId).messages.add(orEmpty(ts));
    }

    public void addThread(String channelId, String threadTs, String ts) {
        channel(channelId).threads.computeIfAbsent(orEmpty(threadTs), k -> new TreeSet<>()).add(orEmpty(ts));
    }

    /**
     * Records a file. An existing non-empty path is kept if {@code path} is empty.
     */
    public void addFile(String channelId, String fileId, String path) {
        channel(channelId).files.merge(orEmpty(fileId), orEmpty(path), (old, add) -> add.isEmpty() ? old : add);
    }

    private ChannelState channel(String channelId) {
        return channels.computeIfAbsent(orEmpty(channelId), k -> new ChannelState());
    }

    // sorted keys reject null
    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    public boolean hasMessage(String channelId, String ts) {
        ChannelState c = channels.get(channelId);
        return c != null && c.messages.contains(ts);
    }

    public boolean hasThread(String channelId, String threadTs, String ts) {
        ChannelState c = channels.get(channelId);
        if (c == null) {
            return false;
        }
        SortedSet<String> replies = c.threads.get(threadTs);
        return replies != null && replies.contains(ts);
    }

    public boolean hasFile(String channelId, String fileId) {
        ChannelState c = channels.get(channelId);
        return c != null && c.files.containsKey(fileId);
    }

    /**
     * @return the local path of the file, empty if unknown, or {@code null} if the file was not captured
     */
    public String filePath(String channelId, String fileId) {
        ChannelState c = channels.get(channelId);
        return c == null ? null : c.files.get(fileId);
    }

    /**
     * @return captured message timestamps of the channel, empty if the channel is unknown
     */
    public Set<String> messages(String channelId) {
        ChannelState c = channels.get(channelId);
        return c == null ? Set.of() : c.getMessages();
    }

    /**
     * @return captured reply timestamps of the thread, empty if the thread is unknown
     */
    public Set<String> threadMessages(String channelId, String threadTs) {
        ChannelState c = channels.get(channelId);
        if (c == null || !c.threads.containsKey(threadTs)) {
            return Set.of();
        }
        return Collections.unmodifiableSet(c.threads.get(threadTs));
    }

    /**
     * @return captured files of the channel mapped to their local path
     */
    public Map<String, String> files(String channelId) {
        ChannelState c = channels.get(channelId);
        return c == null ? Map.of() : c.getFiles();
    }

    public Set<String> channelIds() {
        return Collections.unmodifiableSet(channels.keySet());
    }

    public String getChunkFilename() {
        return chunkFilename;
    }

    public int getVersion() {
        return version;
    }

    /**
     * @return the state as pretty-printed JSON, as written by {@link #save(Path)}
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Writes the state to {@code path}, replacing any previous state atomically.
     *
     * @param path destination file
     * @throws IOException if writing fails
     */
    public void save(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
            GSON.toJson(this, writer);
        }
        try {
            Files.move(tempFile, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
        log.debug("Saved state of '{}' to {}", chunkFilename, absolute);
    }

    /**
     * Reads a state previously written by {@link #save(Path)}.
     *
     * @param path the state file
     * @return the state
     * @throws IOException if the file cannot be read or is not a state
     */
    public static State load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            State state = GSON.fromJson(reader, State.class);
            if (state == null) {
                throw new IOException("empty state file: " + path);
            }
            if (state.version != VERSION) {
                throw new IOException("unsupported state version " + state.version + " in " + path);
            }
            if (state.channels == null) {
                state.channels = new TreeMap<>();
            }
            if (state.chunkFilename == null) {
                state.chunkFilename = "";
            }
            return state;
        } catch (JsonParseException e) {
            throw new IOException("malformed state file: " + path, e);
        }
    }
}
