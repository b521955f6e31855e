package org.chatvault.archive.chunk;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;

/**
 * Offsets of every record in a chunk log, grouped by {@link GroupId}.
 * <p>
 * Offsets of a group are kept in file order, which is also capture order. The index is built
 * once by {@link #build(SeekableByteChannel)} and is read-only afterwards, so it may be read
 * concurrently without synchronization.
 */
public final class ChunkIndex {

    private static final Logger log = LoggerFactory.getLogger(ChunkIndex.class);

    private final Map<GroupId, List<Long>> offsets;
    private final int recordCount;

    private ChunkIndex(Map<GroupId, List<Long>> offsets, int recordCount) {
        this.offsets = offsets;
        this.recordCount = recordCount;
    }

    /**
     * Scans the channel from its current position to the end and indexes every record.
     * <p>
     * The scan is all-or-nothing: any decode failure other than a clean end of stream aborts
     * it, a log with a corrupt tail is not indexed partially. On success the channel is
     * repositioned at offset 0.
     *
     * @param channel channel positioned at the start of the log
     * @return the index
     * @throws ChunkDecodeException        if a record cannot be decoded
     * @throws UnsupportedAddressException if a record decodes but cannot be addressed
     * @throws IOException                 if reading or repositioning the channel fails
     */
    public static ChunkIndex build(SeekableByteChannel channel) throws IOException {
        long base = channel.position();
        Map<GroupId, List<Long>> building = new LinkedHashMap<>();
        int count = 0;

        InputStream in = Channels.newInputStream(channel);
        try (JsonParser parser = ChunkCodec.parser(in)) {
            long offset;
            while ((offset = ChunkCodec.nextRecord(parser, base)) >= 0) {
                Chunk chunk = ChunkCodec.read(parser, offset);
                GroupId id;
                try {
                    id = chunk.groupId();
                } catch (UnsupportedAddressException e) {
                    throw new UnsupportedAddressException(e.getMessage() + " (record at offset " + offset + ")", e);
                }
                building.computeIfAbsent(id, k -> new ArrayList<>()).add(offset);
                count++;
            }
        }
        channel.position(0);

        Map<GroupId, List<Long>> frozen = new LinkedHashMap<>();
        building.forEach((id, list) -> frozen.put(id, Collections.unmodifiableList(list)));
        log.debug("Indexed {} records in {} groups", count, frozen.size());
        return new ChunkIndex(Collections.unmodifiableMap(frozen), count);
    }

    /**
     * @return offsets of the group in file order, or {@code null} if the group has no records
     */
    public List<Long> offsets(GroupId id) {
        return offsets.get(id);
    }

    public boolean contains(GroupId id) {
        return offsets.containsKey(id);
    }

    /**
     * @return all group keys, in order of first appearance
     */
    public Set<GroupId> groupIds() {
        return offsets.keySet();
    }

    public int recordCount() {
        return recordCount;
    }

    public int groupCount() {
        return offsets.size();
    }
}
