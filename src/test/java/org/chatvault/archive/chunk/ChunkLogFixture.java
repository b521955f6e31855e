package org.chatvault.archive.chunk;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.chatvault.archive.model.Message;

/**
 * Builds small chunk logs for tests.
 */
public final class ChunkLogFixture {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    private ChunkLogFixture() {
    }

    /**
     * Records the chunks into {@code file} and returns their offsets.
     */
    public static List<Long> write(Path file, Chunk... chunks) throws IOException {
        List<Long> offsets = new ArrayList<>();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Recorder recorder = new Recorder(bytes, file.getFileName().toString(), FIXED_CLOCK)) {
            for (Chunk chunk : chunks) {
                offsets.add(recorder.record(chunk));
            }
        }
        Files.write(file, bytes.toByteArray());
        return offsets;
    }

    /**
     * A page of {@code size} plain messages with timestamps {@code <first>.000001},
     * {@code <first+1>.000001} and so on.
     */
    public static List<Message> page(int first, int size) {
        List<Message> page = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            page.add(Message.of("U1", (first + i) + ".000001", "message " + (first + i)));
        }
        return page;
    }

    /**
     * Scenario log: channel C1 with pages of 5, 3 and 2 messages.
     */
    public static Chunk[] threePages() {
        return new Chunk[] {
            Chunk.messages("C1", 0, false, page(1, 5)),
            Chunk.messages("C1", 0, false, page(6, 3)),
            Chunk.messages("C1", 0, true, page(9, 2))
        };
    }
}
