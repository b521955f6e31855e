package org.chatvault.archive.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class RecorderTest {

    @TempDir
    Path tempDir;

    @Test
    void returnsOffsetOfEachRecord() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Recorder recorder = new Recorder(out, "log", ChunkLogFixture.FIXED_CLOCK)) {
            long first = recorder.record(Chunk.messages("C1", 0, false, ChunkLogFixture.page(1, 2)));
            long second = recorder.record(Chunk.messages("C1", 0, true, ChunkLogFixture.page(3, 1)));

            assertThat(first).isZero();
            assertThat(second).isEqualTo(out.toByteArray().length - lineLength(out, 1));
            assertThat(recorder.recordsWritten()).isEqualTo(2);
            assertThat(recorder.bytesWritten()).isEqualTo(out.size());
        }
        assertThat(out.toString(StandardCharsets.UTF_8).split("\n")).hasSize(2);
    }

    private static int lineLength(ByteArrayOutputStream out, int line) {
        return (out.toString(StandardCharsets.UTF_8).split("\n")[line] + "\n").getBytes(StandardCharsets.UTF_8).length;
    }

    @Test
    void stampsCaptureTimeInEpochNanos() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Recorder recorder = new Recorder(out, "log", ChunkLogFixture.FIXED_CLOCK)) {
            recorder.record(Chunk.channelInfo(Channel.of("C1", "general")));
        }
        long expected = ChunkLogFixture.FIXED_CLOCK.instant().getEpochSecond() * 1_000_000_000L;
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"ts\":" + expected);
    }

    @Test
    void rejectsUnaddressableChunkWithoutWriting() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Recorder recorder = new Recorder(out)) {
            Chunk orphan = new Chunk(ChunkType.FILES, 0, "C1", 0, null, false, 0,
                null, null, null, null, List.of(SlackFile.of("F1", "a")), null, null, null, null, null);
            assertThatThrownBy(() -> recorder.record(orphan)).isInstanceOf(UnsupportedAddressException.class);
            assertThat(recorder.recordsWritten()).isZero();
        }
        assertThat(out.size()).isZero();
    }

    @Test
    void recordAfterCloseFails() throws IOException {
        Recorder recorder = new Recorder(new ByteArrayOutputStream());
        recorder.close();
        recorder.close();

        assertThatThrownBy(() -> recorder.record(Chunk.users(List.of())))
            .isInstanceOf(RecorderClosedException.class);
    }

    @Test
    void failedWriteAbortsTheRecorder() throws IOException {
        OutputStream out = mock(OutputStream.class);
        doThrow(new IOException("disk full")).when(out).write(any(byte[].class));

        Recorder recorder = new Recorder(out);
        assertThatThrownBy(() -> recorder.record(Chunk.users(List.of())))
            .isInstanceOf(IOException.class)
            .hasMessage("disk full");
        assertThatThrownBy(() -> recorder.record(Chunk.users(List.of())))
            .isInstanceOf(RecorderClosedException.class)
            .hasCauseInstanceOf(IOException.class);

        verify(out, times(1)).write(any(byte[].class));
        assertThat(recorder.recordsWritten()).isZero();
    }

    @Test
    void eachRecordIsASingleWrite() throws IOException {
        OutputStream out = mock(OutputStream.class);
        try (Recorder recorder = new Recorder(out)) {
            recorder.record(Chunk.messages("C1", 0, true, ChunkLogFixture.page(1, 3)));
            recorder.record(Chunk.users(List.of()));
        }
        verify(out, times(2)).write(any(byte[].class));
        verify(out, never()).write(any(byte[].class), org.mockito.ArgumentMatchers.anyInt(),
            org.mockito.ArgumentMatchers.anyInt());
        verify(out).close();
    }

    @Test
    void tracksStateOfRecordedChunks() throws IOException {
        Message root = Message.threadRoot("U1", "10.000001", "root", 1)
            .withFiles(List.of(SlackFile.of("F9", "doc.pdf")));
        try (Recorder recorder = new Recorder(new ByteArrayOutputStream(), "log.jsonl", ChunkLogFixture.FIXED_CLOCK)) {
            recorder.messages("C1", 1, true, List.of(root));
            recorder.threadMessages("C1", root, true, List.of(Message.reply("U2", "11.000001", "10.000001", "re")));
            recorder.files(Channel.of("C1", "general"), root, root.files());

            assertThat(recorder.state().getChunkFilename()).isEqualTo("log.jsonl");
            assertThat(recorder.state().messages("C1")).containsExactly("10.000001");
            assertThat(recorder.state().threadMessages("C1", "10.000001")).containsExactly("11.000001");
            assertThat(recorder.state().hasFile("C1", "F9")).isTrue();
        }
    }

    @Test
    void createTruncatesExistingLog() throws IOException {
        Path log = tempDir.resolve("nested/out.jsonl");
        Files.createDirectories(log.getParent());
        Files.writeString(log, "stale content that is longer than nothing\n");

        try (Recorder recorder = Recorder.create(log)) {
            recorder.users(List.of());
        }
        assertThat(Files.readAllLines(log)).hasSize(1).allMatch(line -> line.startsWith("{") && line.contains("\"t\":3"));
    }
}
