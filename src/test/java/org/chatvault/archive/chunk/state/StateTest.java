package org.chatvault.archive.chunk.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.chatvault.archive.chunk.Chunk;
import org.chatvault.archive.chunk.ChunkLogFixture;
import org.chatvault.archive.chunk.Player;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class StateTest {

    @TempDir
    Path tempDir;

    @Test
    void ledgerFromLogListsMessagesAndFilesWithUnknownPath() throws IOException {
        Message owner = Message.of("U1", "2.0", "see attachment").withFiles(List.of(SlackFile.of("F1", "a.png")));
        Path log = tempDir.resolve("c1.jsonl");
        ChunkLogFixture.write(log,
            Chunk.messages("C1", 0, false, List.of(Message.of("U1", "1.0", "one"))),
            Chunk.messages("C1", 0, true, List.of(owner)),
            Chunk.files(Channel.of("C1", "general"), owner, owner.files()));

        State state;
        try (Player player = Player.open(log)) {
            state = player.state();
        }

        assertThat(state.channelIds()).containsExactly("C1");
        assertThat(state.messages("C1")).containsExactly("1.0", "2.0");
        assertThat(state.hasFile("C1", "F1")).isTrue();
        assertThat(state.filePath("C1", "F1")).isEmpty();
    }

    @Test
    void recordsWithoutTimestampOrFileIdAreListedUnderEmptyKey() throws Exception {
        Path log = tempDir.resolve("tombstone.jsonl");
        Files.writeString(log,
            "{\"t\":0,\"ts\":1,\"id\":\"C1\",\"m\":[{\"type\":\"message\",\"subtype\":\"tombstone\"}]}\n"
                + "{\"t\":2,\"ts\":2,\"id\":\"C1\",\"p\":{\"ts\":\"5.0\"},\"f\":[{\"name\":\"a.png\"}]}\n");

        State state;
        try (Player player = Player.open(log)) {
            assertThat(player.messages("C1")).hasSize(1);
            state = player.state();
        }

        assertThat(state.messages("C1")).containsExactly("");
        assertThat(state.hasFile("C1", "")).isTrue();
    }

    @Test
    void threadRepliesAreKeyedByParent() {
        State state = new State("log");
        state.addThread("C1", "10.0", "10.5");
        state.addThread("C1", "10.0", "10.2");

        assertThat(state.hasThread("C1", "10.0", "10.2")).isTrue();
        assertThat(state.hasThread("C1", "11.0", "10.2")).isFalse();
        assertThat(state.threadMessages("C1", "10.0")).containsExactly("10.2", "10.5");
        assertThat(state.threadMessages("C9", "10.0")).isEmpty();
    }

    @Test
    void knownFilePathIsNotOverwrittenByPlaceholder() {
        State state = new State("log");
        state.addFile("C1", "F1", "files/F1-a.png");
        state.addFile("C1", "F1", "");

        assertThat(state.filePath("C1", "F1")).isEqualTo("files/F1-a.png");
    }

    @Test
    void saveAndLoad() throws IOException {
        State state = new State("archive.jsonl");
        state.addMessage("C2", "5.000001");
        state.addMessage("C1", "1.000001");
        state.addThread("C1", "1.000001", "1.000002");
        state.addFile("C1", "F1", "");
        Path file = tempDir.resolve("archive.jsonl.state");

        state.save(file);
        State loaded = State.load(file);

        assertThat(loaded.getVersion()).isEqualTo(State.VERSION);
        assertThat(loaded.getChunkFilename()).isEqualTo("archive.jsonl");
        assertThat(loaded.channelIds()).containsExactly("C1", "C2");
        assertThat(loaded.hasThread("C1", "1.000001", "1.000002")).isTrue();
        assertThat(loaded.toJson()).isEqualTo(state.toJson());
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void jsonUsesLedgerFieldNames() {
        State state = new State("archive.jsonl");
        state.addMessage("C1", "1.0");

        assertThat(state.toJson())
            .contains("\"version\": 1", "\"chunk_filename\": \"archive.jsonl\"", "\"channels\"", "\"messages\"");
    }

    @Test
    void loadRejectsOtherVersions() throws IOException {
        Path file = tempDir.resolve("future.state");
        Files.writeString(file, "{\"version\": 2, \"chunk_filename\": \"x\", \"channels\": {}}");

        assertThatThrownBy(() -> State.load(file))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("version 2");
    }

    @Test
    void loadRejectsMalformedJson() throws IOException {
        Path file = tempDir.resolve("bad.state");
        Files.writeString(file, "{\"version\": ");

        assertThatThrownBy(() -> State.load(file)).isInstanceOf(IOException.class);
    }
}
