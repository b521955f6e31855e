package org.chatvault.cli.commands;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.chatvault.archive.chunk.Player;
import org.chatvault.archive.chunk.Recorder;
import org.chatvault.archive.chunk.state.State;
import org.chatvault.archive.stream.ArchiveStreamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Re-records channels from an existing log into a new one and saves its state artifact.
 */
@Command(
    name = "stream",
    mixinStandardHelpOptions = true,
    description = "Stream channels from an archived log into a new chunk log"
)
public class RecordStreamSubcommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RecordStreamSubcommand.class);

    @Option(
        names = {"-s", "--source"},
        required = true,
        description = "Chunk log to read the conversations from"
    )
    private Path source;

    @Option(
        names = {"-o", "--output"},
        description = "Output chunk log (default: standard output)"
    )
    private Path output;

    @Parameters(
        arity = "0..*",
        paramLabel = "CHANNEL",
        description = "Channel IDs to stream (default: every channel in the source)"
    )
    private List<String> channels = new ArrayList<>();

    @ParentCommand
    private RecordCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String stateSuffix;
        try {
            final Config config = parent.getParent().getConfig();
            stateSuffix = config.getString("chatvault.record.state-suffix");
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (Player player = Player.open(source)) {
            final ArchiveStreamer streamer = new ArchiveStreamer(player);
            final List<String> ids = channels.isEmpty() ? player.listKnownChannelIds() : channels;

            final State state;
            try (Recorder recorder = openRecorder()) {
                streamer.streamDirectory(recorder);
                for (String id : ids) {
                    streamer.stream(id, recorder);
                }
                recorder.flush();
                state = recorder.state();
                log.info("Recorded {} channels, {} records, {} bytes",
                    ids.size(), recorder.recordsWritten(), recorder.bytesWritten());
            }

            if (output != null) {
                final Path statePath = output.resolveSibling(output.getFileName() + stateSuffix);
                state.save(statePath);
                out.println("Recorded " + ids.size() + " channel(s) to " + output);
                out.println("State saved to " + statePath);
            }
            return 0;
        } catch (IOException e) {
            log.debug("record stream failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Recorder openRecorder() throws IOException {
        if (output != null) {
            return Recorder.create(output);
        }
        // closing the recorder must leave standard output open
        final OutputStream stdout = new FilterOutputStream(System.out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
        return new Recorder(stdout);
    }
}
