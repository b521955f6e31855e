package org.chatvault.archive.chunk;

import org.chatvault.archive.chunk.state.State;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;

/**
 * Folds chunks into a {@link State}. Shared by the recorder (as it writes) and the player
 * (on a full scan), so both produce the same ledger for the same log.
 */
final class StateCollector implements ChunkConsumer {

    private final State state;

    StateCollector(State state) {
        this.state = state;
    }

    @Override
    public void accept(Chunk chunk) {
        if (chunk == null || chunk.type() == null) {
            return;
        }
        switch (chunk.type()) {
            case MESSAGES -> {
                for (Message m : chunk.messages()) {
                    state.addMessage(chunk.channelId(), m.timestamp());
                }
            }
            case THREAD_MESSAGES -> {
                String threadTs = chunk.parent() == null ? chunk.threadTs() : chunk.parent().threadTimestamp();
                for (Message m : chunk.messages()) {
                    state.addThread(chunk.channelId(), threadTs, m.timestamp());
                }
            }
            case FILES -> {
                // whether the file was downloaded is not known from the log
                for (SlackFile f : chunk.files()) {
                    state.addFile(chunk.channelId(), f.id(), "");
                }
            }
            default -> {
            }
        }
    }

    State state() {
        return state;
    }
}
