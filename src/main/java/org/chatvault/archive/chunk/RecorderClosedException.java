package org.chatvault.archive.chunk;

import java.io.IOException;

/**
 * Thrown when a {@link Recorder} is asked to append after it was closed, or after an earlier
 * write failed and left the log in an unknown state.
 */
public class RecorderClosedException extends IOException {

    public RecorderClosedException(String message) {
        super(message);
    }

    public RecorderClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
