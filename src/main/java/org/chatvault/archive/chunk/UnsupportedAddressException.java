package org.chatvault.archive.chunk;

/**
 * Thrown when a chunk cannot be assigned a {@link GroupId}: its type is missing, or a field
 * its type is addressed by (channel ID, parent timestamp) is absent.
 * <p>
 * This is a RuntimeException because it indicates corrupt input or a caller handing the
 * recorder a chunk that violates its contract; there is nothing to recover.
 */
public class UnsupportedAddressException extends RuntimeException {

    public UnsupportedAddressException(String message) {
        super(message);
    }

    public UnsupportedAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
