package org.chatvault.archive.stream;

import java.io.IOException;

/**
 * Source of conversation data: streams one channel into a processor, page by page, in the
 * order the pages would be fetched from the remote service.
 */
@FunctionalInterface
public interface ConversationStreamer {

    /**
     * Streams the channel.
     *
     * @param channelId the channel to stream
     * @param processor receiver of the pages
     * @throws IOException if the source cannot be read or the processor fails
     */
    void stream(String channelId, ConversationProcessor processor) throws IOException;
}
