package org.chatvault.archive.stream;

import java.io.IOException;
import java.util.List;

import org.chatvault.archive.chunk.Chunk;
import org.chatvault.archive.chunk.ChunkLookupException;
import org.chatvault.archive.chunk.ChunkNotFoundException;
import org.chatvault.archive.chunk.GroupId;
import org.chatvault.archive.chunk.Player;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams channels out of an existing chunk log instead of the network.
 * <p>
 * For each channel the pages are emitted in capture order: channel info, members, then every
 * history page followed by the threads and files of the messages on that page, and finally
 * bookmarks. Feeding a {@link org.chatvault.archive.chunk.Recorder} extracts the channel into
 * a new log with the same grouping.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. Streaming resets the cursors of the player.
 */
public class ArchiveStreamer implements ConversationStreamer {

    private static final Logger log = LoggerFactory.getLogger(ArchiveStreamer.class);

    private final Player player;

    public ArchiveStreamer(Player player) {
        this.player = player;
    }

    /**
     * @throws IOException if the channel has no recorded messages, or the log cannot be read
     */
    @Override
    public void stream(String channelId, ConversationProcessor processor) throws IOException {
        GroupId history = GroupId.channel(channelId);
        if (!player.index().contains(history)) {
            throw new IOException("channel not found in archive: " + channelId, new ChunkNotFoundException(history));
        }
        player.reset();
        try {
            Channel channel = Channel.of(channelId, null);
            GroupId info = GroupId.channelInfo(channelId);
            while (player.hasMore(info)) {
                channel = player.next(info).channel();
                processor.channelInfo(channel);
            }

            GroupId members = GroupId.channelUsers(channelId);
            while (player.hasMore(members)) {
                processor.channelUsers(channelId, player.next(members).channelUsers());
            }

            int pages = 0;
            while (player.hasMore(history)) {
                Chunk page = player.next(history);
                processor.messages(channelId, page.numThreads(), page.last(), page.messages());
                pages++;
                for (Message m : page.messages()) {
                    streamFiles(channel, m, processor);
                    if (m.isThreadParent()) {
                        streamThread(channel, m, processor);
                    }
                }
            }

            GroupId bookmarks = GroupId.bookmarks(channelId);
            while (player.hasMore(bookmarks)) {
                processor.bookmarks(channelId, player.next(bookmarks).bookmarks());
            }
            log.info("Streamed channel {}: {} history pages", channelId, pages);
        } catch (ChunkLookupException e) {
            // only reachable if the player is read concurrently
            throw new IOException("archive cursor lost while streaming " + channelId + ": " + e.getMessage(), e);
        }
    }

    private void streamThread(Channel channel, Message parent, ConversationProcessor processor)
            throws IOException, ChunkLookupException {
        GroupId thread = GroupId.thread(channel.id(), parent.threadTimestamp());
        while (player.hasMore(thread)) {
            Chunk page = player.next(thread);
            processor.threadMessages(channel.id(), page.parent(), page.last(), page.messages());
            for (Message reply : page.messages()) {
                streamFiles(channel, reply, processor);
            }
        }
    }

    private void streamFiles(Channel channel, Message message, ConversationProcessor processor)
            throws IOException, ChunkLookupException {
        if (message.files().isEmpty()) {
            return;
        }
        GroupId files = GroupId.file(channel.id(), message.timestamp());
        while (player.hasMore(files)) {
            Chunk chunk = player.next(files);
            Channel owner = chunk.channel() != null ? chunk.channel() : channel;
            processor.files(owner, chunk.parent(), chunk.files());
        }
    }

    /**
     * Streams every channel with recorded messages.
     *
     * @return the IDs of the streamed channels
     */
    public List<String> streamAll(ConversationProcessor processor) throws IOException {
        List<String> ids = player.listKnownChannelIds();
        for (String id : ids) {
            stream(id, processor);
        }
        return ids;
    }

    /**
     * Streams the workspace-wide groups: users, channels, workspace info and starred items.
     * Groups absent from the log are skipped.
     *
     * @return the number of chunks streamed
     */
    public int streamDirectory(ConversationProcessor processor) throws IOException {
        player.reset();
        int count = 0;
        try {
            while (player.hasMore(GroupId.USERS)) {
                processor.users(player.next(GroupId.USERS).users());
                count++;
            }
            while (player.hasMore(GroupId.CHANNELS)) {
                processor.channels(player.next(GroupId.CHANNELS).channels());
                count++;
            }
            while (player.hasMore(GroupId.WORKSPACE_INFO)) {
                processor.workspaceInfo(player.next(GroupId.WORKSPACE_INFO).workspaceInfo());
                count++;
            }
            while (player.hasMore(GroupId.STARRED_ITEMS)) {
                processor.starredItems(player.next(GroupId.STARRED_ITEMS).starredItems());
                count++;
            }
        } catch (ChunkLookupException e) {
            throw new IOException("archive cursor lost while streaming the directory: " + e.getMessage(), e);
        }
        log.debug("Streamed {} directory chunks", count);
        return count;
    }
}
