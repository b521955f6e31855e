package org.chatvault.archive.stream;

import java.io.IOException;
import java.util.List;

import org.chatvault.archive.model.Bookmark;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.SlackFile;
import org.chatvault.archive.model.StarredItem;
import org.chatvault.archive.model.User;
import org.chatvault.archive.model.WorkspaceInfo;

/**
 * Receives API responses from the capture layer, one call per page, in the order they were
 * fetched.
 * <p>
 * The capture layer itself (session handling, pagination, rate limiting) is not part of this
 * project; it only has to hand typed payloads to an implementation of this interface.
 */
public interface ConversationProcessor {

    /**
     * A page of channel history.
     *
     * @param channelId  the channel
     * @param numThreads number of thread roots on the page
     * @param isLast     true on the last page of the channel
     * @param messages   the messages of the page
     */
    void messages(String channelId, int numThreads, boolean isLast, List<Message> messages) throws IOException;

    /**
     * A page of thread replies.
     *
     * @param channelId the channel
     * @param parent    the thread root
     * @param isLast    true on the last page of the thread
     * @param replies   the replies of the page
     */
    void threadMessages(String channelId, Message parent, boolean isLast, List<Message> replies) throws IOException;

    /**
     * Files attached to a message.
     */
    void files(Channel channel, Message parent, List<SlackFile> files) throws IOException;

    void users(List<User> users) throws IOException;

    void channels(List<Channel> channels) throws IOException;

    void channelInfo(Channel channel) throws IOException;

    void channelUsers(String channelId, List<String> userIds) throws IOException;

    void workspaceInfo(WorkspaceInfo info) throws IOException;

    void starredItems(List<StarredItem> items) throws IOException;

    void bookmarks(String channelId, List<Bookmark> bookmarks) throws IOException;
}
