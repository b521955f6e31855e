package org.chatvault.replay;

import java.util.List;

import org.chatvault.archive.chunk.ChunkCodec;
import org.chatvault.archive.chunk.ChunkExhaustedException;
import org.chatvault.archive.chunk.ChunkNotFoundException;
import org.chatvault.archive.chunk.GroupId;
import org.chatvault.archive.chunk.Player;
import org.chatvault.archive.model.Channel;
import org.chatvault.archive.model.Message;
import org.chatvault.archive.model.User;
import org.chatvault.replay.dto.ChannelInfoResponseDto;
import org.chatvault.replay.dto.ChannelsResponseDto;
import org.chatvault.replay.dto.ErrorResponseDto;
import org.chatvault.replay.dto.MessagesResponseDto;
import org.chatvault.replay.dto.ResponseMetadata;
import org.chatvault.replay.dto.UsersResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HttpStatus;

/**
 * HTTP endpoints shaped like the remote service's Web API, answered from a {@link Player}.
 * <p>
 * Every request consumes the next recorded chunk of the group it addresses, so a client
 * paginating through a channel receives the pages in the order they were captured. Lookup
 * results map to responses as follows:
 * <ul>
 *   <li>chunk found: {@code ok=true} with the payload, {@code has_more} from the player and
 *       the record offset as {@code next_cursor}</li>
 *   <li>group never recorded: 404</li>
 *   <li>group exhausted: {@code ok=true}, empty payload, {@code has_more=false}, the way the
 *       service ends pagination</li>
 *   <li>anything else: 500, logged with the group key</li>
 * </ul>
 * Parameters are read from the query string, or from a form body for POST requests.
 * <p>
 * <strong>Thread Safety:</strong> thread-safe; concurrent requests are serialized by the
 * player.
 */
public class ReplayController {

    private static final Logger log = LoggerFactory.getLogger(ReplayController.class);

    private final Player player;

    public ReplayController(Player player) {
        this.player = player;
    }

    /**
     * Registers the endpoints under {@code basePath}, for both GET and POST.
     *
     * @param app      the Javalin instance
     * @param basePath path prefix, e.g. {@code /api}
     */
    public void registerRoutes(final Javalin app, final String basePath) {
        route(app, basePath, "conversations.history", this::getConversationHistory);
        route(app, basePath, "conversations.replies", this::getConversationReplies);
        route(app, basePath, "conversations.info", this::getConversationInfo);
        route(app, basePath, "conversations.list", this::getConversationList);
        route(app, basePath, "users.list", this::getUsersList);
        log.debug("Registered replay endpoints under {}", basePath);
    }

    private static void route(Javalin app, String basePath, String method, Handler handler) {
        String path = (basePath + "/" + method).replaceAll("//", "/");
        app.get(path, handler);
        app.post(path, handler);
    }

    void getConversationHistory(final Context ctx) {
        String channel = param(ctx, "channel");
        if (channel == null) {
            writeJson(ctx, HttpStatus.NOT_FOUND, ErrorResponseDto.of("channel_not_found"));
            return;
        }
        GroupId id = GroupId.channel(channel);
        try {
            List<Message> messages = player.messages(channel);
            writeJson(ctx, HttpStatus.OK, new MessagesResponseDto(
                true, player.hasMoreMessages(channel), messages, cursor()));
        } catch (ChunkNotFoundException e) {
            notFound(ctx, "channel_not_found", id);
        } catch (ChunkExhaustedException e) {
            writeJson(ctx, HttpStatus.OK, MessagesResponseDto.endOfData());
        } catch (Exception e) {
            internalError(ctx, "conversations.history", id, e);
        }
    }

    void getConversationReplies(final Context ctx) {
        String channel = param(ctx, "channel");
        String ts = param(ctx, "ts");
        if (channel == null || ts == null) {
            writeJson(ctx, HttpStatus.BAD_REQUEST, ErrorResponseDto.of("channel and ts are required"));
            return;
        }
        GroupId id = GroupId.thread(channel, ts);
        try {
            List<Message> replies = player.threadMessages(channel, ts);
            writeJson(ctx, HttpStatus.OK, new MessagesResponseDto(
                true, player.hasMoreThreads(channel, ts), replies, cursor()));
        } catch (ChunkNotFoundException e) {
            notFound(ctx, "thread_not_found", id);
        } catch (ChunkExhaustedException e) {
            writeJson(ctx, HttpStatus.OK, MessagesResponseDto.endOfData());
        } catch (Exception e) {
            internalError(ctx, "conversations.replies", id, e);
        }
    }

    void getConversationInfo(final Context ctx) {
        String channel = param(ctx, "channel");
        if (channel == null) {
            writeJson(ctx, HttpStatus.BAD_REQUEST, ErrorResponseDto.of("channel is required"));
            return;
        }
        GroupId id = GroupId.channelInfo(channel);
        try {
            Channel info = player.channelInfo(channel);
            writeJson(ctx, HttpStatus.OK, new ChannelInfoResponseDto(true, info, player.hasMore(id), cursor()));
        } catch (ChunkNotFoundException e) {
            notFound(ctx, "channel_not_found", id);
        } catch (ChunkExhaustedException e) {
            writeJson(ctx, HttpStatus.OK, new ChannelInfoResponseDto(true, null, false, ResponseMetadata.NONE));
        } catch (Exception e) {
            internalError(ctx, "conversations.info", id, e);
        }
    }

    void getConversationList(final Context ctx) {
        GroupId id = GroupId.CHANNELS;
        try {
            List<Channel> channels = player.channels();
            writeJson(ctx, HttpStatus.OK, new ChannelsResponseDto(true, channels, player.hasMoreChannels(), cursor()));
        } catch (ChunkNotFoundException e) {
            notFound(ctx, "not_found", id);
        } catch (ChunkExhaustedException e) {
            writeJson(ctx, HttpStatus.OK, new ChannelsResponseDto(true, List.of(), false, ResponseMetadata.NONE));
        } catch (Exception e) {
            internalError(ctx, "conversations.list", id, e);
        }
    }

    void getUsersList(final Context ctx) {
        GroupId id = GroupId.USERS;
        try {
            List<User> users = player.users();
            writeJson(ctx, HttpStatus.OK, new UsersResponseDto(true, users, player.hasUsers(), cursor()));
        } catch (ChunkNotFoundException e) {
            notFound(ctx, "not_found", id);
        } catch (ChunkExhaustedException e) {
            writeJson(ctx, HttpStatus.OK, new UsersResponseDto(true, List.of(), false, ResponseMetadata.NONE));
        } catch (Exception e) {
            internalError(ctx, "users.list", id, e);
        }
    }

    private ResponseMetadata cursor() {
        return new ResponseMetadata(Long.toString(player.offset()));
    }

    private static String param(Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null || value.isEmpty()) {
            value = ctx.formParam(name);
        }
        return value == null || value.isEmpty() ? null : value;
    }

    private static void notFound(Context ctx, String error, GroupId id) {
        log.debug("No recorded data for {}", id);
        writeJson(ctx, HttpStatus.NOT_FOUND, ErrorResponseDto.of(error));
    }

    private void internalError(Context ctx, String endpoint, GroupId id, Exception e) {
        log.error("{}: failed to replay {} (last offset {}): {}", endpoint, id, player.offset(), e.getMessage());
        log.debug("{}: replay failure details", endpoint, e);
        writeJson(ctx, HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponseDto.of(e.getMessage()));
    }

    private static void writeJson(Context ctx, HttpStatus status, Object body) {
        try {
            ctx.status(status)
                .contentType("application/json")
                .result(ChunkCodec.mapper().writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.error("Failed to encode {} response: {}", body.getClass().getSimpleName(), e.getMessage());
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).result(e.getMessage());
        }
    }
}
