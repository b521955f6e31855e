package org.chatvault.replay;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

import org.chatvault.archive.chunk.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;

/**
 * Serves a recorded log over HTTP with the endpoints of {@link ReplayController}.
 * <p>
 * Options (all optional):
 * <ul>
 *   <li>{@code host}: bind address, default {@code 127.0.0.1}</li>
 *   <li>{@code port}: listen port, default 8080; 0 picks a free port</li>
 *   <li>{@code base-path}: route prefix, default {@code /api}</li>
 * </ul>
 */
public class ReplayServer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ReplayServer.class);

    private final Player player;
    private final boolean ownsPlayer;
    private final String host;
    private final int port;
    private final String basePath;
    private final Javalin app;

    /**
     * Creates a server over an open player. The caller keeps ownership of the player.
     *
     * @param player  the player to answer requests from
     * @param options the server options
     */
    public ReplayServer(Player player, Config options) {
        this(player, options, false);
    }

    private ReplayServer(Player player, Config options, boolean ownsPlayer) {
        this.player = player;
        this.ownsPlayer = ownsPlayer;
        this.host = options.hasPath("host") ? options.getString("host") : "127.0.0.1";
        this.port = options.hasPath("port") ? options.getInt("port") : 8080;
        this.basePath = options.hasPath("base-path") ? options.getString("base-path") : "/api";
        this.app = Javalin.create(config -> config.showJavalinBanner = false);
        new ReplayController(player).registerRoutes(app, basePath);
    }

    /**
     * Opens the log at {@code logFile} and creates a server that closes it on {@link #close()}.
     *
     * @param logFile the chunk log
     * @param options the server options
     * @return the server, not yet started
     * @throws IOException if the log cannot be opened or indexed
     */
    public static ReplayServer open(Path logFile, Config options) throws IOException {
        return new ReplayServer(Player.open(logFile), options, true);
    }

    /**
     * Starts listening.
     *
     * @return this server
     */
    public ReplayServer start() {
        app.start(host, port);
        log.info("Replay server listening on http://{}:{}{} ({} groups)",
            host, app.port(), basePath, player.index().groupCount());
        return this;
    }

    /**
     * @return the bound port, valid after {@link #start()}
     */
    public int port() {
        return app.port();
    }

    @Override
    public void close() throws IOException {
        app.stop();
        log.debug("Replay server stopped");
        if (ownsPlayer) {
            player.close();
        }
    }
}
