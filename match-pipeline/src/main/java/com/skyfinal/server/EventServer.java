package com.skyfinal.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;

import com.skyfinal.handler.EventFrameHandler;
import com.skyfinal.monitor.EventSurface;
import com.skyfinal.protocol.MessageSerializer;
import com.skyfinal.session.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket endpoint where the advisory layer subscribes to pipeline events.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: a few threads for subscriber I/O
 *
 * Event traffic is small (a handful of messages per round), so the worker
 * group stays small; the pipeline threads never run on it.
 */
public class EventServer {

    private static final Logger logger = LoggerFactory.getLogger(EventServer.class);
    public static final String WEBSOCKET_PATH = "/events";
    private static final int WORKER_THREADS = 2;

    private final int port;
    private final SessionManager sessionManager;
    private final EventSurface surface;
    private final MessageSerializer serializer;
    private final String seriesId;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public EventServer(int port, SessionManager sessionManager, EventSurface surface,
                       MessageSerializer serializer, String seriesId) {
        this.port = port;
        this.sessionManager = sessionManager;
        this.surface = surface;
        this.serializer = serializer;
        this.seriesId = seriesId;
    }

    /**
     * Binds the server and returns once it accepts connections.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(WORKER_THREADS);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Subscribers mostly listen, so only their pings and
                        // requests count as reads; one silent for 60s is gone
                        pipeline.addLast(new IdleStateHandler(60, 30, 0, TimeUnit.SECONDS));
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));
                        pipeline.addLast(new WebSocketServerCompressionHandler());
                        pipeline.addLast(new WebSocketServerProtocolHandler(
                                WEBSOCKET_PATH,
                                null,      // subprotocols
                                true,      // allow extensions
                                65536,     // max frame size
                                false,     // allow mask mismatch
                                true,      // check starting slash
                                10000L     // handshake timeout ms
                        ));
                        pipeline.addLast(new EventFrameHandler(sessionManager, surface, serializer, seriesId));
                    }
                });

        try {
            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdown();
            throw e;
        }

        logger.info("Event stream available at ws://localhost:{}{}", getBoundPort(), WEBSOCKET_PATH);
    }

    /**
     * Blocks until the server channel closes.
     */
    public void blockUntilClosed() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    /**
     * The port actually bound, which differs from the configured one when
     * that was 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) {
            return port;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void shutdown() {
        logger.info("Shutting down event server...");

        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        logger.info("Event server shutdown complete.");
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }
}
