package com.numlog.server;

import com.numlog.common.LatencyStats;
import com.numlog.common.NumlogConfig;
import com.numlog.protocol.RecordValidator;
import com.numlog.state.CounterState;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty TCP server accepting numlog client connections.
 *
 * Pipeline per channel:
 *   AdmissionHandler → RecordLineDecoder → RecordHandler (on the handler executor group)
 *
 * Half-closure is allowed so a client that shuts down its output after an unterminated
 * line still gets a response before the server closes.
 */
public final class NumlogServer {

    private static final Logger log = LoggerFactory.getLogger(NumlogServer.class);

    private final NumlogConfig cfg;
    private final CounterState state;
    private final RecordValidator validator;
    private final LatencyStats latency;
    private final FatalFaultHandler fatal;
    private final AdmissionHandler admission;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public NumlogServer(NumlogConfig cfg, CounterState state, LatencyStats latency, FatalFaultHandler fatal) {
        this.cfg       = cfg;
        this.state     = state;
        this.validator = RecordValidator.from(cfg);
        this.latency   = latency;
        this.fatal     = fatal;
        this.admission = new AdmissionHandler(state);
    }

    public void start() throws InterruptedException {
        bossGroup    = new NioEventLoopGroup(1);
        workerGroup  = new NioEventLoopGroup(2);
        handlerGroup = new DefaultEventExecutorGroup(cfg.handlerThreads);

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new AcceptErrorHandler())
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                // Gate first: a rejected channel never reaches the decoder.
                                .addLast("admission", admission)
                                .addLast("line", new RecordLineDecoder(cfg.maxLineLength))
                                .addLast(handlerGroup, "record",
                                        new RecordHandler(state, validator, latency, fatal));
                    }
                });

        ChannelFuture future = bootstrap.bind(cfg.host, cfg.port).sync();
        serverChannel = future.channel();
        log.info("numlog TCP server listening on {} (connection limit {})", localAddress(), state.capacity());
    }

    public InetSocketAddress localAddress() {
        return (InetSocketAddress) serverChannel.localAddress();
    }

    Channel serverChannel() {
        return serverChannel;
    }

    /** Closes the listener only; accepted connections finish on their own. */
    public void stopAccepting() {
        if (serverChannel != null && serverChannel.isOpen()) {
            serverChannel.close().syncUninterruptibly();
            log.info("Stopped accepting connections.");
        }
    }

    public void stop() {
        stopAccepting();
        if (bossGroup    != null) bossGroup.shutdownGracefully().syncUninterruptibly();
        if (workerGroup  != null) workerGroup.shutdownGracefully().syncUninterruptibly();
        if (handlerGroup != null) handlerGroup.shutdownGracefully().syncUninterruptibly();
        log.info("numlog TCP server stopped.");
    }

    /**
     * Server-channel handler: accept failures (e.g. out of file descriptors) are logged,
     * accepting pauses for {@code pauseMillis}, then the listener carries on.
     */
    static final class AcceptErrorHandler extends ChannelInboundHandlerAdapter {

        static final long DEFAULT_PAUSE_MILLIS = 1_000;

        private final long pauseMillis;

        AcceptErrorHandler() {
            this(DEFAULT_PAUSE_MILLIS);
        }

        AcceptErrorHandler(long pauseMillis) {
            this.pauseMillis = pauseMillis;
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Error accepting connection: {}", cause.toString());
            ChannelConfig config = ctx.channel().config();
            if (config.isAutoRead()) {
                // the failing accept would otherwise be retried on every loop iteration
                config.setAutoRead(false);
                ctx.channel().eventLoop().schedule(() -> config.setAutoRead(true), pauseMillis, TimeUnit.MILLISECONDS);
            }
        }
    }
}
