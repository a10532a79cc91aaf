package com.numlog.server;

import com.numlog.common.LatencyStats;
import com.numlog.protocol.LineProtocol;
import com.numlog.protocol.RecordValidator;
import com.numlog.protocol.ValidationResult;
import com.numlog.state.CounterState;
import com.numlog.state.FatalFaultException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Per-connection protocol logic: validate the single line, record it, respond, close.
 *
 * Runs on the handler executor group rather than the I/O loop, since recording a new
 * unique value appends to a file. Every path ends in {@link #closeAfter}, and closing the
 * channel is what returns the admission slot.
 *
 * One instance per channel (not @Sharable).
 */
public final class RecordHandler extends SimpleChannelInboundHandler<InboundLine> {

    private static final Logger log = LoggerFactory.getLogger(RecordHandler.class);

    private final CounterState state;
    private final RecordValidator validator;
    private final LatencyStats latency;
    private final FatalFaultHandler fatal;

    private long acceptedAtNanos;
    private boolean handled;

    public RecordHandler(CounterState state, RecordValidator validator,
                         LatencyStats latency, FatalFaultHandler fatal) {
        this.state     = state;
        this.validator = validator;
        this.latency   = latency;
        this.fatal     = fatal;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        acceptedAtNanos = System.nanoTime();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, InboundLine line) {
        if (handled) return;
        handled = true;

        ChannelFuture pending = null;
        try {
            ValidationResult result = validator.validate(line.length(), line.text());
            if (!result.isValid()) {
                log.debug("Malformed request from {}: {} (length {}{})",
                        ctx.channel().remoteAddress(), result.reason(), line.length(),
                        line.endOfStream() ? ", unterminated" : "");
                pending = respond(ctx, result.response());
                return;
            }

            long value = result.value();
            state.recordValid(value);
            pending = respond(ctx, result.response());

            if (state.recordUnique(value)) {
                log.trace("New unique value {}", value);
            }
        } finally {
            closeAfter(ctx, pending);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof FatalFaultException) {
            ctx.close();
            fatal.onFatal(cause);
        } else if (cause instanceof DecoderException) {
            // a failing line reader is our bug, not the client's
            ctx.close();
            fatal.onFatal(new FatalFaultException("line reader failed", cause));
        } else if (cause instanceof IOException) {
            log.debug("Connection {} dropped by peer: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }

    private ChannelFuture respond(ChannelHandlerContext ctx, String text) {
        return ctx.writeAndFlush(Unpooled.copiedBuffer(text, LineProtocol.CHARSET));
    }

    private void closeAfter(ChannelHandlerContext ctx, ChannelFuture pending) {
        if (pending == null) {
            ctx.close();
        } else {
            pending.addListener(ChannelFutureListener.CLOSE);
        }
        latency.record(System.nanoTime() - acceptedAtNanos);
    }
}
