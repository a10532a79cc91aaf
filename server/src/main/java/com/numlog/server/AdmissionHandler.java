package com.numlog.server;

import com.numlog.protocol.LineProtocol;
import com.numlog.state.CounterState;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First handler on every accepted channel: the admission gate.
 *
 * channelActive reserves a slot in {@link CounterState}. Without one the channel gets the
 * busy message and is closed; no event reaches the protocol handlers and nothing is
 * released. With one, the slot is released from the channel's close future, which fires
 * exactly once whichever path closes the channel.
 */
@ChannelHandler.Sharable
public final class AdmissionHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    static final AttributeKey<Boolean> ADMITTED_KEY = AttributeKey.valueOf("admitted");

    private final CounterState state;

    public AdmissionHandler(CounterState state) {
        this.state = state;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        if (!state.tryAcquire()) {
            log.debug("Rejecting {}: {} connection(s) in flight", ctx.channel().remoteAddress(), state.inFlight());
            ctx.writeAndFlush(Unpooled.copiedBuffer(LineProtocol.BUSY_MESSAGE, LineProtocol.CHARSET))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        ctx.channel().attr(ADMITTED_KEY).set(Boolean.TRUE);
        ctx.channel().closeFuture().addListener(f -> state.release());
        ctx.fireChannelActive();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (isAdmitted(ctx)) {
            ctx.fireChannelRead(msg);
        } else {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (isAdmitted(ctx)) ctx.fireChannelInactive();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
        if (isAdmitted(ctx)) {
            ctx.fireUserEventTriggered(evt);
        } else {
            ReferenceCountUtil.release(evt);
        }
    }

    private static boolean isAdmitted(ChannelHandlerContext ctx) {
        return Boolean.TRUE.equals(ctx.channel().attr(ADMITTED_KEY).get());
    }
}
