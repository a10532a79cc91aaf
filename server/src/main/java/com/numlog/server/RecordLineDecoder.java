package com.numlog.server;

import com.numlog.protocol.LineProtocol;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.ByteProcessor;

import java.util.List;

/**
 * Splits the inbound stream into at most one {@link InboundLine} per connection.
 *
 * Unlike Netty's LineBasedFrameDecoder the terminator is kept and counted, and whatever
 * arrived before end-of-stream is still delivered (possibly zero bytes) so the handler can
 * report its length. Lines over {@code maxLineLength} are counted and discarded rather than
 * buffered. Bytes after the first line are ignored.
 *
 * One instance per channel (not @Sharable).
 */
public final class RecordLineDecoder extends ByteToMessageDecoder {

    private final int maxLineLength;

    private boolean done;
    private boolean discarding;
    private long discarded;

    public RecordLineDecoder(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (done) {
            in.skipBytes(in.readableBytes());
            return;
        }

        int eol = in.forEachByte(ByteProcessor.FIND_LF);
        if (discarding) {
            if (eol < 0) {
                discarded += in.readableBytes();
                in.skipBytes(in.readableBytes());
                return;
            }
            int tail = eol - in.readerIndex() + 1;
            in.skipBytes(tail);
            emit(out, new InboundLine(measured(discarded + tail), null, false));
            return;
        }

        if (eol >= 0) {
            int len = eol - in.readerIndex() + 1;
            if (len > maxLineLength) {
                in.skipBytes(len);
                emit(out, new InboundLine(len, null, false));
            } else {
                emit(out, new InboundLine(len, in.readCharSequence(len, LineProtocol.CHARSET).toString(), false));
            }
            return;
        }

        if (in.readableBytes() > maxLineLength) {
            discarding = true;
            discarded  = in.readableBytes();
            in.skipBytes(in.readableBytes());
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (!done && in.isReadable()) {
            decode(ctx, in, out);
        }
        if (done) {
            in.skipBytes(in.readableBytes());
            return;
        }

        // end of stream before a terminator: hand over what we have
        int len = in.readableBytes();
        if (discarding) {
            in.skipBytes(len);
            emit(out, new InboundLine(measured(discarded + len), null, true));
        } else {
            emit(out, new InboundLine(len, in.readCharSequence(len, LineProtocol.CHARSET).toString(), true));
        }
    }

    /** Length reported for a discarded line; saturates instead of wrapping. */
    static int measured(long length) {
        return (int) Math.min(length, Integer.MAX_VALUE);
    }

    private void emit(List<Object> out, InboundLine line) {
        done = true;
        out.add(line);
    }
}
