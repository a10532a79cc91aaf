package com.numlog.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RecordLineDecoderTest {

    private static final int MAX_LINE = 16;

    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        ch = new EmbeddedChannel(new RecordLineDecoder(MAX_LINE));
    }

    private static ByteBuf bytes(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.ISO_8859_1);
    }

    @Test
    void lineSplitAcrossReadsIsReassembled() {
        ch.writeInbound(bytes("1234"));
        assertNull(ch.readInbound(), "no terminator yet");

        ch.writeInbound(bytes("56789\n"));
        assertEquals(new InboundLine(10, "123456789\n", false), ch.readInbound());
    }

    @Test
    void onlyTheFirstLineIsDelivered() {
        ch.writeInbound(bytes("123456789\n987654321\n"));
        assertEquals(new InboundLine(10, "123456789\n", false), ch.readInbound());
        assertNull(ch.readInbound());

        ch.writeInbound(bytes("555555555\n"));
        assertNull(ch.readInbound());
    }

    @Test
    void overlongLineIsMeasuredNotBuffered() {
        ch.writeInbound(bytes("x".repeat(20)));
        assertNull(ch.readInbound());
        ch.writeInbound(bytes("abc\n"));

        assertEquals(new InboundLine(24, null, false), ch.readInbound());
    }

    @Test
    void overlongLineInSingleRead() {
        ch.writeInbound(bytes("9".repeat(29) + "\n"));
        assertEquals(new InboundLine(30, null, false), ch.readInbound());
    }

    @Test
    void measuredLengthSaturatesInsteadOfWrapping() {
        assertEquals(24, RecordLineDecoder.measured(24));
        assertEquals(Integer.MAX_VALUE, RecordLineDecoder.measured(Integer.MAX_VALUE));
        assertEquals(Integer.MAX_VALUE, RecordLineDecoder.measured(3L * Integer.MAX_VALUE));
    }

    @Test
    void lineAtCapIsKept() {
        String line = "9".repeat(MAX_LINE - 1) + "\n";
        ch.writeInbound(bytes(line));
        assertEquals(new InboundLine(MAX_LINE, line, false), ch.readInbound());
    }

    @Test
    void unterminatedDataIsDeliveredAtClose() {
        ch.writeInbound(bytes("123"));
        ch.finish();

        assertEquals(new InboundLine(3, "123", true), ch.readInbound());
    }

    @Test
    void closeWithoutDataDeliversEmptyLine() {
        ch.finish();
        assertEquals(new InboundLine(0, "", true), ch.readInbound());
    }

    @Test
    void inputShutdownDeliversPartialLineWhileChannelStaysOpen() {
        ch.writeInbound(bytes("12345"));
        ch.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);

        assertEquals(new InboundLine(5, "12345", true), ch.readInbound());
        assertTrue(ch.isOpen());

        ch.finish();
        assertNull(ch.readInbound(), "nothing more after the line was delivered");
    }

    @Test
    void overlongUnterminatedLineAtClose() {
        ch.writeInbound(bytes("7".repeat(40)));
        ch.finish();
        assertEquals(new InboundLine(40, null, true), ch.readInbound());
    }

    @Test
    void closeAfterCompleteLineDeliversNothingMore() {
        ch.writeInbound(bytes("123456789\n"));
        ch.finish();

        assertNotNull(ch.readInbound());
        assertNull(ch.readInbound());
    }
}
