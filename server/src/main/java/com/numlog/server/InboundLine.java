package com.numlog.server;

/**
 * One line as delivered by {@link RecordLineDecoder}.
 *
 * @param length      bytes received for this line, terminator included when present
 * @param text        the line decoded one char per byte, or null when it exceeded the line cap
 * @param endOfStream true when the peer finished sending before a terminator arrived
 */
public record InboundLine(int length, String text, boolean endOfStream) {}
