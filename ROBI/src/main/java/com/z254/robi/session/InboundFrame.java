package com.z254.robi.session;

/**
 * One frame received from the client, detached from the transport.
 *
 * @param kind text or binary
 * @param text payload of a text frame, null for binary
 * @param data payload of a binary frame, null for text
 */
public record InboundFrame(Kind kind, String text, byte[] data) {

    public enum Kind {
        TEXT,
        BINARY
    }

    public static InboundFrame text(String text) {
        return new InboundFrame(Kind.TEXT, text, null);
    }

    public static InboundFrame binary(byte[] data) {
        return new InboundFrame(Kind.BINARY, null, data);
    }

    public boolean isBinary() {
        return kind == Kind.BINARY;
    }
}
