package com.questrail.streaming.digitizer.model;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Closed set of message kinds recognised at the dispatch boundary.
 *
 * <p>Each known kind owns a 4-byte ASCII FlatBuffers file identifier. A
 * finished buffer starts with the u32 offset of its root table, so the
 * identifier sits at bytes 4 to 7. {@link #UNKNOWN} is reported for any other
 * tag and is never coerced into one of the known shapes.</p>
 */
public enum MessageKind
{
    /** Digitizer event list, identifier {@code "dev2"}. */
    EVENT_LIST("dev2"),

    /** Digitizer analog trace, identifier {@code "dat2"}. */
    ANALOG_TRACE("dat2"),

    /** Any buffer whose identifier matches neither known schema. */
    UNKNOWN(null);

    /** Length in bytes of a format identifier. */
    public static final int IDENTIFIER_LENGTH = 4;

    /** Position of the identifier, after the root table offset. */
    public static final int IDENTIFIER_OFFSET = 4;

    /** Bytes a buffer must hold before its identifier can be read. */
    public static final int IDENTIFIED_PREFIX_LENGTH = IDENTIFIER_OFFSET + IDENTIFIER_LENGTH;

    private final String identifier;
    private final byte[] identifierBytes;

    MessageKind(String identifier) {
        this.identifier = identifier;
        this.identifierBytes = identifier == null
                ? new byte[0]
                : identifier.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Returns the ASCII format identifier, or {@code null} for {@link #UNKNOWN}.
     */
    public String identifier() {
        return identifier;
    }

    /**
     * Returns a copy of the identifier bytes (empty for {@link #UNKNOWN}).
     */
    public byte[] identifierBytes() {
        return identifierBytes.clone();
    }

    /**
     * Returns true if the four bytes starting at {@code offset} equal this kind's identifier.
     */
    public boolean matches(byte[] bytes, int offset) {
        if (this == UNKNOWN || offset < 0 || bytes.length - offset < IDENTIFIER_LENGTH) {
            return false;
        }
        return Arrays.equals(bytes, offset, offset + IDENTIFIER_LENGTH,
                identifierBytes, 0, IDENTIFIER_LENGTH);
    }

    /**
     * Returns true if the four bytes at absolute index {@code index} of
     * {@code buffer} equal this kind's identifier. Indices are not moved.
     */
    public boolean matches(ByteBuf buffer, int index) {
        if (this == UNKNOWN || index < 0 || buffer.writerIndex() - index < IDENTIFIER_LENGTH) {
            return false;
        }
        for (int i = 0; i < IDENTIFIER_LENGTH; i++) {
            if (buffer.getByte(index + i) != identifierBytes[i]) {
                return false;
            }
        }
        return true;
    }
}
