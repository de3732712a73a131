package com.questrail.streaming.digitizer.codec;

import com.questrail.streaming.digitizer.model.MessageKind;
import io.netty.buffer.ByteBuf;

import java.util.Objects;
import java.util.Optional;

/**
 * MessageIdentifier
 * -----------------------------------------------------------------------------
 * Cheap peek at the FlatBuffers file identifier of an encoded buffer.
 *
 * <p>Only bytes 4 to 7 after the buffer's reader index are inspected; bytes 0
 * to 3 hold the root table offset. The reader index is not moved and the rest
 * of the buffer is not parsed, so this is suitable for routing heterogeneous
 * buffers before choosing a codec.</p>
 */
public final class MessageIdentifier
{
    private MessageIdentifier() {}

    /**
     * Identifies the message kind of {@code buffer}.
     *
     * @return the matching kind, or {@link MessageKind#UNKNOWN} if the tag is
     *         unrecognised or the buffer is too short to carry one
     */
    public static MessageKind identify(ByteBuf buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.readableBytes() < MessageKind.IDENTIFIED_PREFIX_LENGTH) {
            return MessageKind.UNKNOWN;
        }
        final int index = buffer.readerIndex() + MessageKind.IDENTIFIER_OFFSET;
        for (MessageKind kind : MessageKind.values()) {
            if (kind.matches(buffer, index)) {
                return kind;
            }
        }
        return MessageKind.UNKNOWN;
    }

    /**
     * Identifies the message kind of an encoded byte array.
     */
    public static MessageKind identify(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        for (MessageKind kind : MessageKind.values()) {
            if (kind.matches(bytes, MessageKind.IDENTIFIER_OFFSET)) {
                return kind;
            }
        }
        return MessageKind.UNKNOWN;
    }

    /**
     * Returns true if {@code buffer} carries the identifier of {@code kind}.
     */
    public static boolean hasIdentifier(ByteBuf buffer, MessageKind kind)
    {
        return kind != MessageKind.UNKNOWN && identify(buffer) == kind;
    }

    /**
     * Returns the raw identifier text, if the buffer is long enough to carry one.
     * Non-printable bytes are replaced so the result is safe to log.
     */
    public static Optional<String> peekIdentifier(ByteBuf buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.readableBytes() < MessageKind.IDENTIFIED_PREFIX_LENGTH) {
            return Optional.empty();
        }
        final int start = buffer.readerIndex() + MessageKind.IDENTIFIER_OFFSET;
        final StringBuilder sb = new StringBuilder(MessageKind.IDENTIFIER_LENGTH);
        for (int i = 0; i < MessageKind.IDENTIFIER_LENGTH; i++) {
            final int b = buffer.getUnsignedByte(start + i);
            sb.append(b >= 0x20 && b < 0x7F ? (char) b : '?');
        }
        return Optional.of(sb.toString());
    }
}
