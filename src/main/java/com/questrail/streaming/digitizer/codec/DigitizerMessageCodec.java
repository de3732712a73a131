package com.questrail.streaming.digitizer.codec;

import com.questrail.streaming.digitizer.model.DigitizerMessage;
import com.questrail.streaming.digitizer.model.MessageKind;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * DigitizerMessageCodec
 * -----------------------------------------------------------------------------
 * Encode / decode / validate boundary for one digitizer message kind.
 *
 * <p>Implementations are stateless after construction and safe to share
 * between threads. Each call is independent and produces the same result
 * regardless of concurrent calls.</p>
 *
 * <h2>Buffer ownership</h2>
 * <ul>
 *   <li>{@link #encode} returns a buffer owned by the caller, who must
 *       {@link ByteBuf#release() release} it once it has been handed off.</li>
 *   <li>{@link #decode(ByteBuf, Ownership)} reads from the buffer's reader
 *       index without moving it and never releases the input.</li>
 * </ul>
 *
 * @param <M> the message type handled by this codec
 */
public interface DigitizerMessageCodec<M extends DigitizerMessage>
{
    /**
     * Returns the kind whose identifier this codec writes and accepts.
     */
    MessageKind kind();

    /**
     * Encodes {@code message} into a newly allocated, self-identified buffer.
     *
     * @throws com.questrail.streaming.digitizer.error.DigitizerCodecException if
     *         the message fails a blocking validation rule; no buffer is returned
     */
    ByteBuf encode(M message);

    /**
     * Encodes {@code message} and returns the bytes as a heap array.
     */
    default byte[] encodeToBytes(M message)
    {
        final ByteBuf buffer = encode(message);
        try {
            return ByteBufUtil.getBytes(buffer);
        } finally {
            buffer.release();
        }
    }

    /**
     * Decodes a buffer, choosing per call whether the result borrows from it.
     *
     * @throws com.questrail.streaming.digitizer.error.DigitizerCodecException if
     *         the buffer is not of this kind or is malformed
     */
    M decode(ByteBuf buffer, Ownership ownership);

    /**
     * Decodes a buffer using this codec's configured default ownership.
     */
    M decode(ByteBuf buffer);

    /**
     * Decodes a byte array. The result borrows from {@code bytes}; callers that
     * intend to reuse the array should call {@link DigitizerMessage#owned()}.
     */
    default M decode(byte[] bytes)
    {
        return decode(Unpooled.wrappedBuffer(bytes), Ownership.BORROWED);
    }

    /**
     * Checks {@code message} against the structural rules of this kind without
     * encoding it.
     */
    ValidationReport validate(M message);
}
