package com.questrail.streaming.digitizer.codec.impl;

import com.questrail.streaming.digitizer.codec.MessageIdentifier;
import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.error.BadIdentifierException;
import com.questrail.streaming.digitizer.error.TruncatedBufferException;
import com.questrail.streaming.digitizer.model.MessageKind;
import com.questrail.streaming.digitizer.model.UInt16Vector;
import com.questrail.streaming.digitizer.model.UInt32Vector;
import io.netty.buffer.ByteBuf;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * WireBuffer
 * -----------------------------------------------------------------------------
 * Bounds-checked view of one finished FlatBuffer held in a Netty {@link ByteBuf}.
 *
 * <p>Table navigation runs over a little-endian {@link ByteBuffer} covering
 * the readable bytes, as the FlatBuffers runtime expects. Vector contents are
 * sliced or copied from the original {@code ByteBuf}, so a borrowed result
 * shares memory with the caller's buffer. Positions are relative to the reader
 * index at construction. The buffer's indices are never modified.</p>
 *
 * <p>The Java runtime does not verify buffers. Every position is checked here
 * before the runtime reads it, so a malformed buffer produces a
 * {@link TruncatedBufferException} instead of an {@link IndexOutOfBoundsException}.</p>
 */
final class WireBuffer
{
    /** Position returned for a field that is not set. Real positions are never zero. */
    static final int ABSENT = 0;

    private final ByteBuf source;
    private final int base;
    private final int length;
    private final ByteBuffer nio;

    private WireBuffer(ByteBuf source)
    {
        this.source = source;
        this.base = source.readerIndex();
        this.length = source.readableBytes();
        this.nio = source.nioBuffer(base, length).order(ByteOrder.LITTLE_ENDIAN);
    }

    static WireBuffer of(ByteBuf source)
    {
        return new WireBuffer(source);
    }

    ByteBuffer nio()
    {
        return nio;
    }

    void require(String region, long position, long size)
    {
        if (position < 0 || size < 0 || position + size > length) {
            throw new TruncatedBufferException(region, position, size, length);
        }
    }

    /**
     * Verifies the file identifier at bytes 4 to 7.
     *
     * @throws TruncatedBufferException if the buffer cannot hold a root offset and identifier
     * @throws BadIdentifierException   if the identifier names a different kind
     */
    void checkIdentifier(MessageKind expected)
    {
        require("file identifier", 0, MessageKind.IDENTIFIED_PREFIX_LENGTH);
        if (!WireTable.hasIdentifier(nio, expected)) {
            throw new BadIdentifierException(
                    expected.identifier(),
                    MessageIdentifier.peekIdentifier(source).orElse(""));
        }
    }

    /**
     * Returns the position of the root table.
     */
    int rootTable()
    {
        return reference(0, "root table");
    }

    /**
     * Follows the u32 offset stored at {@code position}.
     *
     * @return the referenced position, which lies inside the buffer
     */
    int reference(int position, String field)
    {
        final long offset = u32(position, field + " offset");
        final long target = position + offset;
        if (target >= length) {
            throw new TruncatedBufferException(field + " offset " + offset + " at " + position
                    + " points past the end of the " + length + "-byte buffer");
        }
        return (int) target;
    }

    int u16(long position, String field)
    {
        require(field, position, 2);
        return Short.toUnsignedInt(nio.getShort((int) position));
    }

    int i32(long position, String field)
    {
        require(field, position, 4);
        return nio.getInt((int) position);
    }

    long u32(long position, String field)
    {
        return Integer.toUnsignedLong(i32(position, field));
    }

    /**
     * Reads the element count of the vector at {@code position} and checks
     * that all of its elements are readable.
     */
    int vectorLength(int position, int elementSize, String field)
    {
        final long count = u32(position, field + " length");
        require(field, (long) position + WireLayout.UOFFSET_SIZE, count * elementSize);
        return (int) count;
    }

    UInt16Vector uint16(int position, int count, Ownership ownership)
    {
        final int index = base + position;
        return ownership == Ownership.OWNED
                ? UInt16Vector.copyOf(source, index, count)
                : UInt16Vector.view(source, index, count);
    }

    UInt32Vector uint32(int position, int count, Ownership ownership)
    {
        final int index = base + position;
        return ownership == Ownership.OWNED
                ? UInt32Vector.copyOf(source, index, count)
                : UInt32Vector.view(source, index, count);
    }
}
