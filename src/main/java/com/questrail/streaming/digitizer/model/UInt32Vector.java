package com.questrail.streaming.digitizer.model;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/**
 * UInt32Vector
 * -----------------------------------------------------------------------------
 * Immutable ordered sequence of 32-bit unsigned values stored little-endian.
 *
 * <p>A vector is either <em>borrowed</em> or <em>owned</em>:</p>
 * <ul>
 *   <li>A borrowed vector is a read-only slice of a decoded buffer. It is only
 *       valid while that buffer has not been released, and it does not hold a
 *       reference count of its own.</li>
 *   <li>An owned vector holds a private heap copy and outlives any buffer it
 *       was read from.</li>
 * </ul>
 *
 * <p>Equality and hashing compare contents only; a borrowed vector equals an
 * owned vector holding the same values.</p>
 */
public final class UInt32Vector
{
    public static final int ELEMENT_SIZE = 4;

    private static final UInt32Vector EMPTY = new UInt32Vector(Unpooled.EMPTY_BUFFER, false);

    private final ByteBuf data;
    private final boolean borrowed;

    private UInt32Vector(ByteBuf data, boolean borrowed) {
        this.data = data;
        this.borrowed = borrowed;
    }

    public static UInt32Vector empty() {
        return EMPTY;
    }

    /**
     * Creates an owned vector from the given values.
     *
     * @throws IllegalArgumentException if any value is outside 0-4294967295
     */
    public static UInt32Vector of(long... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            return EMPTY;
        }
        ByteBuf buf = Unpooled.buffer(values.length * ELEMENT_SIZE, values.length * ELEMENT_SIZE);
        for (int i = 0; i < values.length; i++) {
            long v = values[i];
            if (v < 0 || v > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("Value at index " + i + " does not fit in 32 unsigned bits: " + v);
            }
            buf.writeIntLE((int) v);
        }
        return new UInt32Vector(buf.asReadOnly(), false);
    }

    /**
     * Returns a borrowed view over {@code count} elements starting at absolute
     * index {@code index} of {@code source}. No bytes are copied.
     */
    public static UInt32Vector view(ByteBuf source, int index, int count) {
        if (count == 0) {
            return EMPTY;
        }
        return new UInt32Vector(source.slice(index, count * ELEMENT_SIZE).asReadOnly(), true);
    }

    /**
     * Returns an owned copy of {@code count} elements starting at absolute
     * index {@code index} of {@code source}.
     */
    public static UInt32Vector copyOf(ByteBuf source, int index, int count) {
        if (count == 0) {
            return EMPTY;
        }
        byte[] bytes = ByteBufUtil.getBytes(source, index, count * ELEMENT_SIZE);
        return new UInt32Vector(Unpooled.wrappedBuffer(bytes).asReadOnly(), false);
    }

    public int size() {
        return data.readableBytes() / ELEMENT_SIZE;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public long get(int index) {
        Objects.checkIndex(index, size());
        return data.getUnsignedIntLE(data.readerIndex() + index * ELEMENT_SIZE);
    }

    public long[] toArray() {
        long[] out = new long[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = get(i);
        }
        return out;
    }

    public LongStream stream() {
        return IntStream.range(0, size()).mapToLong(this::get);
    }

    /**
     * Returns true if this vector is a view tied to a decoded buffer's lifetime.
     */
    public boolean isBorrowed() {
        return borrowed;
    }

    /**
     * Returns an owned equivalent of this vector; owned vectors return themselves.
     */
    public UInt32Vector owned() {
        if (!borrowed) {
            return this;
        }
        return copyOf(data, data.readerIndex(), size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UInt32Vector that)) return false;
        return ByteBufUtil.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return ByteBufUtil.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("UInt32Vector[size=").append(size());
        int shown = Math.min(size(), 8);
        sb.append(", values=[");
        for (int i = 0; i < shown; i++) {
            if (i > 0) sb.append(", ");
            sb.append(get(i));
        }
        if (shown < size()) sb.append(", ...");
        return sb.append("]]").toString();
    }
}
