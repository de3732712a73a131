package com.questrail.streaming.digitizer.model;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * UInt16Vector
 * -----------------------------------------------------------------------------
 * Immutable ordered sequence of 16-bit unsigned values stored little-endian.
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
public final class UInt16Vector
{
    public static final int ELEMENT_SIZE = 2;

    private static final UInt16Vector EMPTY = new UInt16Vector(Unpooled.EMPTY_BUFFER, false);

    private final ByteBuf data;
    private final boolean borrowed;

    private UInt16Vector(ByteBuf data, boolean borrowed) {
        this.data = data;
        this.borrowed = borrowed;
    }

    public static UInt16Vector empty() {
        return EMPTY;
    }

    /**
     * Creates an owned vector from the given values.
     *
     * @throws IllegalArgumentException if any value is outside 0-65535
     */
    public static UInt16Vector of(int... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            return EMPTY;
        }
        ByteBuf buf = Unpooled.buffer(values.length * ELEMENT_SIZE, values.length * ELEMENT_SIZE);
        for (int i = 0; i < values.length; i++) {
            int v = values[i];
            if (v < 0 || v > 0xFFFF) {
                throw new IllegalArgumentException("Value at index " + i + " does not fit in 16 unsigned bits: " + v);
            }
            buf.writeShortLE(v);
        }
        return new UInt16Vector(buf.asReadOnly(), false);
    }

    /**
     * Returns a borrowed view over {@code count} elements starting at absolute
     * index {@code index} of {@code source}. No bytes are copied.
     */
    public static UInt16Vector view(ByteBuf source, int index, int count) {
        if (count == 0) {
            return EMPTY;
        }
        return new UInt16Vector(source.slice(index, count * ELEMENT_SIZE).asReadOnly(), true);
    }

    /**
     * Returns an owned copy of {@code count} elements starting at absolute
     * index {@code index} of {@code source}.
     */
    public static UInt16Vector copyOf(ByteBuf source, int index, int count) {
        if (count == 0) {
            return EMPTY;
        }
        byte[] bytes = ByteBufUtil.getBytes(source, index, count * ELEMENT_SIZE);
        return new UInt16Vector(Unpooled.wrappedBuffer(bytes).asReadOnly(), false);
    }

    public int size() {
        return data.readableBytes() / ELEMENT_SIZE;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int get(int index) {
        Objects.checkIndex(index, size());
        return data.getUnsignedShortLE(data.readerIndex() + index * ELEMENT_SIZE);
    }

    public int[] toArray() {
        int[] out = new int[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = get(i);
        }
        return out;
    }

    public IntStream stream() {
        return IntStream.range(0, size()).map(this::get);
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
    public UInt16Vector owned() {
        if (!borrowed) {
            return this;
        }
        return copyOf(data, data.readerIndex(), size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UInt16Vector that)) return false;
        return ByteBufUtil.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return ByteBufUtil.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("UInt16Vector[size=").append(size());
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
