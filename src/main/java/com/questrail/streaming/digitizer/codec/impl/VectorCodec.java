package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.FlatBufferBuilder;
import com.questrail.streaming.digitizer.model.UInt16Vector;
import com.questrail.streaming.digitizer.model.UInt32Vector;

/**
 * Vector construction shared by both message kinds. The builder fills its
 * buffer back to front, so elements are added last to first.
 */
final class VectorCodec
{
    private VectorCodec() {}

    static int create(FlatBufferBuilder builder, UInt16Vector vector)
    {
        builder.startVector(UInt16Vector.ELEMENT_SIZE, vector.size(), UInt16Vector.ELEMENT_SIZE);
        for (int i = vector.size() - 1; i >= 0; i--) {
            builder.addShort((short) vector.get(i));
        }
        return builder.endVector();
    }

    static int create(FlatBufferBuilder builder, UInt32Vector vector)
    {
        builder.startVector(UInt32Vector.ELEMENT_SIZE, vector.size(), UInt32Vector.ELEMENT_SIZE);
        for (int i = vector.size() - 1; i >= 0; i--) {
            builder.addInt((int) vector.get(i));
        }
        return builder.endVector();
    }

    /**
     * Creates a vector of references to tables already in the builder.
     */
    static int createOffsets(FlatBufferBuilder builder, int[] offsets)
    {
        builder.startVector(WireLayout.UOFFSET_SIZE, offsets.length, WireLayout.UOFFSET_SIZE);
        for (int i = offsets.length - 1; i >= 0; i--) {
            builder.addOffset(offsets[i]);
        }
        return builder.endVector();
    }

    /**
     * Rough buffer size for a message carrying {@code payloadBytes} of vector data.
     */
    static int initialCapacity(long payloadBytes)
    {
        return (int) Math.min(Integer.MAX_VALUE / 2, 256 + payloadBytes);
    }
}
