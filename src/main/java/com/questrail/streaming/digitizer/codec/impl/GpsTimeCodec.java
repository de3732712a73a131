package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.FlatBufferBuilder;
import com.questrail.streaming.digitizer.error.InvalidFieldValueException;
import com.questrail.streaming.digitizer.model.GpsTime;
import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * GpsTimeCodec
 * -----------------------------------------------------------------------------
 * The {@code GpsTime} struct: 14 bytes, each field aligned to its own size.
 * See {@link GpsTimeStruct} for the offsets.
 *
 * <p>Inside a message the struct is written inline into the metadata table by
 * {@link #create}. {@link #encode} and {@link #decode} handle the bare struct
 * image.</p>
 */
public final class GpsTimeCodec
{
    public static final int ENCODED_LENGTH = GpsTimeStruct.SIZE;

    private GpsTimeCodec() {}

    /**
     * Writes the struct image of {@code time} at the writer index of {@code out}.
     */
    public static void encode(GpsTime time, ByteBuf out)
    {
        Objects.requireNonNull(time, "time");
        out.writeByte(time.year());
        out.writeZero(1);
        out.writeShortLE(time.dayOfYear());
        out.writeByte(time.hour());
        out.writeByte(time.minute());
        out.writeByte(time.second());
        out.writeZero(1);
        out.writeShortLE(time.millisecond());
        out.writeShortLE(time.microsecond());
        out.writeShortLE(time.nanosecond());
    }

    /**
     * Reads a struct image at the reader index of {@code in} and advances it.
     *
     * @throws com.questrail.streaming.digitizer.error.TruncatedBufferException
     *         if fewer than {@link #ENCODED_LENGTH} bytes are readable
     * @throws InvalidFieldValueException if a field is out of range
     */
    public static GpsTime decode(ByteBuf in)
    {
        final WireBuffer wire = WireBuffer.of(in);
        wire.require("GpsTime", 0, ENCODED_LENGTH);
        final GpsTime time = read(new GpsTimeStruct(wire.nio(), 0));
        in.skipBytes(ENCODED_LENGTH);
        return time;
    }

    /**
     * Writes {@code time} inline. Must be called inside the enclosing table,
     * immediately before the struct field is added.
     */
    static int create(FlatBufferBuilder builder, GpsTime time)
    {
        builder.prep(GpsTimeStruct.ALIGNMENT, ENCODED_LENGTH);
        builder.putShort((short) time.nanosecond());
        builder.putShort((short) time.microsecond());
        builder.putShort((short) time.millisecond());
        builder.pad(1);
        builder.putByte((byte) time.second());
        builder.putByte((byte) time.minute());
        builder.putByte((byte) time.hour());
        builder.putShort((short) time.dayOfYear());
        builder.pad(1);
        builder.putByte((byte) time.year());
        return builder.offset();
    }

    static GpsTime read(GpsTimeStruct struct)
    {
        try {
            return new GpsTime(
                    struct.year(),
                    struct.dayOfYear(),
                    struct.hour(),
                    struct.minute(),
                    struct.second(),
                    struct.millisecond(),
                    struct.microsecond(),
                    struct.nanosecond());
        }
        catch (IllegalArgumentException e) {
            throw new InvalidFieldValueException("metadata.timestamp", e.getMessage(), e);
        }
    }
}
