package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.Struct;

import java.nio.ByteBuffer;

/**
 * Reader for the inline {@code GpsTime} struct. Fields are aligned to their
 * own size, which leaves two padding bytes:
 *
 * <pre>
 *   0  u8  year            6  u8  second
 *   1  (pad)               7  (pad)
 *   2  u16 day of year     8  u16 millisecond
 *   4  u8  hour           10  u16 microsecond
 *   5  u8  minute         12  u16 nanosecond
 * </pre>
 */
final class GpsTimeStruct extends Struct
{
    static final int SIZE = 14;
    static final int ALIGNMENT = 2;

    static final int YEAR = 0;
    static final int DAY_OF_YEAR = 2;
    static final int HOUR = 4;
    static final int MINUTE = 5;
    static final int SECOND = 6;
    static final int MILLISECOND = 8;
    static final int MICROSECOND = 10;
    static final int NANOSECOND = 12;

    /**
     * Wraps the struct at {@code position}; the caller has checked that
     * {@link #SIZE} bytes are readable there.
     */
    GpsTimeStruct(ByteBuffer bb, int position)
    {
        __reset(position, bb);
    }

    int year()
    {
        return u8(YEAR);
    }

    int dayOfYear()
    {
        return u16(DAY_OF_YEAR);
    }

    int hour()
    {
        return u8(HOUR);
    }

    int minute()
    {
        return u8(MINUTE);
    }

    int second()
    {
        return u8(SECOND);
    }

    int millisecond()
    {
        return u16(MILLISECOND);
    }

    int microsecond()
    {
        return u16(MICROSECOND);
    }

    int nanosecond()
    {
        return u16(NANOSECOND);
    }

    private int u8(int offset)
    {
        return Byte.toUnsignedInt(bb.get(bb_pos + offset));
    }

    private int u16(int offset)
    {
        return Short.toUnsignedInt(bb.getShort(bb_pos + offset));
    }
}
