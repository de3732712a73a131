package com.questrail.streaming.digitizer.codec.impl;

import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.model.UInt16Vector;

/**
 * Reader for one {@code ChannelTrace} table of an analog trace.
 */
final class ChannelTraceTable extends WireTable
{
    static final int FIELD_COUNT = 2;

    static final int CHANNEL = 0;
    static final int VOLTAGE = 1;

    ChannelTraceTable(WireBuffer wire, int position, String name)
    {
        super(wire, position, name);
    }

    long channel()
    {
        return u32(CHANNEL, name() + ".channel");
    }

    UInt16Vector voltage(Ownership ownership)
    {
        return uint16Vector(VOLTAGE, ownership, name() + ".voltage");
    }
}
