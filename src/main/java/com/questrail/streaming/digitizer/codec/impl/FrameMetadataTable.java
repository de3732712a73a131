package com.questrail.streaming.digitizer.codec.impl;

/**
 * Reader for the {@code FrameMetadataV2} table.
 */
final class FrameMetadataTable extends WireTable
{
    static final int FIELD_COUNT = 6;

    static final int TIMESTAMP = 0;
    static final int PERIOD_NUMBER = 1;
    static final int PROTONS_PER_PULSE = 2;
    static final int RUNNING = 3;
    static final int FRAME_NUMBER = 4;
    static final int VETO_FLAGS = 5;

    FrameMetadataTable(WireBuffer wire, int position)
    {
        super(wire, position, "metadata");
    }

    /**
     * Returns the inline timestamp, or null if the field is not set.
     */
    GpsTimeStruct timestamp()
    {
        final int at = inline(TIMESTAMP, GpsTimeStruct.SIZE, "metadata.timestamp");
        return at == WireBuffer.ABSENT ? null : new GpsTimeStruct(bb, at);
    }

    long periodNumber()
    {
        return u64(PERIOD_NUMBER, "metadata.periodNumber");
    }

    int protonsPerPulse()
    {
        return u8(PROTONS_PER_PULSE, "metadata.protonsPerPulse");
    }

    /**
     * Returns the raw boolean byte, so that values other than 0 and 1 can be rejected.
     */
    int runningByte()
    {
        return u8(RUNNING, "metadata.running");
    }

    long frameNumber()
    {
        return u32(FRAME_NUMBER, "metadata.frameNumber");
    }

    int vetoFlags()
    {
        return u16(VETO_FLAGS, "metadata.vetoFlags");
    }
}
