package com.questrail.streaming.digitizer.codec.impl;

import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import com.questrail.streaming.digitizer.model.MessageKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Reader for the {@code DigitizerAnalogTraceMessage} root table.
 */
final class AnalogTraceTable extends WireTable
{
    static final int FIELD_COUNT = 4;

    static final int DIGITIZER_ID = 0;
    static final int METADATA = 1;
    static final int SAMPLE_RATE = 2;
    static final int CHANNELS = 3;

    private AnalogTraceTable(WireBuffer wire, int position)
    {
        super(wire, position, "analog trace");
    }

    /**
     * Checks the {@code "dat2"} identifier and opens the root table.
     */
    static AnalogTraceTable root(WireBuffer wire)
    {
        wire.checkIdentifier(MessageKind.ANALOG_TRACE);
        return new AnalogTraceTable(wire, wire.rootTable());
    }

    int digitizerId()
    {
        return u8(DIGITIZER_ID, "digitizerId");
    }

    /**
     * Returns the metadata table, or null if the field is not set.
     */
    FrameMetadataTable metadata()
    {
        final int at = reference(METADATA, "metadata");
        return at == WireBuffer.ABSENT ? null : new FrameMetadataTable(wire, at);
    }

    long sampleRate()
    {
        return u64(SAMPLE_RATE, "sampleRate");
    }

    /**
     * Opens every channel trace table in wire order. An absent vector reads as
     * no channels.
     *
     * @throws MissingRequiredFieldException if an element offset is zero
     */
    List<ChannelTraceTable> channels()
    {
        final int vector = reference(CHANNELS, "channels");
        if (vector == WireBuffer.ABSENT) {
            return List.of();
        }
        final int count = wire.vectorLength(vector, WireLayout.UOFFSET_SIZE, "channels");

        final List<ChannelTraceTable> traces = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final String name = "channels[" + i + "]";
            final int element = vector + WireLayout.UOFFSET_SIZE + i * WireLayout.UOFFSET_SIZE;
            // A zero offset would point at itself; no builder writes one.
            if (wire.u32(element, name) == 0) {
                throw new MissingRequiredFieldException(name);
            }
            traces.add(new ChannelTraceTable(wire, wire.reference(element, name), name));
        }
        return traces;
    }
}
