package com.questrail.streaming.digitizer.codec.impl;

import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.model.MessageKind;
import com.questrail.streaming.digitizer.model.UInt16Vector;
import com.questrail.streaming.digitizer.model.UInt32Vector;

/**
 * Reader for the {@code DigitizerEventListMessage} root table.
 */
final class EventListTable extends WireTable
{
    static final int FIELD_COUNT = 5;

    static final int DIGITIZER_ID = 0;
    static final int METADATA = 1;
    static final int TIME = 2;
    static final int VOLTAGE = 3;
    static final int CHANNEL = 4;

    private EventListTable(WireBuffer wire, int position)
    {
        super(wire, position, "event list");
    }

    /**
     * Checks the {@code "dev2"} identifier and opens the root table.
     */
    static EventListTable root(WireBuffer wire)
    {
        wire.checkIdentifier(MessageKind.EVENT_LIST);
        return new EventListTable(wire, wire.rootTable());
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

    UInt32Vector time(Ownership ownership)
    {
        return uint32Vector(TIME, ownership, "time");
    }

    UInt16Vector voltage(Ownership ownership)
    {
        return uint16Vector(VOLTAGE, ownership, "voltage");
    }

    UInt32Vector channel(Ownership ownership)
    {
        return uint32Vector(CHANNEL, ownership, "channel");
    }
}
