package com.questrail.streaming.digitizer.model;

import com.questrail.streaming.digitizer.TestMessages;
import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EventListMessageTest
{
    @Test
    void eventsAreReadAcrossAlignedSequences()
    {
        EventListMessage message = TestMessages.eventList();

        assertEquals(3, message.eventCount());
        assertEquals(new DetectedEvent(0xFFFF_FFFFL, 300, 3), message.event(2));
        assertEquals(MessageKind.EVENT_LIST, message.kind());
    }

    @Test
    void misalignedSequencesHaveNoEventCount()
    {
        EventListMessage message = EventListMessage.of(
                0, TestMessages.metadata(1), new long[] { 1, 2 }, new int[] { 1 }, new long[] { 1, 2 });

        assertFalse(message.hasAlignedSequences());
        assertThrows(IllegalStateException.class, message::eventCount);
    }

    @Test
    void metadataIsRequired()
    {
        assertThrows(MissingRequiredFieldException.class,
                () -> new EventListMessage(0, null, UInt32Vector.empty(), UInt16Vector.empty(), UInt32Vector.empty()));
        assertThrows(MissingRequiredFieldException.class,
                () -> new AnalogTraceMessage(0, null, 1, List.of()));
    }

    @Test
    void digitizerIdMustFitInOneByte()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new EventListMessage(256, TestMessages.metadata(1),
                        UInt32Vector.empty(), UInt16Vector.empty(), UInt32Vector.empty()));
    }

    @Test
    void analogTraceLooksUpFirstTraceForChannel()
    {
        AnalogTraceMessage message = TestMessages.analogTrace();

        assertEquals(UInt16Vector.of(10, 20), message.channel(5).orElseThrow().voltage());
        assertTrue(message.channel(4).isEmpty());
    }
}
