package com.questrail.streaming.digitizer.observability;

import com.questrail.streaming.digitizer.error.BadIdentifierException;
import com.questrail.streaming.digitizer.error.ErrorKind;
import com.questrail.streaming.digitizer.error.TruncatedBufferException;
import com.questrail.streaming.digitizer.model.MessageKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class CountingObservabilitySinkTest
{
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void countsReceivedMessagesByKind()
    {
        CountingObservabilitySink sink = new CountingObservabilitySink();

        sink.onMessageReceived(new MessageReceivedEvent(T0, MessageKind.EVENT_LIST, 1, 10));
        sink.onMessageReceived(new MessageReceivedEvent(T0, MessageKind.EVENT_LIST, 1, 11));
        sink.onMessageReceived(new MessageReceivedEvent(T0, MessageKind.ANALOG_TRACE, 2, 10));
        sink.onUnknownMessage(new UnknownMessageEvent(T0, "pl72", 40));

        assertEquals(2, sink.received(MessageKind.EVENT_LIST));
        assertEquals(1, sink.received(MessageKind.ANALOG_TRACE));
        assertEquals(1, sink.received(MessageKind.UNKNOWN));
        assertEquals(0, sink.totalFailures());
    }

    @Test
    void countsFailuresByErrorKind()
    {
        CountingObservabilitySink sink = new CountingObservabilitySink();

        sink.onDecodeFailure(new DecodeFailureEvent(T0, MessageKind.EVENT_LIST,
                new TruncatedBufferException("short")));
        sink.onDecodeFailure(new DecodeFailureEvent(T0, MessageKind.ANALOG_TRACE,
                new TruncatedBufferException("short")));
        sink.onDecodeFailure(new DecodeFailureEvent(T0, MessageKind.ANALOG_TRACE,
                new BadIdentifierException("dat2", "dev2")));

        assertEquals(2, sink.failures(ErrorKind.TRUNCATED_BUFFER));
        assertEquals(1, sink.failures(ErrorKind.BAD_IDENTIFIER));
        assertEquals(0, sink.failures(ErrorKind.LENGTH_MISMATCH));
        assertEquals(3, sink.totalFailures());
    }

    @Test
    void slf4jSinkAcceptsEveryEventKind()
    {
        Slf4jCodecObservabilitySink sink = new Slf4jCodecObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onMessageReceived(new MessageReceivedEvent(T0, MessageKind.EVENT_LIST, 1, 10));
            sink.onUnknownMessage(new UnknownMessageEvent(T0, null, 2));
            sink.onDecodeFailure(new DecodeFailureEvent(T0, MessageKind.EVENT_LIST,
                    new TruncatedBufferException("short")));
            sink.onDecodeFailure(new DecodeFailureEvent(T0, MessageKind.EVENT_LIST,
                    new BadIdentifierException("dev2", "dat2")));
        });
    }
}
