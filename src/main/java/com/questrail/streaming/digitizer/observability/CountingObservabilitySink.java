package com.questrail.streaming.digitizer.observability;

import com.questrail.streaming.digitizer.error.ErrorKind;
import com.questrail.streaming.digitizer.model.MessageKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe counters of received messages by {@link MessageKind} and of
 * decode failures by {@link ErrorKind}.
 *
 * <p>Unknown buffers are counted as received messages of kind
 * {@link MessageKind#UNKNOWN}, not as failures.</p>
 */
public final class CountingObservabilitySink implements CodecObservabilitySink {
    private final Map<MessageKind, LongAdder> received = new EnumMap<>(MessageKind.class);
    private final Map<ErrorKind, LongAdder> failures = new EnumMap<>(ErrorKind.class);

    public CountingObservabilitySink() {
        for (MessageKind kind : MessageKind.values()) {
            received.put(kind, new LongAdder());
        }
        for (ErrorKind kind : ErrorKind.values()) {
            failures.put(kind, new LongAdder());
        }
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        received.get(event.kind()).increment();
    }

    @Override
    public void onUnknownMessage(UnknownMessageEvent event) {
        received.get(MessageKind.UNKNOWN).increment();
    }

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        failures.get(event.errorKind()).increment();
    }

    public long received(MessageKind kind) {
        return received.get(kind).sum();
    }

    public long failures(ErrorKind kind) {
        return failures.get(kind).sum();
    }

    public long totalFailures() {
        return failures.values().stream().mapToLong(LongAdder::sum).sum();
    }
}
