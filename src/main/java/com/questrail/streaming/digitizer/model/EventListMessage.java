package com.questrail.streaming.digitizer.model;

import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;

import java.util.Objects;

/**
 * Digitizer output as discrete detected events.
 *
 * <p>Index {@code i} of {@code time}, {@code voltage} and {@code channel}
 * describes one event. The record itself accepts sequences of unequal length so
 * that producers can assemble a message before validating it; the codec
 * refuses to encode or decode such a message.</p>
 *
 * @param digitizerId 8-bit identifier of the source digitizer
 * @param metadata    frame metadata, required
 * @param time        nanoseconds since frame start
 * @param voltage     measured voltages
 * @param channel     channel numbers
 */
public record EventListMessage(
        int digitizerId,
        FrameMetadata metadata,
        UInt32Vector time,
        UInt16Vector voltage,
        UInt32Vector channel
) implements DigitizerMessage
{
    public EventListMessage {
        checkDigitizerId(digitizerId);
        if (metadata == null) {
            throw new MissingRequiredFieldException("metadata");
        }
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(voltage, "voltage");
        Objects.requireNonNull(channel, "channel");
    }

    public static EventListMessage of(int digitizerId,
                                      FrameMetadata metadata,
                                      long[] time,
                                      int[] voltage,
                                      long[] channel) {
        return new EventListMessage(
                digitizerId,
                metadata,
                UInt32Vector.of(time),
                UInt16Vector.of(voltage),
                UInt32Vector.of(channel));
    }

    @Override
    public MessageKind kind() {
        return MessageKind.EVENT_LIST;
    }

    /**
     * Returns true if all three sequences have the same length.
     */
    public boolean hasAlignedSequences() {
        return time.size() == voltage.size() && time.size() == channel.size();
    }

    /**
     * Returns the number of events.
     *
     * @throws IllegalStateException if the sequences are not aligned
     */
    public int eventCount() {
        if (!hasAlignedSequences()) {
            throw new IllegalStateException("Event sequences are not aligned: time=" + time.size()
                    + ", voltage=" + voltage.size() + ", channel=" + channel.size());
        }
        return time.size();
    }

    public DetectedEvent event(int index) {
        Objects.checkIndex(index, eventCount());
        return new DetectedEvent(time.get(index), voltage.get(index), channel.get(index));
    }

    @Override
    public EventListMessage owned() {
        return new EventListMessage(digitizerId, metadata, time.owned(), voltage.owned(), channel.owned());
    }

    static void checkDigitizerId(int digitizerId) {
        if (digitizerId < 0 || digitizerId > 0xFF) {
            throw new IllegalArgumentException("digitizerId must be in range 0-255 (was " + digitizerId + ")");
        }
    }
}
