package com.questrail.streaming.digitizer.model;

import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Digitizer output as per-channel waveforms sampled at one common rate.
 *
 * <p>Trace lengths may differ between channels. Channel numbers are expected
 * to be unique; whether a repeat is fatal is decided by the codec's
 * configuration, not by this record.</p>
 *
 * @param digitizerId 8-bit identifier of the source digitizer
 * @param metadata    frame metadata, required
 * @param sampleRate  samples per second, 64-bit unsigned
 * @param channels    channel traces in wire order
 */
public record AnalogTraceMessage(
        int digitizerId,
        FrameMetadata metadata,
        long sampleRate,
        List<ChannelTrace> channels
) implements DigitizerMessage
{
    public AnalogTraceMessage {
        EventListMessage.checkDigitizerId(digitizerId);
        if (metadata == null) {
            throw new MissingRequiredFieldException("metadata");
        }
        channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
    }

    @Override
    public MessageKind kind() {
        return MessageKind.ANALOG_TRACE;
    }

    /**
     * Returns the first trace recorded for {@code channelNumber}, if any.
     */
    public Optional<ChannelTrace> channel(long channelNumber) {
        return channels.stream()
                .filter(c -> c.channel() == channelNumber)
                .findFirst();
    }

    @Override
    public AnalogTraceMessage owned() {
        return new AnalogTraceMessage(digitizerId, metadata, sampleRate,
                channels.stream().map(ChannelTrace::owned).toList());
    }

    @Override
    public String toString() {
        return "AnalogTraceMessage[" +
                "digitizerId=" + digitizerId +
                ", metadata=" + metadata +
                ", sampleRate=" + Long.toUnsignedString(sampleRate) +
                ", channels=" + channels.size() +
                ']';
    }
}
