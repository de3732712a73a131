package com.questrail.streaming.digitizer.model;

import java.util.Objects;

/**
 * Raw waveform captured on one detector channel.
 *
 * @param channel facility-assigned channel number (32-bit unsigned, not an index)
 * @param voltage sampled voltages in acquisition order
 */
public record ChannelTrace(long channel, UInt16Vector voltage)
{
    public ChannelTrace {
        if (channel < 0 || channel > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Channel number must fit in 32 unsigned bits (was " + channel + ")");
        }
        Objects.requireNonNull(voltage, "voltage");
    }

    public static ChannelTrace of(long channel, int... samples) {
        return new ChannelTrace(channel, UInt16Vector.of(samples));
    }

    public ChannelTrace owned() {
        return voltage.isBorrowed() ? new ChannelTrace(channel, voltage.owned()) : this;
    }
}
