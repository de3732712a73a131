package com.questrail.streaming.digitizer.model;

import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;

/**
 * Per-frame descriptor shared by both digitizer message kinds.
 *
 * <p>{@code frameNumber} increases monotonically within one digitizer's stream
 * but is not unique across digitizers. It is always supplied by the producer.</p>
 *
 * @param timestamp       GPS time of the frame, required
 * @param periodNumber    64-bit unsigned period counter (read with {@link Long#toUnsignedString(long)})
 * @param protonsPerPulse 8-bit unsigned
 * @param running         whether the frame belongs to an active run
 * @param frameNumber     32-bit unsigned sequence id
 * @param vetoFlags       16-bit veto bitmask, 0 when no veto applies
 */
public record FrameMetadata(
        GpsTime timestamp,
        long periodNumber,
        int protonsPerPulse,
        boolean running,
        long frameNumber,
        int vetoFlags
) {
    public static final long MAX_FRAME_NUMBER = 0xFFFF_FFFFL;

    public FrameMetadata {
        if (timestamp == null) {
            throw new MissingRequiredFieldException("metadata.timestamp");
        }
        if (protonsPerPulse < 0 || protonsPerPulse > 0xFF) {
            throw new IllegalArgumentException("protonsPerPulse must be in range 0-255 (was " + protonsPerPulse + ")");
        }
        if (frameNumber < 0 || frameNumber > MAX_FRAME_NUMBER) {
            throw new IllegalArgumentException("frameNumber must fit in 32 unsigned bits (was " + frameNumber + ")");
        }
        if (vetoFlags < 0 || vetoFlags > 0xFFFF) {
            throw new IllegalArgumentException("vetoFlags must fit in 16 bits (was " + vetoFlags + ")");
        }
    }

    /**
     * Returns true if any veto bit is set.
     */
    public boolean isVetoed() {
        return vetoFlags != 0;
    }

    /**
     * Returns true if veto bit {@code bit} (0-15) is set.
     */
    public boolean hasVetoBit(int bit) {
        if (bit < 0 || bit > 15) {
            throw new IllegalArgumentException("Veto bit must be in range 0-15 (was " + bit + ")");
        }
        return (vetoFlags & (1 << bit)) != 0;
    }

    @Override
    public String toString() {
        return "FrameMetadata[" +
                "timestamp=" + timestamp +
                ", periodNumber=" + Long.toUnsignedString(periodNumber) +
                ", protonsPerPulse=" + protonsPerPulse +
                ", running=" + running +
                ", frameNumber=" + frameNumber +
                ", vetoFlags=0x" + Integer.toHexString(vetoFlags) +
                ']';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private GpsTime timestamp;
        private long periodNumber;
        private int protonsPerPulse;
        private boolean running = true;
        private long frameNumber;
        private int vetoFlags;

        public Builder withTimestamp(GpsTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder withPeriodNumber(long periodNumber) {
            this.periodNumber = periodNumber;
            return this;
        }

        public Builder withProtonsPerPulse(int protonsPerPulse) {
            this.protonsPerPulse = protonsPerPulse;
            return this;
        }

        public Builder withRunning(boolean running) {
            this.running = running;
            return this;
        }

        public Builder withFrameNumber(long frameNumber) {
            this.frameNumber = frameNumber;
            return this;
        }

        public Builder withVetoFlags(int vetoFlags) {
            this.vetoFlags = vetoFlags;
            return this;
        }

        public FrameMetadata build() {
            return new FrameMetadata(timestamp, periodNumber, protonsPerPulse, running, frameNumber, vetoFlags);
        }
    }
}
