package com.questrail.streaming.digitizer.config;

/**
 * Settings for the synthetic analog trace generator.
 *
 * @param digitizerId          digitizer identifier stamped on every frame (0-255)
 * @param measurementsPerFrame samples per channel per frame, at least 2
 * @param startFrame           frame number of the first generated frame
 * @param channelCount         channels per frame, numbered from 0
 * @param sampleRate           samples per second, non-zero
 * @param fillValue            voltage written to every sample not used as a marker
 */
public record SyntheticTraceConfig(
    int digitizerId,
    int measurementsPerFrame,
    long startFrame,
    int channelCount,
    long sampleRate,
    int fillValue
) {
    public SyntheticTraceConfig {
        if (digitizerId < 0 || digitizerId > 0xFF) {
            throw new IllegalArgumentException("digitizerId must be 0-255");
        }
        if (measurementsPerFrame < 2) {
            throw new IllegalArgumentException("measurementsPerFrame must be at least 2");
        }
        if (startFrame < 0 || startFrame > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("startFrame must fit in 32 unsigned bits");
        }
        if (channelCount < 0) {
            throw new IllegalArgumentException("channelCount must not be negative");
        }
        if (sampleRate == 0) {
            throw new IllegalArgumentException("sampleRate must be non-zero");
        }
        if (fillValue < 0 || fillValue > 0xFFFF) {
            throw new IllegalArgumentException("fillValue must be 0-65535");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int digitizerId = 0;
        private int measurementsPerFrame = 20_000;
        private long startFrame = 0;
        private int channelCount = 8;
        private long sampleRate = 1_000_000_000L;
        private int fillValue = 404;

        public Builder withDigitizerId(int digitizerId) {
            this.digitizerId = digitizerId;
            return this;
        }

        public Builder withMeasurementsPerFrame(int measurementsPerFrame) {
            this.measurementsPerFrame = measurementsPerFrame;
            return this;
        }

        public Builder withStartFrame(long startFrame) {
            this.startFrame = startFrame;
            return this;
        }

        public Builder withChannelCount(int channelCount) {
            this.channelCount = channelCount;
            return this;
        }

        public Builder withSampleRate(long sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder withFillValue(int fillValue) {
            this.fillValue = fillValue;
            return this;
        }

        public SyntheticTraceConfig build() {
            return new SyntheticTraceConfig(digitizerId, measurementsPerFrame, startFrame,
                    channelCount, sampleRate, fillValue);
        }
    }
}
