package com.questrail.streaming.digitizer.synthetic;

import com.questrail.streaming.digitizer.config.SyntheticTraceConfig;
import com.questrail.streaming.digitizer.internal.time.SystemWallClock;
import com.questrail.streaming.digitizer.internal.time.WallClock;
import com.questrail.streaming.digitizer.model.AnalogTraceMessage;
import com.questrail.streaming.digitizer.model.ChannelTrace;
import com.questrail.streaming.digitizer.model.FrameMetadata;
import com.questrail.streaming.digitizer.model.GpsTime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * SyntheticTraceGenerator
 * -----------------------------------------------------------------------------
 * Deterministic producer of analog trace frames for throughput testing.
 *
 * <p>Each frame carries {@code channelCount} channels numbered from 0. Every
 * sample holds the configured fill value except two markers that let a
 * consumer check what arrived:</p>
 * <ul>
 *   <li>sample 0 holds the low 16 bits of the frame number</li>
 *   <li>sample 1 holds the digitizer id</li>
 * </ul>
 *
 * <p>Frame numbers start at the configured value and increase by one per
 * frame, wrapping at 32 bits. The generator only builds messages; encoding and
 * publishing them is the caller's business.</p>
 *
 * <p>Not thread-safe: the frame counter is per-stream state, as it is on a
 * real digitizer.</p>
 */
public final class SyntheticTraceGenerator
{
    private final SyntheticTraceConfig config;
    private final WallClock clock;
    private long nextFrameNumber;

    public SyntheticTraceGenerator(SyntheticTraceConfig config)
    {
        this(config, SystemWallClock.INSTANCE);
    }

    public SyntheticTraceGenerator(SyntheticTraceConfig config, WallClock clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nextFrameNumber = config.startFrame();
    }

    /**
     * Returns the frame number the next call to {@link #nextFrame()} will use.
     */
    public long nextFrameNumber()
    {
        return nextFrameNumber;
    }

    /**
     * Builds the next frame, stamped with the clock's current time.
     */
    public AnalogTraceMessage nextFrame()
    {
        final long frameNumber = nextFrameNumber;
        nextFrameNumber = (nextFrameNumber + 1) & FrameMetadata.MAX_FRAME_NUMBER;

        final FrameMetadata metadata = FrameMetadata.builder()
                .withTimestamp(GpsTime.fromInstant(clock.now()))
                .withFrameNumber(frameNumber)
                .withPeriodNumber(0)
                .withProtonsPerPulse(0)
                .withRunning(true)
                .withVetoFlags(0)
                .build();

        final int[] samples = new int[config.measurementsPerFrame()];
        Arrays.fill(samples, config.fillValue());
        samples[0] = (int) (frameNumber & 0xFFFF);
        samples[1] = config.digitizerId();

        final List<ChannelTrace> channels = new ArrayList<>(config.channelCount());
        for (int channel = 0; channel < config.channelCount(); channel++) {
            channels.add(ChannelTrace.of(channel, samples));
        }

        return new AnalogTraceMessage(config.digitizerId(), metadata, config.sampleRate(), channels);
    }
}
