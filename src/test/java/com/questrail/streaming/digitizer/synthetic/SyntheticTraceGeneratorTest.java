package com.questrail.streaming.digitizer.synthetic;

import com.questrail.streaming.digitizer.codec.impl.AnalogTraceMessageCodec;
import com.questrail.streaming.digitizer.config.SyntheticTraceConfig;
import com.questrail.streaming.digitizer.internal.time.WallClock;
import com.questrail.streaming.digitizer.model.AnalogTraceMessage;
import com.questrail.streaming.digitizer.model.ChannelTrace;
import com.questrail.streaming.digitizer.model.GpsTime;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class SyntheticTraceGeneratorTest
{
    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00.000000500Z");
    private static final WallClock FIXED_CLOCK = () -> NOW;

    @Test
    void defaultFrameShape()
    {
        SyntheticTraceGenerator generator = new SyntheticTraceGenerator(
                SyntheticTraceConfig.builder().withDigitizerId(3).build(), FIXED_CLOCK);

        AnalogTraceMessage frame = generator.nextFrame();

        assertEquals(3, frame.digitizerId());
        assertEquals(1_000_000_000L, frame.sampleRate());
        assertEquals(8, frame.channels().size());
        assertEquals(GpsTime.fromInstant(NOW), frame.metadata().timestamp());
        assertEquals(0, frame.metadata().frameNumber());
        assertTrue(frame.metadata().running());

        for (int i = 0; i < 8; i++) {
            ChannelTrace trace = frame.channels().get(i);
            assertEquals(i, trace.channel());
            assertEquals(20_000, trace.voltage().size());
            assertEquals(404, trace.voltage().get(2));
            assertEquals(404, trace.voltage().get(19_999));
        }
    }

    @Test
    void markersCarryFrameNumberAndDigitizerId()
    {
        SyntheticTraceGenerator generator = new SyntheticTraceGenerator(
                SyntheticTraceConfig.builder()
                        .withDigitizerId(9)
                        .withStartFrame(0x1_2345L)
                        .withMeasurementsPerFrame(4)
                        .withChannelCount(2)
                        .build(),
                FIXED_CLOCK);

        AnalogTraceMessage frame = generator.nextFrame();

        assertArrayEquals(new int[] { 0x2345, 9, 404, 404 }, frame.channels().get(1).voltage().toArray());
        assertEquals(0x1_2345L, frame.metadata().frameNumber());
    }

    @Test
    void frameNumbersIncreaseAndWrapAt32Bits()
    {
        SyntheticTraceGenerator generator = new SyntheticTraceGenerator(
                SyntheticTraceConfig.builder()
                        .withStartFrame(0xFFFF_FFFEL)
                        .withMeasurementsPerFrame(2)
                        .withChannelCount(1)
                        .build(),
                FIXED_CLOCK);

        assertEquals(0xFFFF_FFFEL, generator.nextFrame().metadata().frameNumber());
        assertEquals(0xFFFF_FFFFL, generator.nextFrame().metadata().frameNumber());
        assertEquals(0, generator.nextFrameNumber());
        assertEquals(0, generator.nextFrame().metadata().frameNumber());
        assertEquals(1, generator.nextFrameNumber());
    }

    @Test
    void generatedFramesAreEncodable()
    {
        SyntheticTraceGenerator generator = new SyntheticTraceGenerator(
                SyntheticTraceConfig.builder().withMeasurementsPerFrame(100).build(), FIXED_CLOCK);
        AnalogTraceMessageCodec codec = new AnalogTraceMessageCodec();

        AnalogTraceMessage frame = generator.nextFrame();

        assertTrue(codec.validate(frame).isValid());
        assertEquals(frame, codec.decode(codec.encodeToBytes(frame)));
    }

    @Test
    void noChannelsIsAllowed()
    {
        SyntheticTraceGenerator generator = new SyntheticTraceGenerator(
                SyntheticTraceConfig.builder().withChannelCount(0).build(), FIXED_CLOCK);

        assertTrue(generator.nextFrame().channels().isEmpty());
    }
}
