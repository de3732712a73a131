package com.questrail.streaming.digitizer.codec.impl;

import com.questrail.streaming.digitizer.TestMessages;
import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.codec.ValidationReport;
import com.questrail.streaming.digitizer.codec.Violation;
import com.questrail.streaming.digitizer.config.DigitizerCodecConfig;
import com.questrail.streaming.digitizer.error.BadIdentifierException;
import com.questrail.streaming.digitizer.error.DuplicateChannelException;
import com.questrail.streaming.digitizer.error.ErrorKind;
import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import com.questrail.streaming.digitizer.error.TruncatedBufferException;
import com.questrail.streaming.digitizer.error.ZeroSampleRateException;
import com.questrail.streaming.digitizer.model.AnalogTraceMessage;
import com.questrail.streaming.digitizer.model.ChannelTrace;
import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AnalogTraceMessageCodecTest
 * -----------------------------------------------------------------------------
 * The fixture has channels 3, 5 and 9 holding 3, 2 and 0 samples. Tables and
 * vectors are located through {@link FlatBufferLayout}.
 */
final class AnalogTraceMessageCodecTest
{
    private final AnalogTraceMessageCodec lenient = new AnalogTraceMessageCodec();
    private final AnalogTraceMessageCodec strict = new AnalogTraceMessageCodec(
            DigitizerCodecConfig.builder().withStrictChannels(true).build());

    private AnalogTraceMessage message;
    private ByteBuf encoded;
    private FlatBufferLayout layout;
    private int root;

    @BeforeEach
    void setUp()
    {
        message = TestMessages.analogTrace();
        encoded = lenient.encode(message);
        layout = new FlatBufferLayout(encoded);
        root = layout.root();
    }

    @AfterEach
    void tearDown()
    {
        if (encoded.refCnt() > 0) {
            encoded.release();
        }
    }

    private int channelElement(int index)
    {
        return layout.reference(root, 3) + 4 + 4 * index;
    }

    private int trace(int index)
    {
        int element = channelElement(index);
        return element + encoded.getIntLE(element);
    }

    @Test
    void roundTripPreservesChannelOrderAndLengths()
    {
        AnalogTraceMessage decoded = lenient.decode(encoded);

        assertEquals(message, decoded);
        assertEquals(List.of(3L, 5L, 9L), decoded.channels().stream().map(ChannelTrace::channel).toList());
        assertArrayEquals(new int[] { 1, 2, 3 }, decoded.channels().get(0).voltage().toArray());
        assertArrayEquals(new int[] { 10, 20 }, decoded.channels().get(1).voltage().toArray());
        assertTrue(decoded.channels().get(2).voltage().isEmpty());
        assertEquals(1_000_000_000L, decoded.sampleRate());
    }

    @Test
    void rootAndChannelTableLayout()
    {
        assertEquals("dat2", encoded.toString(4, 4, StandardCharsets.US_ASCII));
        assertEquals(7, encoded.getUnsignedByte(layout.field(root, 0)));
        assertEquals(1_000_000_000L, encoded.getLongLE(layout.field(root, 2)));

        int metadata = layout.reference(root, 1);
        assertEquals(2002, encoded.getUnsignedIntLE(layout.field(metadata, 4)));

        assertEquals(3, encoded.getIntLE(layout.reference(root, 3)));

        assertEquals(3, encoded.getIntLE(layout.field(trace(0), 0)));
        int voltage = layout.reference(trace(0), 1);
        assertEquals(3, encoded.getIntLE(voltage));
        assertEquals(1, encoded.getUnsignedShortLE(voltage + 4));
        assertEquals(3, encoded.getUnsignedShortLE(voltage + 8));

        assertEquals(5, encoded.getIntLE(layout.field(trace(1), 0)));
        assertEquals(9, encoded.getIntLE(layout.field(trace(2), 0)));
        assertEquals(0, encoded.getIntLE(layout.reference(trace(2), 1)));
    }

    @Test
    void channelZeroIsOmittedAndReadsBackAsZero()
    {
        AnalogTraceMessage zero = new AnalogTraceMessage(1, TestMessages.metadata(1), 100,
                List.of(ChannelTrace.of(0, 8)));

        ByteBuf buffer = lenient.encode(zero);
        try {
            FlatBufferLayout zeroLayout = new FlatBufferLayout(buffer);
            int element = zeroLayout.reference(zeroLayout.root(), 3) + 4;
            int table = element + buffer.getIntLE(element);
            assertEquals(0, zeroLayout.fieldOffset(table, 0));
            assertEquals(zero, lenient.decode(buffer));
        } finally {
            buffer.release();
        }
    }

    @Test
    void decodesProducerBuiltBuffer()
    {
        assertEquals(message, lenient.decode(ReferenceBuffers.analogTrace(1_000_000_000L)));
    }

    @Test
    void noChannelsIsAllowed()
    {
        AnalogTraceMessage empty = new AnalogTraceMessage(1, TestMessages.metadata(1), 500, List.of());

        ByteBuf buffer = lenient.encode(empty);
        try {
            FlatBufferLayout emptyLayout = new FlatBufferLayout(buffer);
            assertEquals(0, buffer.getIntLE(emptyLayout.reference(emptyLayout.root(), 3)));
            assertEquals(empty, lenient.decode(buffer));
        } finally {
            buffer.release();
        }
    }

    @Test
    void maximumUnsignedSampleRateSurvives()
    {
        AnalogTraceMessage fast = new AnalogTraceMessage(1, TestMessages.metadata(1), -1L, List.of());
        assertEquals(-1L, lenient.decode(lenient.encodeToBytes(fast)).sampleRate());
    }

    @Test
    void zeroSampleRateIsNeverEncoded()
    {
        CountingAllocator allocator = new CountingAllocator();
        AnalogTraceMessageCodec counting = new AnalogTraceMessageCodec(
                DigitizerCodecConfig.builder().withAllocator(allocator).build());

        ZeroSampleRateException e = assertThrows(ZeroSampleRateException.class,
                () -> counting.encode(7, TestMessages.metadata(1), 0, List.of(ChannelTrace.of(1, 1))));
        assertEquals(ErrorKind.ZERO_SAMPLE_RATE, e.kind());

        assertThrows(ZeroSampleRateException.class,
                () -> counting.encode(new AnalogTraceMessage(7, TestMessages.metadata(1), 0, List.of())));
        assertEquals(0, allocator.allocations());
    }

    @Test
    void duplicateChannelsAreEncodedWhenLenient()
    {
        AnalogTraceMessage repeated = new AnalogTraceMessage(1, TestMessages.metadata(1), 100,
                List.of(ChannelTrace.of(4, 1), ChannelTrace.of(4, 2)));

        AnalogTraceMessage decoded = lenient.decode(lenient.encodeToBytes(repeated));
        assertEquals(2, decoded.channels().size());
        assertEquals(1, decoded.channel(4).orElseThrow().voltage().get(0));
    }

    @Test
    void duplicateChannelsAreRejectedWhenStrict()
    {
        AnalogTraceMessage repeated = new AnalogTraceMessage(1, TestMessages.metadata(1), 100,
                List.of(ChannelTrace.of(4, 1), ChannelTrace.of(6), ChannelTrace.of(4, 2)));

        DuplicateChannelException e = assertThrows(DuplicateChannelException.class,
                () -> strict.encode(repeated));
        assertEquals(4, e.channel());

        byte[] bytes = lenient.encodeToBytes(repeated);
        assertThrows(DuplicateChannelException.class, () -> strict.decode(bytes));
    }

    @Test
    void zeroSampleRateOnWireDependsOnStrictness()
    {
        encoded.setLongLE(layout.field(root, 2), 0);

        assertEquals(0, lenient.decode(encoded).sampleRate());
        assertThrows(ZeroSampleRateException.class, () -> strict.decode(encoded));
    }

    @Test
    void absentSampleRateReadsAsZero()
    {
        ByteBuf producer = ReferenceBuffers.analogTrace(0);

        assertEquals(0, lenient.decode(producer).sampleRate());
        assertThrows(ZeroSampleRateException.class, () -> strict.decode(producer));
    }

    @Test
    void eventListBufferIsRejectedByIdentifier()
    {
        byte[] events = new EventListMessageCodec().encodeToBytes(TestMessages.eventList());

        BadIdentifierException e = assertThrows(BadIdentifierException.class, () -> lenient.decode(events));
        assertEquals("dat2", e.expected());
        assertEquals("dev2", e.found());
    }

    @Test
    void absentMetadataIsMissingRequiredField()
    {
        layout.clearField(root, 1);

        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> lenient.decode(encoded));
        assertEquals("metadata", e.field());
    }

    @Test
    void absentTimestampIsMissingRequiredField()
    {
        layout.clearField(layout.reference(root, 1), 0);

        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> lenient.decode(encoded));
        assertEquals("metadata.timestamp", e.field());
    }

    @Test
    void zeroedTraceOffsetIsMissingRequiredField()
    {
        encoded.setIntLE(channelElement(0), 0);

        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> lenient.decode(encoded));
        assertEquals("channels[0]", e.field());
    }

    @Test
    void traceOffsetPastEndIsTruncated()
    {
        encoded.setIntLE(channelElement(1), encoded.readableBytes());
        assertThrows(TruncatedBufferException.class, () -> lenient.decode(encoded));
    }

    @Test
    void absentChannelVectorDecodesAsNoChannels()
    {
        layout.clearField(root, 3);
        assertTrue(lenient.decode(encoded).channels().isEmpty());
    }

    @Test
    void oversizedTraceLengthIsTruncated()
    {
        encoded.setIntLE(layout.reference(trace(0), 1), 1_000_000);
        assertThrows(TruncatedBufferException.class, () -> lenient.decode(encoded));
    }

    @Test
    void oversizedChannelCountIsTruncated()
    {
        encoded.setIntLE(layout.reference(root, 3), 1_000_000);
        assertThrows(TruncatedBufferException.class, () -> lenient.decode(encoded));
    }

    @Test
    void truncatedBuffersAreRejected()
    {
        assertThrows(TruncatedBufferException.class, () -> lenient.decode(encoded.slice(0, 7)));
        assertThrows(TruncatedBufferException.class, () -> lenient.decode(encoded.slice(0, 10)));
        assertThrows(TruncatedBufferException.class,
                () -> lenient.decode(encoded.slice(0, encoded.readableBytes() - 1)));
    }

    @Test
    void ownedResultOutlivesReleasedBuffer()
    {
        AnalogTraceMessage owned = lenient.decode(encoded, Ownership.OWNED);
        encoded.release();

        assertEquals(TestMessages.analogTrace(), owned);
        assertFalse(owned.channels().get(0).voltage().isBorrowed());
    }

    @Test
    void borrowedTraceSeesBufferChanges()
    {
        AnalogTraceMessage borrowed = lenient.decode(encoded, Ownership.BORROWED);

        encoded.setShortLE(layout.reference(trace(0), 1) + 4, 999);
        assertEquals(999, borrowed.channels().get(0).voltage().get(0));
        assertEquals(999, borrowed.owned().channel(3).orElseThrow().voltage().get(0));
    }

    @Test
    void validateSeverityFollowsStrictness()
    {
        AnalogTraceMessage bad = new AnalogTraceMessage(1, TestMessages.metadata(1), 0,
                List.of(ChannelTrace.of(2), ChannelTrace.of(2)));

        ValidationReport lenientReport = lenient.validate(bad);
        assertFalse(lenientReport.isValid());
        assertEquals(1, lenientReport.errors().size());
        assertEquals(Violation.Code.ZERO_SAMPLE_RATE, lenientReport.errors().get(0).code());
        assertTrue(lenientReport.hasWarnings());

        ValidationReport strictReport = strict.validate(bad);
        assertEquals(2, strictReport.errors().size());
        assertTrue(strictReport.contains(Violation.Code.DUPLICATE_CHANNEL));

        assertTrue(lenient.validate(message).isValid());
    }
}
