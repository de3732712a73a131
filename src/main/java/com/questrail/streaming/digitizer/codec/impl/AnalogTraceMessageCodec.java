package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.FlatBufferBuilder;
import com.questrail.streaming.digitizer.codec.DigitizerMessageCodec;
import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.codec.ValidationReport;
import com.questrail.streaming.digitizer.codec.Violation;
import com.questrail.streaming.digitizer.config.DigitizerCodecConfig;
import com.questrail.streaming.digitizer.error.DuplicateChannelException;
import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import com.questrail.streaming.digitizer.error.ZeroSampleRateException;
import com.questrail.streaming.digitizer.model.AnalogTraceMessage;
import com.questrail.streaming.digitizer.model.ChannelTrace;
import com.questrail.streaming.digitizer.model.FrameMetadata;
import com.questrail.streaming.digitizer.model.MessageKind;
import com.questrail.streaming.digitizer.model.UInt16Vector;
import io.netty.buffer.ByteBuf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * AnalogTraceMessageCodec
 * -----------------------------------------------------------------------------
 * Codec for digitizer analog traces, format identifier {@code "dat2"}.
 *
 * <p>Policy applied on top of the wire layout:</p>
 * <ul>
 *   <li>A sample rate of zero is never encoded ({@link ZeroSampleRateException}).</li>
 *   <li>Repeated channel numbers are logged and encoded by default. With
 *       {@link DigitizerCodecConfig#strictChannels()} they are rejected with
 *       {@link DuplicateChannelException}.</li>
 *   <li>In strict mode decode applies both rules as well. Lenient decode
 *       reports what the buffer holds and leaves judgement to {@link #validate}.</li>
 * </ul>
 *
 * <p>Trace lengths are independent per channel.</p>
 */
public final class AnalogTraceMessageCodec implements DigitizerMessageCodec<AnalogTraceMessage>
{
    private static final Logger log = LoggerFactory.getLogger(AnalogTraceMessageCodec.class);

    private final DigitizerCodecConfig config;

    public AnalogTraceMessageCodec()
    {
        this(DigitizerCodecConfig.defaults());
    }

    public AnalogTraceMessageCodec(DigitizerCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.ANALOG_TRACE;
    }

    public ByteBuf encode(int digitizerId,
                          FrameMetadata metadata,
                          long sampleRate,
                          List<ChannelTrace> channels)
    {
        if (sampleRate == 0) {
            throw new ZeroSampleRateException();
        }
        return encode(new AnalogTraceMessage(digitizerId, metadata, sampleRate, channels));
    }

    @Override
    public ByteBuf encode(AnalogTraceMessage message)
    {
        Objects.requireNonNull(message, "message");

        if (message.sampleRate() == 0) {
            throw new ZeroSampleRateException();
        }
        final Set<Long> duplicates = duplicateChannels(message.channels());
        if (!duplicates.isEmpty()) {
            if (config.strictChannels()) {
                throw new DuplicateChannelException(duplicates.iterator().next());
            }
            log.warn("Analog trace from digitizer {} frame {} repeats channel(s) {}",
                    message.digitizerId(), message.metadata().frameNumber(), duplicates);
        }

        final List<ChannelTrace> channels = message.channels();
        long samples = 0;
        for (ChannelTrace trace : channels) {
            samples += trace.voltage().size();
        }
        final FlatBufferBuilder builder = new FlatBufferBuilder(VectorCodec.initialCapacity(
                samples * UInt16Vector.ELEMENT_SIZE + 32L * channels.size()));

        final int metadata = FrameMetadataCodec.create(builder, message.metadata());

        final int[] traces = new int[channels.size()];
        for (int i = 0; i < traces.length; i++) {
            final ChannelTrace trace = channels.get(i);
            final int voltage = VectorCodec.create(builder, trace.voltage());
            builder.startTable(ChannelTraceTable.FIELD_COUNT);
            builder.addOffset(ChannelTraceTable.VOLTAGE, voltage, 0);
            builder.addInt(ChannelTraceTable.CHANNEL, (int) trace.channel(), 0);
            traces[i] = builder.endTable();
        }
        final int channelVector = VectorCodec.createOffsets(builder, traces);

        builder.startTable(AnalogTraceTable.FIELD_COUNT);
        builder.addLong(AnalogTraceTable.SAMPLE_RATE, message.sampleRate(), 0L);
        builder.addOffset(AnalogTraceTable.CHANNELS, channelVector, 0);
        builder.addOffset(AnalogTraceTable.METADATA, metadata, 0);
        builder.addByte(AnalogTraceTable.DIGITIZER_ID, (byte) message.digitizerId(), 0);
        final int root = builder.endTable();
        builder.required(root, WireLayout.vtableOffset(AnalogTraceTable.METADATA));
        builder.finish(root, MessageKind.ANALOG_TRACE.identifier());

        return WireLayout.copyFinished(builder, config.allocator());
    }

    @Override
    public AnalogTraceMessage decode(ByteBuf buffer)
    {
        return decode(buffer, config.defaultOwnership());
    }

    @Override
    public AnalogTraceMessage decode(ByteBuf buffer, Ownership ownership)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(ownership, "ownership");

        final AnalogTraceTable table = AnalogTraceTable.root(WireBuffer.of(buffer));

        final FrameMetadataTable metadataTable = table.metadata();
        if (metadataTable == null) {
            throw new MissingRequiredFieldException("metadata");
        }
        final FrameMetadata metadata = FrameMetadataCodec.read(metadataTable);
        final long sampleRate = table.sampleRate();

        final List<ChannelTraceTable> traces = table.channels();
        final List<ChannelTrace> channels = new ArrayList<>(traces.size());
        for (ChannelTraceTable trace : traces) {
            channels.add(new ChannelTrace(trace.channel(), trace.voltage(ownership)));
        }

        if (config.strictChannels()) {
            if (sampleRate == 0) {
                throw new ZeroSampleRateException();
            }
            final Set<Long> duplicates = duplicateChannels(channels);
            if (!duplicates.isEmpty()) {
                throw new DuplicateChannelException(duplicates.iterator().next());
            }
        }
        return new AnalogTraceMessage(table.digitizerId(), metadata, sampleRate, channels);
    }

    @Override
    public ValidationReport validate(AnalogTraceMessage message)
    {
        Objects.requireNonNull(message, "message");

        final List<Violation> violations = new ArrayList<>();
        if (message.sampleRate() == 0) {
            violations.add(Violation.error(Violation.Code.ZERO_SAMPLE_RATE,
                    "Sample rate must be non-zero"));
        }
        for (Long channel : duplicateChannels(message.channels())) {
            final String detail = "Channel " + channel + " appears more than once";
            violations.add(config.strictChannels()
                    ? Violation.error(Violation.Code.DUPLICATE_CHANNEL, detail)
                    : Violation.warning(Violation.Code.DUPLICATE_CHANNEL, detail));
        }
        return ValidationReport.of(violations);
    }

    /**
     * Returns each channel number that occurs more than once, in first-repeat order.
     */
    private static Set<Long> duplicateChannels(List<ChannelTrace> channels)
    {
        final Set<Long> seen = new HashSet<>();
        final Set<Long> duplicates = new LinkedHashSet<>();
        for (ChannelTrace trace : channels) {
            if (!seen.add(trace.channel())) {
                duplicates.add(trace.channel());
            }
        }
        return duplicates;
    }
}
