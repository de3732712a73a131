package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.FlatBufferBuilder;
import com.questrail.streaming.digitizer.codec.DigitizerMessageCodec;
import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.codec.ValidationReport;
import com.questrail.streaming.digitizer.codec.Violation;
import com.questrail.streaming.digitizer.config.DigitizerCodecConfig;
import com.questrail.streaming.digitizer.error.LengthMismatchException;
import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import com.questrail.streaming.digitizer.model.EventListMessage;
import com.questrail.streaming.digitizer.model.FrameMetadata;
import com.questrail.streaming.digitizer.model.MessageKind;
import com.questrail.streaming.digitizer.model.UInt16Vector;
import com.questrail.streaming.digitizer.model.UInt32Vector;
import io.netty.buffer.ByteBuf;

import java.util.List;
import java.util.Objects;

/**
 * EventListMessageCodec
 * -----------------------------------------------------------------------------
 * Codec for digitizer event lists, format identifier {@code "dev2"}.
 *
 * <p>The parallel time, voltage and channel sequences must agree in length.
 * This is enforced twice:</p>
 * <ul>
 *   <li>on encode, before the message is built</li>
 *   <li>on decode, because a corrupted or hand-crafted buffer can disagree
 *       even though this encoder never produces one</li>
 * </ul>
 */
public final class EventListMessageCodec implements DigitizerMessageCodec<EventListMessage>
{
    private final DigitizerCodecConfig config;

    public EventListMessageCodec()
    {
        this(DigitizerCodecConfig.defaults());
    }

    public EventListMessageCodec(DigitizerCodecConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public MessageKind kind()
    {
        return MessageKind.EVENT_LIST;
    }

    /**
     * Encodes raw per-event arrays as produced by the digitizer interface.
     *
     * @throws LengthMismatchException if the arrays differ in length; nothing is allocated
     */
    public ByteBuf encode(int digitizerId,
                          FrameMetadata metadata,
                          long[] time,
                          int[] voltage,
                          long[] channel)
    {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(voltage, "voltage");
        Objects.requireNonNull(channel, "channel");

        if (time.length != voltage.length || time.length != channel.length) {
            throw new LengthMismatchException(time.length, voltage.length, channel.length);
        }
        return encode(EventListMessage.of(digitizerId, metadata, time, voltage, channel));
    }

    @Override
    public ByteBuf encode(EventListMessage message)
    {
        Objects.requireNonNull(message, "message");

        if (!message.hasAlignedSequences()) {
            throw mismatch(message.time(), message.voltage(), message.channel());
        }

        final FlatBufferBuilder builder = new FlatBufferBuilder(VectorCodec.initialCapacity(
                (long) message.time().size() * (2 * UInt32Vector.ELEMENT_SIZE + UInt16Vector.ELEMENT_SIZE)));

        final int time = VectorCodec.create(builder, message.time());
        final int voltage = VectorCodec.create(builder, message.voltage());
        final int channel = VectorCodec.create(builder, message.channel());
        final int metadata = FrameMetadataCodec.create(builder, message.metadata());

        builder.startTable(EventListTable.FIELD_COUNT);
        builder.addOffset(EventListTable.CHANNEL, channel, 0);
        builder.addOffset(EventListTable.VOLTAGE, voltage, 0);
        builder.addOffset(EventListTable.TIME, time, 0);
        builder.addOffset(EventListTable.METADATA, metadata, 0);
        builder.addByte(EventListTable.DIGITIZER_ID, (byte) message.digitizerId(), 0);
        final int root = builder.endTable();
        builder.required(root, WireLayout.vtableOffset(EventListTable.METADATA));
        builder.finish(root, MessageKind.EVENT_LIST.identifier());

        return WireLayout.copyFinished(builder, config.allocator());
    }

    @Override
    public EventListMessage decode(ByteBuf buffer)
    {
        return decode(buffer, config.defaultOwnership());
    }

    @Override
    public EventListMessage decode(ByteBuf buffer, Ownership ownership)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(ownership, "ownership");

        final EventListTable table = EventListTable.root(WireBuffer.of(buffer));

        final FrameMetadataTable metadataTable = table.metadata();
        if (metadataTable == null) {
            throw new MissingRequiredFieldException("metadata");
        }
        final FrameMetadata metadata = FrameMetadataCodec.read(metadataTable);

        final UInt32Vector time = table.time(ownership);
        final UInt16Vector voltage = table.voltage(ownership);
        final UInt32Vector channel = table.channel(ownership);

        if (time.size() != voltage.size() || time.size() != channel.size()) {
            throw mismatch(time, voltage, channel);
        }
        return new EventListMessage(table.digitizerId(), metadata, time, voltage, channel);
    }

    @Override
    public ValidationReport validate(EventListMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (message.hasAlignedSequences()) {
            return ValidationReport.ok();
        }
        return ValidationReport.of(List.of(Violation.error(
                Violation.Code.LENGTH_MISMATCH,
                mismatch(message.time(), message.voltage(), message.channel()).getMessage())));
    }

    private static LengthMismatchException mismatch(UInt32Vector time, UInt16Vector voltage, UInt32Vector channel)
    {
        return new LengthMismatchException(time.size(), voltage.size(), channel.size());
    }
}
