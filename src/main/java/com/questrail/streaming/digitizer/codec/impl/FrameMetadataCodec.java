package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.FlatBufferBuilder;
import com.questrail.streaming.digitizer.error.InvalidFieldValueException;
import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import com.questrail.streaming.digitizer.model.FrameMetadata;
import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * FrameMetadataCodec
 * -----------------------------------------------------------------------------
 * The {@code FrameMetadataV2} table, fields in schema order:
 *
 * <pre>
 *   0  timestamp          GpsTime struct (required)
 *   1  period_number      u64
 *   2  protons_per_pulse  u8
 *   3  running            bool
 *   4  frame_number       u32
 *   5  veto_flags         u16
 * </pre>
 *
 * <p>Scalars equal to zero are omitted from the table and read back as zero.
 * Inside a message the table is referenced from the root; an absent reference
 * is reported by the message codecs, not here.</p>
 */
public final class FrameMetadataCodec
{
    private FrameMetadataCodec() {}

    /**
     * Writes {@code metadata} as a finished FlatBuffer without a file
     * identifier, at the writer index of {@code out}.
     */
    public static void encode(FrameMetadata metadata, ByteBuf out)
    {
        Objects.requireNonNull(metadata, "metadata");
        final FlatBufferBuilder builder = new FlatBufferBuilder(64);
        builder.finish(create(builder, metadata));
        out.writeBytes(builder.dataBuffer());
    }

    /**
     * Reads a finished metadata FlatBuffer starting at the reader index of
     * {@code in}. The buffer's indices are not changed.
     */
    public static FrameMetadata decode(ByteBuf in)
    {
        final WireBuffer wire = WireBuffer.of(in);
        return read(new FrameMetadataTable(wire, wire.rootTable()));
    }

    static int create(FlatBufferBuilder builder, FrameMetadata metadata)
    {
        builder.startTable(FrameMetadataTable.FIELD_COUNT);
        builder.addLong(FrameMetadataTable.PERIOD_NUMBER, metadata.periodNumber(), 0L);
        builder.addStruct(FrameMetadataTable.TIMESTAMP, GpsTimeCodec.create(builder, metadata.timestamp()), 0);
        builder.addInt(FrameMetadataTable.FRAME_NUMBER, (int) metadata.frameNumber(), 0);
        builder.addShort(FrameMetadataTable.VETO_FLAGS, (short) metadata.vetoFlags(), 0);
        builder.addByte(FrameMetadataTable.PROTONS_PER_PULSE, (byte) metadata.protonsPerPulse(), 0);
        builder.addBoolean(FrameMetadataTable.RUNNING, metadata.running(), false);
        return builder.endTable();
    }

    static FrameMetadata read(FrameMetadataTable table)
    {
        final GpsTimeStruct timestamp = table.timestamp();
        if (timestamp == null) {
            throw new MissingRequiredFieldException("metadata.timestamp");
        }

        final int running = table.runningByte();
        if (running > 1) {
            throw new InvalidFieldValueException("metadata.running",
                    "boolean byte must be 0 or 1 (was " + running + ")", null);
        }

        return new FrameMetadata(
                GpsTimeCodec.read(timestamp),
                table.periodNumber(),
                table.protonsPerPulse(),
                running == 1,
                table.frameNumber(),
                table.vetoFlags());
    }
}
