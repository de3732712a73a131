package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.FlatBufferBuilder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.nio.ByteBuffer;

/**
 * WireLayout
 * -----------------------------------------------------------------------------
 * FlatBuffers framing shared by both message schemas.
 *
 * <pre>
 *   0  u32 offset of the root table
 *   4  file identifier ("dev2" or "dat2")
 *   8  tables, vtables and vectors, placed by FlatBufferBuilder
 * </pre>
 *
 * <p>Every table starts with an i32 back-offset to its vtable. A vtable holds
 * its own size, the table's inline size, then one u16 per field giving the
 * field's position inside the table; zero marks the field absent and it reads
 * as its default. References to sub-tables and vectors are u32 offsets from
 * the place they are stored. A vector is a u32 element count followed by the
 * elements. All integers are little-endian.</p>
 *
 * <p>Field indices follow declaration order in the schemas under
 * {@code src/main/fbs}.</p>
 */
final class WireLayout
{
    /** Size of a u32 reference, vector length or vtable back-offset. */
    static final int UOFFSET_SIZE = 4;

    static final int VTABLE_HEADER_SIZE = 4;
    static final int VTABLE_ENTRY_SIZE = 2;

    private WireLayout() {}

    /**
     * Returns the vtable position of the field with schema index {@code field}.
     */
    static int vtableOffset(int field)
    {
        return VTABLE_HEADER_SIZE + field * VTABLE_ENTRY_SIZE;
    }

    /**
     * Copies a finished builder's bytes into a buffer from {@code allocator}.
     */
    static ByteBuf copyFinished(FlatBufferBuilder builder, ByteBufAllocator allocator)
    {
        final ByteBuffer data = builder.dataBuffer();
        final ByteBuf out = allocator.buffer(data.remaining(), data.remaining());
        out.writeBytes(data);
        return out;
    }
}
