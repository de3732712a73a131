package com.questrail.streaming.digitizer.codec.impl;

import com.google.flatbuffers.Table;
import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.error.TruncatedBufferException;
import com.questrail.streaming.digitizer.model.MessageKind;
import com.questrail.streaming.digitizer.model.UInt16Vector;
import com.questrail.streaming.digitizer.model.UInt32Vector;

import java.nio.ByteBuffer;

/**
 * WireTable
 * -----------------------------------------------------------------------------
 * Base of the table readers: a FlatBuffers {@link Table} whose vtable, inline
 * fields and references are checked against the buffer before they are read.
 *
 * <p>Fields are addressed by schema index. An absent field reads as its schema
 * default, which is zero for every scalar in these schemas.</p>
 */
abstract class WireTable extends Table
{
    protected final WireBuffer wire;

    private final String name;
    private final int inlineSize;

    protected WireTable(WireBuffer wire, int position, String name)
    {
        this.wire = wire;
        this.name = name;

        final long vtable = (long) position - wire.i32(position, name);
        final int vtableSize = wire.u16(vtable, name + " vtable");
        this.inlineSize = wire.u16(vtable + 2, name + " vtable");
        if (vtableSize < WireLayout.VTABLE_HEADER_SIZE || vtableSize % WireLayout.VTABLE_ENTRY_SIZE != 0) {
            throw new TruncatedBufferException(name + " vtable at " + vtable + " has malformed size " + vtableSize);
        }
        wire.require(name + " vtable", vtable, vtableSize);
        wire.require(name, position, inlineSize);

        __reset(position, wire.nio());
    }

    static boolean hasIdentifier(ByteBuffer bb, MessageKind kind)
    {
        return __has_identifier(bb, kind.identifier());
    }

    protected final String name()
    {
        return name;
    }

    /**
     * Returns the buffer position of an inline field of {@code width} bytes,
     * or {@link WireBuffer#ABSENT} if the field is not set.
     */
    protected final int inline(int field, int width, String fieldName)
    {
        final int offset = __offset(WireLayout.vtableOffset(field));
        if (offset == 0) {
            return WireBuffer.ABSENT;
        }
        if (offset < WireLayout.UOFFSET_SIZE || offset + width > inlineSize) {
            throw new TruncatedBufferException(fieldName + " at table offset " + offset
                    + " lies outside the " + inlineSize + "-byte " + name + " table");
        }
        return bb_pos + offset;
    }

    protected final int u8(int field, String fieldName)
    {
        final int at = inline(field, 1, fieldName);
        return at == WireBuffer.ABSENT ? 0 : Byte.toUnsignedInt(bb.get(at));
    }

    protected final int u16(int field, String fieldName)
    {
        final int at = inline(field, 2, fieldName);
        return at == WireBuffer.ABSENT ? 0 : Short.toUnsignedInt(bb.getShort(at));
    }

    protected final long u32(int field, String fieldName)
    {
        final int at = inline(field, 4, fieldName);
        return at == WireBuffer.ABSENT ? 0 : Integer.toUnsignedLong(bb.getInt(at));
    }

    protected final long u64(int field, String fieldName)
    {
        final int at = inline(field, 8, fieldName);
        return at == WireBuffer.ABSENT ? 0 : bb.getLong(at);
    }

    /**
     * Returns the position of the table or vector a field refers to, or
     * {@link WireBuffer#ABSENT} if the field is not set.
     */
    protected final int reference(int field, String fieldName)
    {
        final int at = inline(field, WireLayout.UOFFSET_SIZE, fieldName);
        return at == WireBuffer.ABSENT ? WireBuffer.ABSENT : wire.reference(at, fieldName);
    }

    protected final UInt16Vector uint16Vector(int field, Ownership ownership, String fieldName)
    {
        final int vector = reference(field, fieldName);
        if (vector == WireBuffer.ABSENT) {
            return UInt16Vector.empty();
        }
        final int count = wire.vectorLength(vector, UInt16Vector.ELEMENT_SIZE, fieldName);
        return wire.uint16(vector + WireLayout.UOFFSET_SIZE, count, ownership);
    }

    protected final UInt32Vector uint32Vector(int field, Ownership ownership, String fieldName)
    {
        final int vector = reference(field, fieldName);
        if (vector == WireBuffer.ABSENT) {
            return UInt32Vector.empty();
        }
        final int count = wire.vectorLength(vector, UInt32Vector.ELEMENT_SIZE, fieldName);
        return wire.uint32(vector + WireLayout.UOFFSET_SIZE, count, ownership);
    }
}
