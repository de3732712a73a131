package com.questrail.streaming.digitizer.codec.impl;

import io.netty.buffer.ByteBuf;

import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * Walks a finished FlatBuffer by raw offsets, without the readers under test.
 * All positions are absolute buffer indices.
 */
final class FlatBufferLayout
{
    private final ByteBuf buffer;

    FlatBufferLayout(ByteBuf buffer)
    {
        this.buffer = buffer;
    }

    static int slot(int field)
    {
        return 4 + 2 * field;
    }

    int root()
    {
        return buffer.getIntLE(0);
    }

    int vtable(int table)
    {
        return table - buffer.getIntLE(table);
    }

    /**
     * Table-relative position of a field, 0 when the field is absent.
     */
    int fieldOffset(int table, int field)
    {
        final int vtable = vtable(table);
        final int slot = slot(field);
        return slot < buffer.getUnsignedShortLE(vtable) ? buffer.getUnsignedShortLE(vtable + slot) : 0;
    }

    int field(int table, int field)
    {
        final int offset = fieldOffset(table, field);
        assertNotEquals(0, offset, "field " + field + " is absent");
        return table + offset;
    }

    /**
     * Follows the reference stored in a field to the table or vector it names.
     */
    int reference(int table, int field)
    {
        final int at = field(table, field);
        return at + buffer.getIntLE(at);
    }

    /**
     * Zeroes the field's vtable slot. Vtables are shared between identical
     * tables, so only use this on tables with a vtable of their own.
     */
    void clearField(int table, int field)
    {
        buffer.setShortLE(vtable(table) + slot(field), 0);
    }
}
