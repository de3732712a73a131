package com.questrail.streaming.digitizer.model;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class UIntVectorTest
{
    @Test
    void ownedVectorsHoldFullUnsignedRange()
    {
        UInt32Vector u32 = UInt32Vector.of(0, 1, 0xFFFF_FFFFL);
        UInt16Vector u16 = UInt16Vector.of(0, 1, 0xFFFF);

        assertArrayEquals(new long[] { 0, 1, 0xFFFF_FFFFL }, u32.toArray());
        assertArrayEquals(new int[] { 0, 1, 0xFFFF }, u16.toArray());
        assertFalse(u32.isBorrowed());
        assertFalse(u16.isBorrowed());
    }

    @Test
    void rejectsValuesOutsideUnsignedRange()
    {
        assertThrows(IllegalArgumentException.class, () -> UInt32Vector.of(-1));
        assertThrows(IllegalArgumentException.class, () -> UInt32Vector.of(0x1_0000_0000L));
        assertThrows(IllegalArgumentException.class, () -> UInt16Vector.of(0x1_0000));
    }

    @Test
    void viewSharesBytesWithSource()
    {
        ByteBuf source = Unpooled.buffer(8);
        source.writeShortLE(7).writeShortLE(8).writeShortLE(9);

        UInt16Vector view = UInt16Vector.view(source, 2, 2);
        assertTrue(view.isBorrowed());
        assertArrayEquals(new int[] { 8, 9 }, view.toArray());

        source.setShortLE(2, 80);
        assertEquals(80, view.get(0));
    }

    @Test
    void ownedCopySurvivesSourceRelease()
    {
        ByteBuf source = Unpooled.directBuffer(8);
        source.writeIntLE(123).writeIntLE(456);

        UInt32Vector borrowed = UInt32Vector.view(source, 0, 2);
        UInt32Vector owned = borrowed.owned();
        source.release();

        assertFalse(owned.isBorrowed());
        assertArrayEquals(new long[] { 123, 456 }, owned.toArray());
    }

    @Test
    void equalityComparesContentsOnly()
    {
        ByteBuf source = Unpooled.buffer(8);
        source.writeIntLE(5).writeIntLE(6);

        assertEquals(UInt32Vector.of(5, 6), UInt32Vector.view(source, 0, 2));
        assertEquals(UInt32Vector.of(5, 6).hashCode(), UInt32Vector.view(source, 0, 2).hashCode());
        assertNotEquals(UInt32Vector.of(5, 6), UInt32Vector.of(6, 5));
        assertEquals(UInt16Vector.empty(), UInt16Vector.of());
    }

    @Test
    void getChecksBounds()
    {
        UInt16Vector vector = UInt16Vector.of(1, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> vector.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> vector.get(-1));
    }
}
