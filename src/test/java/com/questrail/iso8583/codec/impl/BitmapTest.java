package com.questrail.iso8583.codec.impl;

import com.questrail.iso8583.codec.IsoDecodeException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BitmapTest
{
    @Test
    void primaryBitmapForLowFields()
    {
        byte[] bitmap = Bitmap.forFields(List.of(0, 2, 3));

        assertEquals(Bitmap.PRIMARY_BYTES, bitmap.length);
        assertEquals("6000000000000000", Bitmap.toHex(bitmap));
    }

    @Test
    void secondaryBitmapForcesBitOne()
    {
        byte[] bitmap = Bitmap.forFields(List.of(0, 3, 70));

        assertEquals(Bitmap.FULL_BYTES, bitmap.length);
        assertTrue(Bitmap.isSet(bitmap, 1));
        assertTrue(Bitmap.isSet(bitmap, 70));
        assertEquals("A0000000000000000400000000000000", Bitmap.toHex(bitmap));
    }

    @Test
    void fieldOneIsNeverFlaggedDirectly()
    {
        byte[] bitmap = Bitmap.forFields(List.of(0, 1, 3));
        assertFalse(Bitmap.isSet(bitmap, 1));
    }

    @Test
    void lastFieldOfEachHalf()
    {
        byte[] bitmap = Bitmap.forFields(List.of(64, 128));

        assertEquals("80000000000000010000000000000001", Bitmap.toHex(bitmap));
    }

    @Test
    void fieldsBeyondBitmapAreAbsent()
    {
        byte[] primary = Bitmap.fromHex("FFFFFFFFFFFFFFFF");
        assertTrue(Bitmap.isSet(primary, 64));
        assertFalse(Bitmap.isSet(primary, 65));
    }

    @Test
    void fromHexAcceptsEitherCase()
    {
        assertArrayEquals(Bitmap.fromHex("A0FF"), Bitmap.fromHex("a0ff"));
    }

    @Test
    void fromHexRejectsOddLength()
    {
        assertThrows(IsoDecodeException.class, () -> Bitmap.fromHex("ABC"));
    }

    @Test
    void hexIsUppercaseAndReversible()
    {
        byte[] bitmap = { (byte) 0xAB, 0x01, (byte) 0xFF, 0x00, 0x10, 0x20, 0x30, (byte) 0xC4 };

        assertEquals("AB01FF00102030C4", Bitmap.toHex(bitmap));
        assertArrayEquals(bitmap, Bitmap.fromHex("ab01ff00102030c4"));
    }

    @Test
    void fromHexKeepsParseFailureAsCause()
    {
        IsoDecodeException e = assertThrows(IsoDecodeException.class, () -> Bitmap.fromHex("0G"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void fromHexRejectsNonHex()
    {
        assertThrows(IsoDecodeException.class, () -> Bitmap.fromHex("ZZ00000000000000"));
    }
}
