package com.questrail.iso8583.codec.impl;

import com.questrail.iso8583.codec.IsoDecodeException;
import com.questrail.iso8583.codec.MissingFieldConfigException;
import com.questrail.iso8583.codec.UnsupportedLengthTypeException;
import com.questrail.iso8583.schema.TestSchemas;

import org.junit.jupiter.api.Test;

import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultIsoMessageDecoderTest
 * -----------------------------------------------------------------------------
 * Wire-level tests for {@link DefaultIsoMessageDecoder}, including the
 * secondary bitmap policy.
 */
final class DefaultIsoMessageDecoderTest
{
    private final DefaultIsoMessageDecoder decoder = new DefaultIsoMessageDecoder(TestSchemas.payments());

    @Test
    void decodesAuthorizationRequest()
    {
        SortedMap<Integer, String> fields = decoder.decode(
                "0200" + "6000000000000000" + "16" + "4111111111111111" + "000000");

        assertEquals(4, fields.size());
        assertEquals("0200", fields.get(0));
        assertEquals("6000000000000000", fields.get(1));
        assertEquals("4111111111111111", fields.get(2));
        assertEquals("000000", fields.get(3));
    }

    @Test
    void fixedFieldsAreReturnedWithTheirPadding()
    {
        SortedMap<Integer, String> fields = decoder.decode(
                "0200" + "3000000000800000" + "123456" + "000000001500" + "TERM1   ");

        assertEquals("000000001500", fields.get(4));
        assertEquals("TERM1   ", fields.get(41));
    }

    @Test
    void secondaryBitmapIsReadWhenFlagged()
    {
        SortedMap<Integer, String> fields = decoder.decode(
                "0800" + "A000000000000000" + "0400000000000000" + "990000" + "301");

        assertEquals("A0000000000000000400000000000000", fields.get(1));
        assertEquals("990000", fields.get(3));
        assertEquals("301", fields.get(70));
    }

    @Test
    void fullWidthBitmapIsReadUpFront()
    {
        DefaultIsoMessageDecoder wide = new DefaultIsoMessageDecoder(TestSchemas.paymentsWithFullBitmap());

        SortedMap<Integer, String> fields = wide.decode(
                "0800" + "A0000000000000000400000000000000" + "990000" + "301");

        assertEquals("A0000000000000000400000000000000", fields.get(1));
        assertEquals("301", fields.get(70));
    }

    @Test
    void fullWidthBitmapCoversHighFieldsWithoutSecondaryFlag()
    {
        DefaultIsoMessageDecoder wide = new DefaultIsoMessageDecoder(TestSchemas.paymentsWithFullBitmap());

        SortedMap<Integer, String> fields = wide.decode(
                "0800" + "20000000000000000400000000000000" + "990000" + "301");

        assertEquals("301", fields.get(70));
    }

    @Test
    void lowercaseBitmapIsAccepted()
    {
        SortedMap<Integer, String> fields = decoder.decode(
                "0800" + "a000000000000000" + "0400000000000000" + "990000" + "301");

        assertEquals("a0000000000000000400000000000000", fields.get(1));
        assertEquals("301", fields.get(70));
    }

    @Test
    void trailingCharactersAreIgnored()
    {
        SortedMap<Integer, String> fields = decoder.decode("0200" + "2000000000000000" + "000000" + "EXTRA");

        assertEquals("000000", fields.get(3));
        assertEquals(3, fields.size());
    }

    @Test
    void lllvarFieldUsesThreeDigitPrefix()
    {
        SortedMap<Integer, String> fields = decoder.decode("0100" + "0000000000010000" + "005HELLO");

        assertEquals("HELLO", fields.get(48));
    }

    @Test
    void shortMtiIsRejected()
    {
        assertThrows(IsoDecodeException.class, () -> decoder.decode("02"));
    }

    @Test
    void truncatedBitmapIsRejected()
    {
        assertThrows(IsoDecodeException.class, () -> decoder.decode("0200" + "6000"));
    }

    @Test
    void truncatedFieldIsRejected()
    {
        IsoDecodeException e = assertThrows(IsoDecodeException.class,
                () -> decoder.decode("0200" + "6000000000000000" + "16" + "41111"));
        assertTrue(e.getMessage().contains("field 2"));
    }

    @Test
    void truncatedSecondaryBitmapIsRejected()
    {
        assertThrows(IsoDecodeException.class, () -> decoder.decode("0800" + "A000000000000000" + "0400"));
    }

    @Test
    void invalidBitmapHexIsRejected()
    {
        assertThrows(IsoDecodeException.class, () -> decoder.decode("0200" + "ZZ00000000000000"));
    }

    @Test
    void nonDecimalLengthPrefixIsRejected()
    {
        assertThrows(IsoDecodeException.class,
                () -> decoder.decode("0200" + "4000000000000000" + "A1" + "4111111111111111"));
    }

    @Test
    void flaggedFieldWithoutRuleIsRejected()
    {
        MissingFieldConfigException e = assertThrows(MissingFieldConfigException.class,
                () -> decoder.decode("0200" + "0800000000000000" + "000000001500"));
        assertEquals(5, e.field());
    }

    @Test
    void flaggedFieldWithUnsupportedLengthTypeIsRejected()
    {
        UnsupportedLengthTypeException e = assertThrows(UnsupportedLengthTypeException.class,
                () -> decoder.decode("0200" + "0200000000000000" + "1011120000"));
        assertEquals(7, e.field());
    }
}
