package com.questrail.iso8583.transport;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class LengthPrefixFramingTest
{
    @Test
    void framePrefixesZeroPaddedLength()
    {
        byte[] framed = LengthPrefixFraming.frame("0200ABC");

        assertEquals("00070200ABC", new String(framed, StandardCharsets.ISO_8859_1));
    }

    @Test
    void frameRejectsOversizedPayload()
    {
        assertThrows(FramingException.class, () -> LengthPrefixFraming.frame(new byte[10_000]));
    }

    @Test
    void largestPayloadFits()
    {
        byte[] framed = LengthPrefixFraming.frame(new byte[LengthPrefixFraming.MAX_PAYLOAD_LENGTH]);

        assertEquals("9999", new String(framed, 0, 4, StandardCharsets.ISO_8859_1));
    }

    @Test
    void parseLengthReadsDecimalHeader()
    {
        assertEquals(46, LengthPrefixFraming.parseLength("0046".getBytes(StandardCharsets.ISO_8859_1)));
        assertEquals(0, LengthPrefixFraming.parseLength("0000".getBytes(StandardCharsets.ISO_8859_1)));
    }

    @Test
    void parseLengthRejectsNonDigits()
    {
        assertThrows(FramingException.class,
                () -> LengthPrefixFraming.parseLength("00A1".getBytes(StandardCharsets.ISO_8859_1)));
        assertThrows(FramingException.class,
                () -> LengthPrefixFraming.parseLength(" 046".getBytes(StandardCharsets.ISO_8859_1)));
    }

    @Test
    void unframeStripsHeader()
    {
        byte[] payload = LengthPrefixFraming.unframe("00040800".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals("0800", LengthPrefixFraming.decodeText(payload));
    }

    @Test
    void unframeRejectsLengthMismatch()
    {
        assertThrows(FramingException.class,
                () -> LengthPrefixFraming.unframe("0005080".getBytes(StandardCharsets.ISO_8859_1)));
        assertThrows(FramingException.class,
                () -> LengthPrefixFraming.unframe("00".getBytes(StandardCharsets.ISO_8859_1)));
    }

    @Test
    void highBytesSurviveAsSingleCharacters()
    {
        byte[] payload = { (byte) 0xE9, 'A' };

        assertEquals(2, LengthPrefixFraming.decodeText(payload).length());
    }
}
