package com.questrail.iso8583.transport.netty;

import com.questrail.iso8583.transport.FramingException;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class LengthPrefixFrameDecoderTest
{
    @Test
    void emitsPayloadOnceComplete()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new LengthPrefixFrameDecoder());

        assertFalse(channel.writeInbound(Unpooled.copiedBuffer("00", StandardCharsets.ISO_8859_1)));
        assertFalse(channel.writeInbound(Unpooled.copiedBuffer("0602", StandardCharsets.ISO_8859_1)));
        assertTrue(channel.writeInbound(Unpooled.copiedBuffer("0012", StandardCharsets.ISO_8859_1)));

        byte[] payload = channel.readInbound();
        assertEquals("020012", new String(payload, StandardCharsets.ISO_8859_1));
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void malformedHeaderFailsWithFramingCause()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new LengthPrefixFrameDecoder());

        DecoderException e = assertThrows(DecoderException.class,
                () -> channel.writeInbound(Unpooled.copiedBuffer("AB120200", StandardCharsets.ISO_8859_1)));
        assertInstanceOf(FramingException.class, e.getCause());
        channel.finishAndReleaseAll();
    }

    @Test
    void zeroLengthFrameIsEmitted()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new LengthPrefixFrameDecoder());

        assertTrue(channel.writeInbound(Unpooled.copiedBuffer("0000", StandardCharsets.ISO_8859_1)));

        byte[] payload = channel.readInbound();
        assertEquals(0, payload.length);
        channel.finishAndReleaseAll();
    }
}
