package com.questrail.iso8583.transport.netty;

import com.questrail.iso8583.transport.LengthPrefixFraming;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Cuts a 4-digit decimal length-prefixed frame out of the inbound byte stream
 * and emits its payload as a {@code byte[]}.
 *
 * <p>A malformed header surfaces as a {@code DecoderException} wrapping a
 * {@link com.questrail.iso8583.transport.FramingException}.</p>
 */
final class LengthPrefixFrameDecoder extends ByteToMessageDecoder
{
    LengthPrefixFrameDecoder()
    {
        setSingleDecode(true);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        if (in.readableBytes() < LengthPrefixFraming.HEADER_LENGTH) {
            return;
        }

        byte[] header = new byte[LengthPrefixFraming.HEADER_LENGTH];
        in.getBytes(in.readerIndex(), header);
        int length = LengthPrefixFraming.parseLength(header);

        if (in.readableBytes() < LengthPrefixFraming.HEADER_LENGTH + length) {
            return;
        }

        in.skipBytes(LengthPrefixFraming.HEADER_LENGTH);
        byte[] payload = new byte[length];
        in.readBytes(payload);
        out.add(payload);
    }
}
