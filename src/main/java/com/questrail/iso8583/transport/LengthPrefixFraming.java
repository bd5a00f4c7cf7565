package com.questrail.iso8583.transport;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * LengthPrefixFraming
 * -----------------------------------------------------------------------------
 * Wire framing shared by requests and responses:
 *
 * <pre>
 *   &lt;4-digit zero-padded decimal byte length&gt;&lt;payload&gt;
 * </pre>
 *
 * <p>The length counts payload bytes only. Message text is carried as
 * ISO-8859-1, so each character is exactly one byte and a payload's byte
 * length equals its string length.</p>
 */
public final class LengthPrefixFraming
{
    public static final int HEADER_LENGTH = 4;
    public static final int MAX_PAYLOAD_LENGTH = 9999;
    public static final Charset WIRE_CHARSET = StandardCharsets.ISO_8859_1;

    private LengthPrefixFraming() {}

    /**
     * Prefixes {@code payload} with its length.
     *
     * @throws FramingException if the payload is longer than {@value #MAX_PAYLOAD_LENGTH} bytes
     */
    public static byte[] frame(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length > MAX_PAYLOAD_LENGTH) {
            throw new FramingException(
                    "Payload of " + payload.length + " bytes exceeds frame limit " + MAX_PAYLOAD_LENGTH);
        }
        byte[] header = String.format("%04d", payload.length).getBytes(WIRE_CHARSET);
        byte[] framed = Arrays.copyOf(header, HEADER_LENGTH + payload.length);
        System.arraycopy(payload, 0, framed, HEADER_LENGTH, payload.length);
        return framed;
    }

    public static byte[] frame(String message)
    {
        return frame(message.getBytes(WIRE_CHARSET));
    }

    /**
     * Parses a 4-byte length header.
     *
     * @throws FramingException if the header is not four decimal digits
     */
    public static int parseLength(byte[] header)
    {
        Objects.requireNonNull(header, "header");
        if (header.length != HEADER_LENGTH) {
            throw new FramingException("Length header must be " + HEADER_LENGTH + " bytes");
        }
        int length = 0;
        for (byte b : header) {
            if (b < '0' || b > '9') {
                throw new FramingException(
                        "Length header is not decimal: '" + new String(header, WIRE_CHARSET) + "'");
            }
            length = length * 10 + (b - '0');
        }
        return length;
    }

    /**
     * Strips the length header from one complete frame.
     *
     * @throws FramingException if the header is malformed or disagrees with the frame size
     */
    static byte[] unframe(byte[] framed)
    {
        Objects.requireNonNull(framed, "framed");
        if (framed.length < HEADER_LENGTH) {
            throw new FramingException("Frame shorter than its " + HEADER_LENGTH + "-byte header");
        }
        int length = parseLength(Arrays.copyOf(framed, HEADER_LENGTH));
        if (framed.length != HEADER_LENGTH + length) {
            throw new FramingException(
                    "Frame declares " + length + " payload bytes but carries " + (framed.length - HEADER_LENGTH));
        }
        return Arrays.copyOfRange(framed, HEADER_LENGTH, framed.length);
    }

    public static String decodeText(byte[] payload)
    {
        return new String(payload, WIRE_CHARSET);
    }
}
