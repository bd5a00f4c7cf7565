package com.questrail.iso8583.codec;

/**
 * Indicates that a raw message could not be parsed.
 *
 * This typically reflects:
 * <ul>
 *   <li>Input shorter than the schema or a length prefix implies</li>
 *   <li>A bitmap that is not valid hexadecimal</li>
 *   <li>A length prefix that is not a decimal number</li>
 * </ul>
 */
public final class IsoDecodeException extends IsoCodecException
{
    public IsoDecodeException(String message) {
        super(message);
    }

    public IsoDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
