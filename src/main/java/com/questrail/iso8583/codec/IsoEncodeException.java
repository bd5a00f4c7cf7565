package com.questrail.iso8583.codec;

/**
 * Indicates that a set of field values cannot be composed into a message,
 * for example because the MTI is absent.
 */
public final class IsoEncodeException extends IsoCodecException
{
    public IsoEncodeException(String message) {
        super(message);
    }
}
