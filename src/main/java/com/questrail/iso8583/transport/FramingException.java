package com.questrail.iso8583.transport;

/**
 * Indicates that bytes on a connection do not form a valid length-prefixed
 * frame, or that the connection ended before a complete frame arrived.
 */
public final class FramingException extends RuntimeException
{
    public FramingException(String message) {
        super(message);
    }
}
