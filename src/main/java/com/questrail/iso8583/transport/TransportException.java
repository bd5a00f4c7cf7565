package com.questrail.iso8583.transport;

/**
 * Indicates that the listener could not be started.
 */
public final class TransportException extends RuntimeException
{
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
