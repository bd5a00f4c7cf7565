package com.questrail.iso8583.transport;

import java.time.Duration;

/**
 * A connection did not deliver a complete request frame before its read
 * deadline, measured from acceptance.
 */
public final class ReadDeadlineException extends RuntimeException
{
    public ReadDeadlineException(Duration deadline) {
        super("No complete request frame within " + deadline.toMillis() + " ms of accept");
    }
}
