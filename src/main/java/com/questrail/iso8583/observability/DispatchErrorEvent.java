package com.questrail.iso8583.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a failure that ended one connection's request/response
 * cycle, or an accept failure on the listener.
 *
 * @param remote peer address; {@code null} for accept failures
 * @param cause  underlying exception; may be {@code null}
 */
public record DispatchErrorEvent(
    Instant timestamp,
    DispatchStage stage,
    SocketAddress remote,
    String message,
    Throwable cause
) {
}
