package com.questrail.iso8583.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a listener lifecycle change.
 */
public record TransportEvent(
    Instant timestamp,
    Kind kind,
    SocketAddress localAddress
) {
    public enum Kind {
        LISTENING,
        STOPPED
    }
}
