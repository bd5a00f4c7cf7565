package com.questrail.iso8583.observability;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.List;

/**
 * Record describing a request that was routed to a handler and answered.
 *
 * @param routingKey     field values that formed the routing key, in order
 * @param defaultHandler true if no specific handler matched and the default one ran
 * @param requestMti     MTI as received
 * @param responseMti    MTI after the handler ran
 */
public record DispatchEvent(
    Instant timestamp,
    SocketAddress remote,
    List<String> routingKey,
    boolean defaultHandler,
    String requestMti,
    String responseMti
) {
    public DispatchEvent {
        routingKey = List.copyOf(routingKey);
    }
}
