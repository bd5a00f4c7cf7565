package com.questrail.iso8583.dispatch;

/**
 * Thrown when no handler is registered for a routing key and no default
 * handler is set.
 */
public final class HandlerNotFoundException extends RuntimeException
{
    private final RoutingKey key;

    public HandlerNotFoundException(RoutingKey key) {
        super("No handler registered for " + key + " and no default handler set");
        this.key = key;
    }

    public RoutingKey key() {
        return key;
    }
}
