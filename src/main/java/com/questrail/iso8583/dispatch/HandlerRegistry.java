package com.questrail.iso8583.dispatch;

import com.questrail.iso8583.api.IsoHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * HandlerRegistry
 * -----------------------------------------------------------------------------
 * Maps routing keys to handlers for one engine, plus an optional default.
 *
 * <p>Registration may happen while connections are being served; lookups take
 * the read lock and registrations the write lock. Registering a key twice
 * replaces the earlier handler.</p>
 */
public final class HandlerRegistry
{
    private final int keySize;
    private final Map<RoutingKey, IsoHandler> handlers = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private IsoHandler defaultHandler;

    /**
     * @param keySize number of parts every registered key must have; zero
     *                routes every request on the empty key
     */
    public HandlerRegistry(int keySize) {
        if (keySize < 0) {
            throw new IllegalArgumentException("Routing key size must not be negative (was " + keySize + ")");
        }
        this.keySize = keySize;
    }

    public int keySize() {
        return keySize;
    }

    public void addHandler(IsoHandler handler, String... keyParts) {
        Objects.requireNonNull(handler, "handler");
        RoutingKey key = RoutingKey.of(keyParts);
        if (key.size() != keySize) {
            throw new IllegalArgumentException(
                    "Routing key must have " + keySize + " part(s) to match the routing fields (was " + key + ")");
        }
        lock.writeLock().lock();
        try {
            handlers.put(key, handler);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setDefaultHandler(IsoHandler handler) {
        Objects.requireNonNull(handler, "handler");
        lock.writeLock().lock();
        try {
            defaultHandler = handler;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the handler registered for {@code key}, falling back to the
     * default handler.
     *
     * @throws HandlerNotFoundException if neither exists
     */
    public Resolution resolve(RoutingKey key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            IsoHandler handler = handlers.get(key);
            if (handler != null) {
                return new Resolution(handler, false);
            }
            if (defaultHandler != null) {
                return new Resolution(defaultHandler, true);
            }
        } finally {
            lock.readLock().unlock();
        }
        throw new HandlerNotFoundException(key);
    }

    /**
     * Outcome of {@link #resolve(RoutingKey)}.
     *
     * @param usedDefault true if no specific handler matched
     */
    public record Resolution(IsoHandler handler, boolean usedDefault) {
    }
}
