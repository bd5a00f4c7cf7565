package com.questrail.iso8583.transport;

import java.net.SocketAddress;

/**
 * ServerEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a connection-oriented, one-request-per-connection listener.
 *
 * <p>For each accepted connection the endpoint reads exactly one
 * length-prefixed frame, hands its payload to the listener, writes whatever
 * bytes the listener returns and then closes the connection.</p>
 *
 * <p>Implementations may be backed by Netty, blocking sockets, or a test
 * harness.</p>
 */
public interface ServerEndpoint
{
    /**
     * Bind and begin accepting connections. Returns once the listener is bound.
     *
     * @throws TransportException if binding fails
     */
    void start();

    /**
     * Block until the endpoint has been stopped.
     */
    void awaitStopped() throws InterruptedException;

    /**
     * Stop accepting connections and release all transport resources.
     */
    void stop();

    /**
     * Address actually bound, or {@code null} before {@link #start()}.
     */
    SocketAddress localAddress();

    /**
     * Register the listener that processes frames. Must be called before
     * {@link #start()}.
     */
    void setListener(ServerEndpointListener listener);
}
