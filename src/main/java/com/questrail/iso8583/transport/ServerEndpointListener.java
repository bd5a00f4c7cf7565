package com.questrail.iso8583.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * ServerEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link ServerEndpoint}.
 *
 * <p>{@link #onFrame(SocketAddress, byte[])} may be invoked concurrently for
 * different connections. Implementations must not block other connections
 * through shared state.</p>
 */
public interface ServerEndpointListener
{
    void onListening(SocketAddress localAddress);

    void onStopped(SocketAddress localAddress);

    /**
     * Process one inbound frame payload.
     *
     * @return bytes to write verbatim before closing, or empty to close
     *         without a response
     */
    Optional<byte[]> onFrame(SocketAddress remote, byte[] payload);

    /**
     * A connection failed before a complete frame was read (timeout, malformed
     * header, early close) or while writing the response.
     *
     * @param writing true if the failure happened while writing the response
     */
    void onConnectionError(SocketAddress remote, boolean writing, Throwable cause);

    /**
     * Accepting a connection failed. The endpoint keeps listening.
     */
    void onAcceptError(Throwable cause);
}
