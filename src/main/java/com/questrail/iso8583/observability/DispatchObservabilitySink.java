package com.questrail.iso8583.observability;

/**
 * Main interface for receiving dispatch engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DispatchObservabilitySink {
    /**
     * Called after a response has been composed for a request.
     * @param event the dispatch details
     */
    void onDispatch(DispatchEvent event);

    /**
     * Called when the listener starts or stops.
     * @param event the transport event
     */
    void onTransportEvent(TransportEvent event);

    /**
     * Called when a connection is abandoned without a response, or when
     * accepting a connection fails.
     * @param event the error event
     */
    void onError(DispatchErrorEvent event);
}
