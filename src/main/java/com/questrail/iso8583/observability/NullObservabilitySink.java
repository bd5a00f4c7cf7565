package com.questrail.iso8583.observability;

/**
 * No-op implementation of DispatchObservabilitySink.
 */
public final class NullObservabilitySink implements DispatchObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDispatch(DispatchEvent event) {}

    @Override
    public void onTransportEvent(TransportEvent event) {}

    @Override
    public void onError(DispatchErrorEvent event) {}
}
