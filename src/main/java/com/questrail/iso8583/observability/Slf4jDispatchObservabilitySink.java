package com.questrail.iso8583.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DispatchObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDispatchObservabilitySink implements DispatchObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);

    @Override
    public void onDispatch(DispatchEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("ISO 8583 {} -> {} from {} routed by {}{}",
                event.requestMti(),
                event.responseMti(),
                event.remote(),
                event.routingKey(),
                event.defaultHandler() ? " (default handler)" : "");
        }
    }

    @Override
    public void onTransportEvent(TransportEvent event) {
        log.info("ISO 8583 listener {} on {}", event.kind(), event.localAddress());
    }

    @Override
    public void onError(DispatchErrorEvent event) {
        if (event.stage() == DispatchStage.ROUTE) {
            log.error("ISO 8583 {} error from {}: {}", event.stage(), event.remote(), event.message());
            return;
        }
        log.error("ISO 8583 {} error from {}: {}", event.stage(), event.remote(), event.message(), event.cause());
    }
}
