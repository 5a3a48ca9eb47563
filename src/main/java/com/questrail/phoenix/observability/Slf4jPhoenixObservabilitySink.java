package com.questrail.phoenix.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PhoenixObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPhoenixObservabilitySink implements PhoenixObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPhoenixObservabilitySink.class);

    @Override
    public void onTransportEvent(PhoenixTransportEvent event) {
        switch (event.kind()) {
            case ERROR -> log.warn("Phoenix transport error: {}", event.detail());
            case CLOSED -> log.info("Phoenix transport closed: {}", event.detail());
            default -> log.info("Phoenix transport {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onProtocolEvent(PhoenixProtocolEvent event) {
        if (event.kind() == PhoenixProtocolEvent.Kind.HEARTBEAT_SENT) {
            log.trace("Phoenix heartbeat sent: ref={}", event.detail());
            return;
        }
        log.debug("Phoenix protocol event: {}", event);
    }

    @Override
    public void onError(PhoenixErrorEvent event) {
        log.error("Phoenix error: {}", event.message(), event.cause());
    }
}
