package com.questrail.meshgate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        log.info("Session {} ({}): {} -> {}",
            event.connectionId(),
            event.nickname() != null ? event.nickname() : "*",
            event.fromState(),
            event.toState());
    }

    @Override
    public void onRequestOutcome(RequestOutcomeEvent event) {
        log.info("{} request {} for {}: {}",
            event.kind(),
            event.requestId(),
            event.requester(),
            event.outcome());
    }

    @Override
    public void onMeshStatus(MeshStatusEvent event) {
        log.info("Mesh status: {}", event.status());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge error: {}", event.message(), event.cause());
    }
}
