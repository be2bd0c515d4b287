package com.questrail.meshgate.observability;

/**
 * Main interface for receiving gateway observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when a chat session changes registration state.
     * @param event the transition details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when a correlated mesh request reaches a terminal outcome
     * (acknowledged, rejected, answered, or timed out).
     * @param event the outcome details
     */
    void onRequestOutcome(RequestOutcomeEvent event);

    /**
     * Called when the mesh link reports a status change.
     * @param event the status event
     */
    void onMeshStatus(MeshStatusEvent event);

    /**
     * Called when an error occurs while processing input from either side of the bridge.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
