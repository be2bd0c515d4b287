package com.questrail.meshgate.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onRequestOutcome(RequestOutcomeEvent event) {}

    @Override
    public void onMeshStatus(MeshStatusEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
