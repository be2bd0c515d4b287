package com.questrail.meshgate.mesh;

/**
 * MeshInterface
 * =============================================================================
 * Port to the packet-radio mesh.
 *
 * <p>The gateway core never talks to radio hardware or its transport directly.
 * Everything it needs from the mesh is on this interface: three fire-and-forget
 * outbound operations and one asynchronous inbound event stream.</p>
 *
 * <h2>Request identifiers</h2>
 * Each outbound operation returns the {@link RequestId} under which its
 * terminal outcome ({@link MeshEvent.DeliveryAcknowledged},
 * {@link MeshEvent.DeliveryFailed}, {@link MeshEvent.PingReply}) will later be
 * reported. A completion event may arrive on another thread before the call
 * returns.
 *
 * <h2>Failure</h2>
 * Operations that cannot even be attempted throw {@link MeshOperationException}.
 * Failures after the packet left are reported only through events.
 */
public interface MeshInterface
{
    /** Node number addressing every node on a channel. */
    long BROADCAST = 0xFFFF_FFFFL;

    void setListener(MeshEventListener listener);

    void start();

    void stop();

    /**
     * Broadcasts {@code text} on channel {@code channelIndex}. Broadcasts are
     * never acknowledged.
     */
    RequestId sendText(String text, int channelIndex);

    /**
     * Sends {@code text} to one node on the primary channel.
     *
     * @param wantAck request a delivery acknowledgement from the destination
     */
    RequestId sendDirectText(long destination, String text, boolean wantAck);

    /**
     * Sends a low-level ping to {@code destination}.
     */
    RequestId ping(long destination);
}
