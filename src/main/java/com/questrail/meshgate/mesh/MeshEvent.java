package com.questrail.meshgate.mesh;

import com.questrail.meshgate.directory.NodeUpdate;

import java.time.Instant;
import java.util.Objects;

/**
 * MeshEvent
 * -----------------------------------------------------------------------------
 * Everything a {@link MeshInterface} reports about the mesh.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable and fully decoded before they are emitted</li>
 *   <li>Node references are node numbers, never names</li>
 * </ul>
 */
public sealed interface MeshEvent
        permits MeshEvent.NodeHeard,
                MeshEvent.MessageReceived,
                MeshEvent.DeliveryAcknowledged,
                MeshEvent.DeliveryFailed,
                MeshEvent.PingReply,
                MeshEvent.ConnectionStatus,
                MeshEvent.LocalNodeReported
{
    Instant timestamp();

    abstract class Base {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public Instant timestamp() {
            return timestamp;
        }
    }

    /** A node announced or updated its attributes. */
    final class NodeHeard extends Base implements MeshEvent
    {
        private final long nodeNumber;
        private final NodeUpdate attributes;

        public NodeHeard(Instant timestamp, long nodeNumber, NodeUpdate attributes) {
            super(timestamp);
            this.nodeNumber = nodeNumber;
            this.attributes = Objects.requireNonNull(attributes, "attributes");
        }

        public long nodeNumber() {
            return nodeNumber;
        }

        public NodeUpdate attributes() {
            return attributes;
        }

        @Override
        public String toString() {
            return "NodeHeard[" + MeshEvents.nodeRef(nodeNumber) + "]";
        }
    }

    /**
     * A text message arrived. {@code to} is {@link MeshInterface#BROADCAST} for
     * channel broadcasts.
     */
    final class MessageReceived extends Base implements MeshEvent
    {
        private final long from;
        private final long to;
        private final int channel;
        private final String text;
        private final SignalInfo signal;

        public MessageReceived(Instant timestamp, long from, long to, int channel, String text, SignalInfo signal) {
            super(timestamp);
            this.from = from;
            this.to = to;
            this.channel = channel;
            this.text = Objects.requireNonNull(text, "text");
            this.signal = Objects.requireNonNull(signal, "signal");
        }

        public long from() {
            return from;
        }

        public long to() {
            return to;
        }

        public int channel() {
            return channel;
        }

        public String text() {
            return text;
        }

        public SignalInfo signal() {
            return signal;
        }

        public boolean isBroadcast() {
            return to == MeshInterface.BROADCAST;
        }

        @Override
        public String toString() {
            return "MessageReceived[" + MeshEvents.nodeRef(from) + " -> "
                    + (isBroadcast() ? "^all" : MeshEvents.nodeRef(to)) + " ch" + channel + "]";
        }
    }

    /** The destination confirmed delivery of a request. */
    final class DeliveryAcknowledged extends Base implements MeshEvent
    {
        private final RequestId requestId;

        public DeliveryAcknowledged(Instant timestamp, RequestId requestId) {
            super(timestamp);
            this.requestId = Objects.requireNonNull(requestId, "requestId");
        }

        public RequestId requestId() {
            return requestId;
        }

        @Override
        public String toString() {
            return "DeliveryAcknowledged[" + requestId + "]";
        }
    }

    /** The mesh gave up on a request. {@code reason} is the radio's error code. */
    final class DeliveryFailed extends Base implements MeshEvent
    {
        private final RequestId requestId;
        private final String reason;

        public DeliveryFailed(Instant timestamp, RequestId requestId, String reason) {
            super(timestamp);
            this.requestId = Objects.requireNonNull(requestId, "requestId");
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public RequestId requestId() {
            return requestId;
        }

        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "DeliveryFailed[" + requestId + ", " + reason + "]";
        }
    }

    /** A pinged node answered. */
    final class PingReply extends Base implements MeshEvent
    {
        private final RequestId requestId;
        private final long from;
        private final SignalInfo signal;

        public PingReply(Instant timestamp, RequestId requestId, long from, SignalInfo signal) {
            super(timestamp);
            this.requestId = Objects.requireNonNull(requestId, "requestId");
            this.from = from;
            this.signal = Objects.requireNonNull(signal, "signal");
        }

        public RequestId requestId() {
            return requestId;
        }

        public long from() {
            return from;
        }

        public SignalInfo signal() {
            return signal;
        }

        @Override
        public String toString() {
            return "PingReply[" + requestId + " from " + MeshEvents.nodeRef(from) + "]";
        }
    }

    /** The link to the mesh radio changed state. */
    final class ConnectionStatus extends Base implements MeshEvent
    {
        private final boolean connected;
        private final String status;

        public ConnectionStatus(Instant timestamp, boolean connected, String status) {
            super(timestamp);
            this.connected = connected;
            this.status = Objects.requireNonNull(status, "status");
        }

        public boolean connected() {
            return connected;
        }

        public String status() {
            return status;
        }

        @Override
        public String toString() {
            return "ConnectionStatus[" + status + "]";
        }
    }

    /** The mesh interface identified the gateway's own radio. */
    final class LocalNodeReported extends Base implements MeshEvent
    {
        private final long nodeNumber;

        public LocalNodeReported(Instant timestamp, long nodeNumber) {
            super(timestamp);
            this.nodeNumber = nodeNumber;
        }

        public long nodeNumber() {
            return nodeNumber;
        }

        @Override
        public String toString() {
            return "LocalNodeReported[" + MeshEvents.nodeRef(nodeNumber) + "]";
        }
    }
}
