package com.questrail.meshgate.correlation;

import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.mesh.RequestId;
import com.questrail.meshgate.observability.BridgeObservabilitySink;
import com.questrail.meshgate.observability.RequestOutcomeEvent;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * RequestCorrelator
 * =============================================================================
 * Tracks outstanding DMs and pings and matches them to their asynchronous
 * outcome.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Hold at most one {@link PendingRequest} per {@link RequestId}</li>
 *   <li>Turn a terminal mesh outcome into exactly one line for the requester</li>
 *   <li>Report requests whose deadline passed exactly once, then forget them</li>
 * </ul>
 *
 * <h2>Idempotence</h2>
 * A request leaves the active set the moment it is resolved or swept. A later
 * outcome for the same identifier finds nothing and is ignored.
 *
 * <h2>Concurrency</h2>
 * Command handlers register from connection threads, the relay resolves from
 * its consumer thread, and the sweeper expires from the scheduler. Every
 * operation runs under this object's monitor. The correlator never calls into
 * chat output; it returns {@link RequesterNotice}s for the caller to deliver.
 *
 * <h2>Issue/complete race</h2>
 * A fast mesh interface can report an outcome before {@code sendDirectText}
 * even returns its identifier. {@link #issue} therefore performs the send while
 * holding the monitor: a competing {@link #resolve} for the new identifier
 * waits until the request is registered.
 */
public final class RequestCorrelator
{
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final CorrelationPolicy policy;
    private final BridgeObservabilitySink sink;

    private final Map<RequestId, PendingRequest> pending = new LinkedHashMap<>();

    public RequestCorrelator(MonotonicClock clock,
                             WallClock wallClock,
                             CorrelationPolicy policy,
                             BridgeObservabilitySink sink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CorrelationPolicy policy()
    {
        return policy;
    }

    /**
     * Performs {@code send} and registers its identifier as a pending request
     * for {@code requester}, due after the policy's acknowledgement timeout.
     *
     * <p>If {@code send} throws, nothing is registered and the exception
     * propagates.</p>
     */
    public synchronized PendingRequest issue(RequestKind kind,
                                             String requester,
                                             MeshNodeRecord target,
                                             Supplier<RequestId> send)
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(send, "send");

        RequestId id = Objects.requireNonNull(send.get(), "mesh interface returned null request id");
        long now = clock.nowNanos();
        PendingRequest request = new PendingRequest(
                id, kind, requester,
                target.nodeNumber(), target.nodeId(), target.displayName(),
                now, now + policy.ackTimeout().toNanos());
        register(request);
        return request;
    }

    /**
     * Adds a pending request.
     *
     * @throws IllegalStateException if a request with the same identifier is already pending
     */
    public synchronized void register(PendingRequest request)
    {
        Objects.requireNonNull(request, "request");
        if (pending.containsKey(request.requestId())) {
            throw new IllegalStateException("request " + request.requestId() + " is already pending");
        }
        pending.put(request.requestId(), request);
    }

    /**
     * Removes the request {@code requestId} and returns the line owed to its
     * requester. Unknown or already-finished identifiers yield empty.
     */
    public synchronized Optional<RequesterNotice> resolve(RequestId requestId, RequestOutcome outcome)
    {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(outcome, "outcome");

        PendingRequest request = pending.remove(requestId);
        if (request == null) {
            return Optional.empty();
        }

        String line = describe(request, outcome, clock.nowNanos());
        report(request, outcomeName(outcome));
        return Optional.of(new RequesterNotice(request.requester(), line));
    }

    /**
     * Removes every request whose deadline is at or before {@code nowNanos}
     * and returns one timeout line per removed request, in issue order.
     */
    public synchronized List<RequesterNotice> sweepExpired(long nowNanos)
    {
        List<RequesterNotice> expired = new ArrayList<>();
        Iterator<PendingRequest> it = pending.values().iterator();
        while (it.hasNext()) {
            PendingRequest request = it.next();
            if (request.deadlineNanos() - nowNanos <= 0) {
                it.remove();
                long waited = TimeUnit.NANOSECONDS.toSeconds(request.deadlineNanos() - request.createdAtNanos());
                expired.add(new RequesterNotice(request.requester(),
                        "[TIMEOUT] " + request.kind().label() + " to " + request.targetLabel()
                                + ": " + request.kind().silence() + " within " + waited + "s"));
                report(request, "TIMEOUT");
            }
        }
        return expired;
    }

    public synchronized int pendingCount()
    {
        return pending.size();
    }

    public synchronized Optional<PendingRequest> find(RequestId requestId)
    {
        return Optional.ofNullable(pending.get(requestId));
    }

    private static String describe(PendingRequest request, RequestOutcome outcome, long nowNanos)
    {
        String what = request.kind().label() + " to " + request.targetLabel();
        if (outcome instanceof RequestOutcome.Acknowledged) {
            return request.kind() == RequestKind.PING
                    ? "[ACK] " + what + " acknowledged"
                    : "[ACK] " + what + " delivered";
        }
        if (outcome instanceof RequestOutcome.NegativeAcknowledged nak) {
            return "[NAK] " + what + " failed: " + nak.reason();
        }
        RequestOutcome.Pong pong = (RequestOutcome.Pong) outcome;
        double seconds = (nowNanos - request.createdAtNanos()) / 1_000_000_000.0;
        return "[PONG] Reply from " + request.targetLabel()
                + " SNR:" + pong.signal().snrText()
                + " RSSI:" + pong.signal().rssiText()
                + " after " + String.format(Locale.ROOT, "%.1f", seconds) + "s";
    }

    private static String outcomeName(RequestOutcome outcome)
    {
        if (outcome instanceof RequestOutcome.Acknowledged) {
            return "ACK";
        }
        if (outcome instanceof RequestOutcome.NegativeAcknowledged nak) {
            return "NAK " + nak.reason();
        }
        return "PONG";
    }

    private void report(PendingRequest request, String outcome)
    {
        sink.onRequestOutcome(new RequestOutcomeEvent(
                wallClock.now(),
                request.requestId().value(),
                request.kind().label(),
                request.requester(),
                outcome));
    }
}
