package com.questrail.meshgate.command;

import com.questrail.meshgate.correlation.PendingRequest;
import com.questrail.meshgate.correlation.RequestCorrelator;
import com.questrail.meshgate.correlation.RequestKind;
import com.questrail.meshgate.directory.MeshNodeRecord;
import com.questrail.meshgate.directory.NodeDirectory;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.lookup.HfConditionsLookup;
import com.questrail.meshgate.lookup.WeatherLookup;
import com.questrail.meshgate.mesh.MeshOperationException;
import com.questrail.meshgate.mesh.RequestId;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeContext
 * -----------------------------------------------------------------------------
 * What one command invocation may do: reply to its requester, post to the
 * room, read the node directory, and start mesh operations.
 *
 * <p>Correlated operations ({@link #sendDirect}, {@link #ping}) register a
 * pending request for the requester; the outcome arrives later as a notice.</p>
 */
public final class BridgeContext
{
    private final BridgeServices services;
    private final String requester;

    public BridgeContext(BridgeServices services, String requester)
    {
        this.services = Objects.requireNonNull(services, "services");
        this.requester = Objects.requireNonNull(requester, "requester");
    }

    public String requester()
    {
        return requester;
    }

    /** Sends {@code text} to the requester only. */
    public void reply(String text)
    {
        services.chat().sendToSession(requester, text);
    }

    public void replyAll(List<String> lines)
    {
        for (String line : lines) {
            reply(line);
        }
    }

    /** Posts {@code text} to the whole control room. */
    public void announce(String text)
    {
        services.chat().sendToRoom(text);
    }

    public Optional<MeshNodeRecord> resolveNode(String reference)
    {
        return services.resolver().resolve(reference);
    }

    public NodeDirectory directory()
    {
        return services.directory();
    }

    public RequestCorrelator correlator()
    {
        return services.correlator();
    }

    public CommandRegistry registry()
    {
        return services.registry();
    }

    public WeatherLookup weather()
    {
        return services.weather();
    }

    public HfConditionsLookup hfConditions()
    {
        return services.hfConditions();
    }

    public WallClock wallClock()
    {
        return services.wallClock();
    }

    public ZoneId zone()
    {
        return services.zone();
    }

    public int defaultChannel()
    {
        return services.defaultChannel();
    }

    public int activeSessionCount()
    {
        return services.chat().activeSessionCount();
    }

    public Duration uptime()
    {
        return Duration.ofNanos(services.clock().nowNanos() - services.startedAtNanos());
    }

    /**
     * Broadcasts {@code text} on the default channel. Not correlated.
     *
     * @throws MeshOperationException if the mesh interface rejects the send
     */
    public RequestId sendBroadcast(String text)
    {
        return services.mesh().sendText(text, services.defaultChannel());
    }

    /**
     * Sends an acknowledged direct message and tracks it for the requester.
     *
     * @throws MeshOperationException if the mesh interface rejects the send
     */
    public PendingRequest sendDirect(MeshNodeRecord target, String text)
    {
        return services.correlator().issue(RequestKind.DIRECT_MESSAGE, requester, target,
                () -> services.mesh().sendDirectText(target.nodeNumber(), text, true));
    }

    /**
     * Pings {@code target} and tracks the reply for the requester.
     *
     * @throws MeshOperationException if the mesh interface rejects the ping
     */
    public PendingRequest ping(MeshNodeRecord target)
    {
        return services.correlator().issue(RequestKind.PING, requester, target,
                () -> services.mesh().ping(target.nodeNumber()));
    }
}
