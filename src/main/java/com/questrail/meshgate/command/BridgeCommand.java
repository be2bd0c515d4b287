package com.questrail.meshgate.command;

/**
 * A control-room command.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and
 * need a public no-argument constructor. One instance serves every session
 * concurrently, so implementations must be stateless.</p>
 */
public interface BridgeCommand
{
    /** Verb that invokes the command, upper case. */
    String name();

    /** One-line usage and description, e.g. {@code PING <node> - Pings a node}. */
    String help();

    /**
     * Runs the command. Mesh operations it starts are fire-and-forget; their
     * outcome reaches the requester later through the request correlator.
     */
    void execute(BridgeContext context, CommandInvocation invocation);
}
