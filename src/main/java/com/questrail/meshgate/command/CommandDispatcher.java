package com.questrail.meshgate.command;

import com.questrail.meshgate.irc.RoomCommandHandler;
import com.questrail.meshgate.observability.BridgeErrorEvent;
import com.questrail.meshgate.observability.BridgeObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * CommandDispatcher
 * =============================================================================
 * Turns a control-room line whose first word is a registered verb into a
 * {@link BridgeCommand} invocation.
 *
 * <p>The chat server asks {@link #handles(String)} before treating a line as
 * chat, so an unregistered verb is never seen here. Handlers run synchronously
 * on the calling connection's thread.</p>
 *
 * <h2>Failure Semantics</h2>
 * <ul>
 *   <li>Malformed quoting → {@code Error parsing arguments: ...} to the requester</li>
 *   <li>Any other exception → logged, then {@code Error executing command VERB: ...}</li>
 * </ul>
 * Nothing a handler throws reaches the chat server.
 */
public final class CommandDispatcher implements RoomCommandHandler
{
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final BridgeServices services;
    private final BridgeObservabilitySink sink;

    public CommandDispatcher(BridgeServices services, BridgeObservabilitySink sink)
    {
        this.services = Objects.requireNonNull(services, "services");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public boolean handles(String verb)
    {
        return services.registry().find(verb).isPresent();
    }

    @Override
    public void handle(String nickname, String verb, String rawArguments)
    {
        dispatch(nickname, verb, rawArguments);
    }

    /**
     * @return {@code false} if {@code verb} is not a registered command
     */
    public boolean dispatch(String nickname, String verb, String rawArguments)
    {
        Objects.requireNonNull(nickname, "nickname");
        Optional<BridgeCommand> found = services.registry().find(verb);
        if (found.isEmpty()) {
            return false;
        }

        BridgeCommand command = found.get();
        BridgeContext context = new BridgeContext(services, nickname);
        CommandInvocation invocation = new CommandInvocation(
                nickname, command.name(), rawArguments == null ? "" : rawArguments);

        log.info("Executing command '{}' for {} with args: {}", command.name(), nickname, invocation.rawArguments());
        try {
            command.execute(context, invocation);
        }
        catch (ArgumentSyntaxException e) {
            log.warn("Argument parsing error for '{}' from {}: {}", invocation.rawArguments(), nickname, e.getMessage());
            context.reply("Error parsing arguments: " + e.getMessage());
        }
        catch (RuntimeException e) {
            log.error("Error executing command '{}' for {}", command.name(), nickname, e);
            sink.onError(new BridgeErrorEvent(services.wallClock().now(),
                    "Command " + command.name() + " failed for " + nickname, e));
            context.reply("Error executing command " + command.name() + ": " + e.getMessage());
        }
        return true;
    }
}
