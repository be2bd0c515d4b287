package com.questrail.meshgate.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Immutable mapping from command name to {@link BridgeCommand}.
 *
 * <p>Names are matched case-insensitively. Built once at startup, either from
 * every {@code BridgeCommand} on the class path ({@link #discover()}) or from an
 * explicit list. A later registration of the same name replaces the earlier one
 * with a warning.</p>
 */
public final class CommandRegistry
{
    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, BridgeCommand> commands;

    private CommandRegistry(Map<String, BridgeCommand> commands)
    {
        this.commands = Collections.unmodifiableMap(new TreeMap<>(commands));
    }

    /**
     * Loads every command registered under
     * {@code META-INF/services/com.questrail.meshgate.command.BridgeCommand}.
     */
    public static CommandRegistry discover()
    {
        return discover(CommandRegistry.class.getClassLoader());
    }

    public static CommandRegistry discover(ClassLoader loader)
    {
        Builder builder = builder();
        for (BridgeCommand command : ServiceLoader.load(BridgeCommand.class, loader)) {
            builder.register(command);
        }
        CommandRegistry registry = builder.build();
        log.info("Loaded {} commands: {}", registry.size(), String.join(", ", registry.names()));
        return registry;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Optional<BridgeCommand> find(String name)
    {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(name.toUpperCase(Locale.ROOT)));
    }

    /** Command names, sorted. */
    public List<String> names()
    {
        return new ArrayList<>(commands.keySet());
    }

    public int size()
    {
        return commands.size();
    }

    public static final class Builder
    {
        private final Map<String, BridgeCommand> commands = new TreeMap<>();

        private Builder() {}

        public Builder register(BridgeCommand command)
        {
            Objects.requireNonNull(command, "command");
            String name = Objects.requireNonNull(command.name(), "command.name()").toUpperCase(Locale.ROOT);
            if (name.isBlank()) {
                throw new IllegalArgumentException("command name must not be blank: " + command.getClass().getName());
            }
            BridgeCommand previous = commands.put(name, command);
            if (previous != null) {
                log.warn("Command '{}' is already registered by {}. Overwriting with {}.",
                        name, previous.getClass().getName(), command.getClass().getName());
            }
            else {
                log.debug("Registered command: {}", name);
            }
            return this;
        }

        public CommandRegistry build()
        {
            return new CommandRegistry(commands);
        }
    }
}
