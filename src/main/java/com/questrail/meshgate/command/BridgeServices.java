package com.questrail.meshgate.command;

import com.questrail.meshgate.correlation.RequestCorrelator;
import com.questrail.meshgate.directory.NodeDirectory;
import com.questrail.meshgate.directory.NodeResolver;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.irc.ChatOutput;
import com.questrail.meshgate.lookup.HfConditionsLookup;
import com.questrail.meshgate.lookup.WeatherLookup;
import com.questrail.meshgate.mesh.MeshInterface;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Everything command handlers may reach, shared by all invocations.
 *
 * @param startedAtNanos monotonic time the gateway started, for uptime
 * @param defaultChannel mesh channel index used for broadcasts
 * @param zone           time zone for times shown to users
 */
public record BridgeServices(
        NodeDirectory directory,
        NodeResolver resolver,
        RequestCorrelator correlator,
        MeshInterface mesh,
        ChatOutput chat,
        CommandRegistry registry,
        WeatherLookup weather,
        HfConditionsLookup hfConditions,
        MonotonicClock clock,
        WallClock wallClock,
        long startedAtNanos,
        int defaultChannel,
        ZoneId zone
) {
    public BridgeServices {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(correlator, "correlator");
        Objects.requireNonNull(mesh, "mesh");
        Objects.requireNonNull(chat, "chat");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(weather, "weather");
        Objects.requireNonNull(hfConditions, "hfConditions");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(zone, "zone");
        if (defaultChannel < 0 || defaultChannel > 7) {
            throw new IllegalArgumentException("defaultChannel must be 0..7");
        }
    }
}
