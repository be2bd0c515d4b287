package com.questrail.meshgate.irc;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed identity and limits of the chat server.
 */
public record ChatServerSettings(
        String serverName,
        String roomName,
        String topic,
        Duration registrationTimeout,
        String version
) {
    public ChatServerSettings {
        Objects.requireNonNull(serverName, "serverName");
        Objects.requireNonNull(roomName, "roomName");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(registrationTimeout, "registrationTimeout");
        Objects.requireNonNull(version, "version");

        if (serverName.isBlank() || serverName.contains(" ")) {
            throw new IllegalArgumentException("serverName must be a single word");
        }
        if (roomName.length() < 2 || (roomName.charAt(0) != '#' && roomName.charAt(0) != '&')) {
            throw new IllegalArgumentException("roomName must start with '#' or '&'");
        }
        if (registrationTimeout.isNegative() || registrationTimeout.isZero()) {
            throw new IllegalArgumentException("registrationTimeout must be positive");
        }
    }
}
