package com.questrail.meshgate.config;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * GatewayConfig
 * =============================================================================
 * Immutable gateway settings.
 *
 * <p>Built from {@link #builder()} defaults, overlaid with properties
 * ({@link Builder#apply(Properties)}) in precedence order. Every value is
 * validated on {@link Builder#build()}; an invalid value raises
 * {@link IllegalArgumentException} naming its property key.</p>
 *
 * <h2>Keys</h2>
 * <pre>
 *   irc.host, irc.port, irc.serverName, irc.controlChannel, irc.topic,
 *   irc.registrationTimeout (s), mesh.transport, mesh.host, mesh.port,
 *   mesh.defaultChannel, mesh.ackTimeout (s), mesh.sweepInterval (ms),
 *   relay.queueCapacity, weather.apiKey, weather.location, weather.units,
 *   hf.sourceUrl
 * </pre>
 */
public record GatewayConfig(
        String ircHost,
        int ircPort,
        String serverName,
        String controlChannel,
        String topic,
        Duration registrationTimeout,
        MeshTransport meshTransport,
        String meshHost,
        int meshPort,
        int meshDefaultChannel,
        Duration ackTimeout,
        Duration sweepInterval,
        int relayQueueCapacity,
        String weatherApiKey,
        String weatherLocation,
        String weatherUnits,
        URI hfSourceUrl
) {
    public static final String IRC_HOST = "irc.host";
    public static final String IRC_PORT = "irc.port";
    public static final String IRC_SERVER_NAME = "irc.serverName";
    public static final String IRC_CONTROL_CHANNEL = "irc.controlChannel";
    public static final String IRC_TOPIC = "irc.topic";
    public static final String IRC_REGISTRATION_TIMEOUT = "irc.registrationTimeout";
    public static final String MESH_TRANSPORT = "mesh.transport";
    public static final String MESH_HOST = "mesh.host";
    public static final String MESH_PORT = "mesh.port";
    public static final String MESH_DEFAULT_CHANNEL = "mesh.defaultChannel";
    public static final String MESH_ACK_TIMEOUT = "mesh.ackTimeout";
    public static final String MESH_SWEEP_INTERVAL = "mesh.sweepInterval";
    public static final String RELAY_QUEUE_CAPACITY = "relay.queueCapacity";
    public static final String WEATHER_API_KEY = "weather.apiKey";
    public static final String WEATHER_LOCATION = "weather.location";
    public static final String WEATHER_UNITS = "weather.units";
    public static final String HF_SOURCE_URL = "hf.sourceUrl";

    public GatewayConfig {
        requireText(ircHost, IRC_HOST);
        requirePort(ircPort, IRC_PORT);
        requireText(serverName, IRC_SERVER_NAME);
        if (serverName.contains(" ")) {
            throw new IllegalArgumentException(IRC_SERVER_NAME + " must not contain spaces");
        }
        requireText(controlChannel, IRC_CONTROL_CHANNEL);
        if (!(controlChannel.startsWith("#") || controlChannel.startsWith("&")) || controlChannel.length() < 2
                || controlChannel.contains(" ") || controlChannel.contains(",")) {
            throw new IllegalArgumentException(IRC_CONTROL_CHANNEL + " must start with '#' or '&': " + controlChannel);
        }
        Objects.requireNonNull(topic, IRC_TOPIC);
        requirePositive(registrationTimeout, IRC_REGISTRATION_TIMEOUT);
        Objects.requireNonNull(meshTransport, MESH_TRANSPORT);
        if (meshTransport == MeshTransport.JSON_TCP && (meshHost == null || meshHost.isBlank())) {
            throw new IllegalArgumentException(MESH_HOST + " is required when " + MESH_TRANSPORT + " is json-tcp");
        }
        requirePort(meshPort, MESH_PORT);
        if (meshDefaultChannel < 0 || meshDefaultChannel > 7) {
            throw new IllegalArgumentException(MESH_DEFAULT_CHANNEL + " must be 0..7: " + meshDefaultChannel);
        }
        requirePositive(ackTimeout, MESH_ACK_TIMEOUT);
        requirePositive(sweepInterval, MESH_SWEEP_INTERVAL);
        if (relayQueueCapacity <= 0) {
            throw new IllegalArgumentException(RELAY_QUEUE_CAPACITY + " must be > 0: " + relayQueueCapacity);
        }
        requireText(weatherUnits, WEATHER_UNITS);
        if (!weatherUnits.equals("metric") && !weatherUnits.equals("imperial")) {
            throw new IllegalArgumentException(WEATHER_UNITS + " must be metric or imperial: " + weatherUnits);
        }
        Objects.requireNonNull(hfSourceUrl, HF_SOURCE_URL);
    }

    public static GatewayConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.ircHost = ircHost;
        b.ircPort = ircPort;
        b.serverName = serverName;
        b.controlChannel = controlChannel;
        b.topic = topic;
        b.registrationTimeout = registrationTimeout;
        b.meshTransport = meshTransport;
        b.meshHost = meshHost;
        b.meshPort = meshPort;
        b.meshDefaultChannel = meshDefaultChannel;
        b.ackTimeout = ackTimeout;
        b.sweepInterval = sweepInterval;
        b.relayQueueCapacity = relayQueueCapacity;
        b.weatherApiKey = weatherApiKey;
        b.weatherLocation = weatherLocation;
        b.weatherUnits = weatherUnits;
        b.hfSourceUrl = hfSourceUrl;
        return b;
    }

    public boolean weatherConfigured() {
        return weatherApiKey != null && !weatherApiKey.isBlank()
                && weatherLocation != null && !weatherLocation.isBlank();
    }

    @Override
    public String toString() {
        return "GatewayConfig{irc=" + ircHost + ":" + ircPort
                + ", serverName=" + serverName
                + ", controlChannel=" + controlChannel
                + ", mesh=" + meshTransport + (meshHost == null ? "" : "@" + meshHost + ":" + meshPort)
                + ", meshChannel=" + meshDefaultChannel
                + ", ackTimeout=" + ackTimeout
                + ", weatherApiKey=" + (weatherApiKey == null ? "unset" : "***")
                + ", weatherLocation=" + weatherLocation
                + "}";
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must not be blank");
        }
    }

    private static void requirePort(int port, String key) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(key + " must be 1..65535: " + port);
        }
    }

    private static void requirePositive(Duration d, String key) {
        Objects.requireNonNull(d, key);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(key + " must be > 0");
        }
    }

    public static final class Builder {
        private String ircHost = "0.0.0.0";
        private int ircPort = 6667;
        private String serverName = "meshgate.gw";
        private String controlChannel = "#meshtastic-ctrl";
        private String topic = "Meshtastic IRC Gateway | Type HELP for commands";
        private Duration registrationTimeout = Duration.ofSeconds(60);
        private MeshTransport meshTransport = MeshTransport.SIMULATOR;
        private String meshHost;
        private int meshPort = 4403;
        private int meshDefaultChannel = 0;
        private Duration ackTimeout = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofMillis(1000);
        private int relayQueueCapacity = 1024;
        private String weatherApiKey;
        private String weatherLocation = "Port Colborne,CA";
        private String weatherUnits = "metric";
        private URI hfSourceUrl = URI.create("https://services.swpc.noaa.gov/products/summary/3-day-forecast.json");

        private Builder() {
        }

        public Builder ircHost(String v) { this.ircHost = v; return this; }
        public Builder ircPort(int v) { this.ircPort = v; return this; }
        public Builder serverName(String v) { this.serverName = v; return this; }
        public Builder controlChannel(String v) { this.controlChannel = v; return this; }
        public Builder topic(String v) { this.topic = v; return this; }
        public Builder registrationTimeout(Duration v) { this.registrationTimeout = v; return this; }
        public Builder meshTransport(MeshTransport v) { this.meshTransport = v; return this; }
        public Builder meshHost(String v) { this.meshHost = v; return this; }
        public Builder meshPort(int v) { this.meshPort = v; return this; }
        public Builder meshDefaultChannel(int v) { this.meshDefaultChannel = v; return this; }
        public Builder ackTimeout(Duration v) { this.ackTimeout = v; return this; }
        public Builder sweepInterval(Duration v) { this.sweepInterval = v; return this; }
        public Builder relayQueueCapacity(int v) { this.relayQueueCapacity = v; return this; }
        public Builder weatherApiKey(String v) { this.weatherApiKey = v; return this; }
        public Builder weatherLocation(String v) { this.weatherLocation = v; return this; }
        public Builder weatherUnits(String v) { this.weatherUnits = v; return this; }
        public Builder hfSourceUrl(URI v) { this.hfSourceUrl = v; return this; }

        /**
         * Overlays every recognized key present in {@code props}. Unknown keys
         * are ignored; blank values clear optional settings.
         *
         * @throws IllegalArgumentException if a value does not parse
         */
        public Builder apply(Properties props) {
            Objects.requireNonNull(props, "props");
            String v;
            if ((v = value(props, IRC_HOST)) != null) ircHost = v;
            if ((v = value(props, IRC_PORT)) != null) ircPort = parseInt(v, IRC_PORT);
            if ((v = value(props, IRC_SERVER_NAME)) != null) serverName = v;
            if ((v = value(props, IRC_CONTROL_CHANNEL)) != null) controlChannel = v;
            if (props.containsKey(IRC_TOPIC)) topic = props.getProperty(IRC_TOPIC).trim();
            if ((v = value(props, IRC_REGISTRATION_TIMEOUT)) != null) {
                registrationTimeout = Duration.ofSeconds(parseLong(v, IRC_REGISTRATION_TIMEOUT));
            }
            if ((v = value(props, MESH_TRANSPORT)) != null) meshTransport = MeshTransport.fromKey(v);
            if (props.containsKey(MESH_HOST)) meshHost = blankToNull(props.getProperty(MESH_HOST));
            if ((v = value(props, MESH_PORT)) != null) meshPort = parseInt(v, MESH_PORT);
            if ((v = value(props, MESH_DEFAULT_CHANNEL)) != null) meshDefaultChannel = parseInt(v, MESH_DEFAULT_CHANNEL);
            if ((v = value(props, MESH_ACK_TIMEOUT)) != null) ackTimeout = Duration.ofSeconds(parseLong(v, MESH_ACK_TIMEOUT));
            if ((v = value(props, MESH_SWEEP_INTERVAL)) != null) sweepInterval = Duration.ofMillis(parseLong(v, MESH_SWEEP_INTERVAL));
            if ((v = value(props, RELAY_QUEUE_CAPACITY)) != null) relayQueueCapacity = parseInt(v, RELAY_QUEUE_CAPACITY);
            if (props.containsKey(WEATHER_API_KEY)) weatherApiKey = blankToNull(props.getProperty(WEATHER_API_KEY));
            if (props.containsKey(WEATHER_LOCATION)) weatherLocation = blankToNull(props.getProperty(WEATHER_LOCATION));
            if ((v = value(props, WEATHER_UNITS)) != null) weatherUnits = v.toLowerCase(Locale.ROOT);
            if ((v = value(props, HF_SOURCE_URL)) != null) hfSourceUrl = parseUri(v, HF_SOURCE_URL);
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(ircHost, ircPort, serverName, controlChannel, topic, registrationTimeout,
                    meshTransport, meshHost, meshPort, meshDefaultChannel, ackTimeout, sweepInterval,
                    relayQueueCapacity, weatherApiKey, weatherLocation, weatherUnits, hfSourceUrl);
        }

        private static String value(Properties props, String key) {
            String raw = props.getProperty(key);
            return raw == null || raw.isBlank() ? null : raw.trim();
        }

        private static String blankToNull(String raw) {
            return raw == null || raw.isBlank() ? null : raw.trim();
        }

        private static int parseInt(String v, String key) {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + v, e);
            }
        }

        private static long parseLong(String v, String key) {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + v, e);
            }
        }

        private static URI parseUri(String v, String key) {
            try {
                return URI.create(v);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(key + " is not a valid URL: " + v, e);
            }
        }
    }
}
