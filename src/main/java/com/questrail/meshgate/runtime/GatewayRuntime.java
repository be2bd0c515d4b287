package com.questrail.meshgate.runtime;

import com.questrail.meshgate.command.BridgeServices;
import com.questrail.meshgate.command.CommandDispatcher;
import com.questrail.meshgate.command.CommandRegistry;
import com.questrail.meshgate.config.GatewayConfig;
import com.questrail.meshgate.correlation.CorrelationPolicy;
import com.questrail.meshgate.correlation.ExpirySweeper;
import com.questrail.meshgate.correlation.RequestCorrelator;
import com.questrail.meshgate.directory.NodeDirectory;
import com.questrail.meshgate.directory.NodeResolver;
import com.questrail.meshgate.internal.time.MonotonicClock;
import com.questrail.meshgate.internal.time.MonotonicScheduler;
import com.questrail.meshgate.internal.time.ScheduledExecutorScheduler;
import com.questrail.meshgate.internal.time.SystemMonotonicClock;
import com.questrail.meshgate.internal.time.SystemWallClock;
import com.questrail.meshgate.internal.time.WallClock;
import com.questrail.meshgate.irc.ChatServer;
import com.questrail.meshgate.irc.ChatServerSettings;
import com.questrail.meshgate.irc.ChatTransportAdapter;
import com.questrail.meshgate.lookup.HfConditionsLookup;
import com.questrail.meshgate.lookup.OpenWeatherMapLookup;
import com.questrail.meshgate.lookup.SwpcHfConditionsLookup;
import com.questrail.meshgate.lookup.WeatherLookup;
import com.questrail.meshgate.mesh.MeshInterface;
import com.questrail.meshgate.mesh.jsonl.JsonLinesMeshInterface;
import com.questrail.meshgate.mesh.jsonl.MeshJsonCodec;
import com.questrail.meshgate.mesh.sim.SimulatedMeshInterface;
import com.questrail.meshgate.observability.BridgeObservabilitySink;
import com.questrail.meshgate.observability.NullObservabilitySink;
import com.questrail.meshgate.relay.MeshEventRelay;
import com.questrail.meshgate.transport.LineEndpoint;
import com.questrail.meshgate.transport.tcp.netty.NettyTcpLineClient;
import com.questrail.meshgate.transport.tcp.netty.NettyTcpLineEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GatewayRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the gateway.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   LineEndpoint ⇄ ChatTransportAdapter ⇄ ChatServer ──▶ CommandDispatcher ──▶ BridgeCommand
 *                                              ▲                 │
 *                                              │                 ▼
 *   MeshInterface ──▶ MeshEventRelay ──────────┘          MeshInterface / RequestCorrelator
 *                          │                                      ▲
 *                          └──▶ NodeDirectory, RequestCorrelator ◀┘── ExpirySweeper
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} brings up the relay, mesh interface, expiry sweeper and the
 * listening endpoint, in that order. {@link #stop()} disconnects every client
 * and shuts the parts down in reverse.
 */
public final class GatewayRuntime {
    private static final Logger log = LoggerFactory.getLogger(GatewayRuntime.class);

    static final String SHUTDOWN_REASON = "Server shutting down";

    private final GatewayConfig config;
    private final ChatServer chatServer;
    private final ChatTransportAdapter transport;
    private final LineEndpoint endpoint;
    private final MeshInterface mesh;
    private final MeshEventRelay relay;
    private final ExpirySweeper sweeper;
    private final NodeDirectory directory;
    private final RequestCorrelator correlator;
    private final CommandRegistry registry;
    private final ScheduledExecutorService schedulerExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private GatewayRuntime(Builder b,
                           ChatServer chatServer,
                           ChatTransportAdapter transport,
                           LineEndpoint endpoint,
                           MeshInterface mesh,
                           MeshEventRelay relay,
                           ExpirySweeper sweeper,
                           NodeDirectory directory,
                           RequestCorrelator correlator,
                           CommandRegistry registry,
                           ScheduledExecutorService schedulerExecutor) {
        this.config = b.config;
        this.chatServer = chatServer;
        this.transport = transport;
        this.endpoint = endpoint;
        this.mesh = mesh;
        this.relay = relay;
        this.sweeper = sweeper;
        this.directory = directory;
        this.correlator = correlator;
        this.registry = registry;
        this.schedulerExecutor = schedulerExecutor;
    }

    /**
     * Starts every component.
     *
     * @throws IllegalStateException if the listen port cannot be bound; anything
     *                               already started is stopped again
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting Meshtastic IRC gateway {}: {}", GatewayVersion.VERSION, config);
        relay.start();
        mesh.start();
        sweeper.start();
        try {
            transport.start();
        } catch (IllegalStateException e) {
            log.error("Failed to start IRC listener on {}:{}", config.ircHost(), config.ircPort(), e);
            stop();
            throw e;
        }
        log.info("IRC listener up on {}; control channel {}",
                endpoint.boundAddress().map(Object::toString).orElse(config.ircHost() + ":" + config.ircPort()),
                config.controlChannel());
    }

    /**
     * Disconnects all clients and stops every component. Safe to call more than once.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down gateway");
        chatServer.disconnectAll(SHUTDOWN_REASON);
        transport.stop();
        mesh.stop();
        sweeper.stop();
        relay.stop();
        if (schedulerExecutor != null) {
            schedulerExecutor.shutdown();
            try {
                if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    schedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                schedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Gateway stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public GatewayConfig config() {
        return config;
    }

    public ChatServer chatServer() {
        return chatServer;
    }

    public NodeDirectory directory() {
        return directory;
    }

    public RequestCorrelator correlator() {
        return correlator;
    }

    public MeshEventRelay relay() {
        return relay;
    }

    public CommandRegistry commands() {
        return registry;
    }

    public Optional<SocketAddress> boundAddress() {
        return endpoint.boundAddress();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private GatewayConfig config = GatewayConfig.defaults();
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ZoneId zone = ZoneId.systemDefault();
        private LineEndpoint lineEndpoint;
        private MeshInterface meshInterface;
        private CommandRegistry commandRegistry;
        private WeatherLookup weatherLookup;
        private HfConditionsLookup hfConditionsLookup;

        private Builder() {
        }

        public Builder withConfig(GatewayConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the system clock and the runtime-owned scheduler thread.
         */
        public Builder withTime(MonotonicClock clock, MonotonicScheduler scheduler, WallClock wallClock) {
            this.clock = clock;
            this.scheduler = scheduler;
            this.wallClock = wallClock;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        /** Replaces the Netty TCP listener. */
        public Builder withLineEndpoint(LineEndpoint endpoint) {
            this.lineEndpoint = endpoint;
            return this;
        }

        /** Replaces the mesh interface selected by {@code mesh.transport}. */
        public Builder withMeshInterface(MeshInterface mesh) {
            this.meshInterface = mesh;
            return this;
        }

        /** Replaces ServiceLoader command discovery. */
        public Builder withCommandRegistry(CommandRegistry registry) {
            this.commandRegistry = registry;
            return this;
        }

        public Builder withWeatherLookup(WeatherLookup lookup) {
            this.weatherLookup = lookup;
            return this;
        }

        public Builder withHfConditionsLookup(HfConditionsLookup lookup) {
            this.hfConditionsLookup = lookup;
            return this;
        }

        public GatewayRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(zone, "zone");
            BridgeObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Time
            MonotonicClock monotonic;
            MonotonicScheduler sched;
            ScheduledExecutorService ownedExecutor = null;
            if (clock != null && scheduler != null) {
                monotonic = clock;
                sched = scheduler;
            } else {
                monotonic = SystemMonotonicClock.INSTANCE;
                ownedExecutor = Executors.newScheduledThreadPool(1, r -> {
                    Thread t = new Thread(r, "meshgate-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                sched = new ScheduledExecutorScheduler(ownedExecutor, monotonic);
            }
            long startedAt = monotonic.nowNanos();

            // 2. Shared state
            NodeDirectory directory = new NodeDirectory();
            NodeResolver resolver = new NodeResolver(directory);
            RequestCorrelator correlator = new RequestCorrelator(monotonic, wallClock,
                    new CorrelationPolicy(config.ackTimeout(), config.sweepInterval()), sink);

            // 3. Chat side
            ChatServer chat = new ChatServer(
                    new ChatServerSettings(config.serverName(), config.controlChannel(), config.topic(),
                            config.registrationTimeout(), GatewayVersion.VERSION),
                    monotonic, sched, wallClock, sink);
            LineEndpoint endpoint = lineEndpoint != null
                    ? lineEndpoint
                    : new NettyTcpLineEndpoint(new InetSocketAddress(config.ircHost(), config.ircPort()));
            ChatTransportAdapter transport = new ChatTransportAdapter(chat, endpoint, wallClock, sink);

            // 4. Mesh side
            MeshInterface mesh = meshInterface != null ? meshInterface : createMesh(monotonic, sched);
            MeshEventRelay relay = new MeshEventRelay(directory, correlator, chat,
                    config.relayQueueCapacity(), wallClock, sink);
            mesh.setListener(relay);
            ExpirySweeper sweeper = new ExpirySweeper(correlator, monotonic, sched,
                    notice -> chat.sendToSession(notice.nickname(), notice.line()));

            // 5. Commands
            CommandRegistry registry = commandRegistry != null ? commandRegistry : CommandRegistry.discover();
            WeatherLookup weather = weatherLookup != null
                    ? weatherLookup
                    : new OpenWeatherMapLookup(config.weatherApiKey(), config.weatherLocation(), config.weatherUnits());
            HfConditionsLookup hf = hfConditionsLookup != null
                    ? hfConditionsLookup
                    : new SwpcHfConditionsLookup(config.hfSourceUrl());
            BridgeServices services = new BridgeServices(directory, resolver, correlator, mesh, chat, registry,
                    weather, hf, monotonic, wallClock, startedAt, config.meshDefaultChannel(), zone);
            chat.attachCommandHandler(new CommandDispatcher(services, sink));

            return new GatewayRuntime(this, chat, transport, endpoint, mesh, relay, sweeper,
                    directory, correlator, registry, ownedExecutor);
        }

        private MeshInterface createMesh(MonotonicClock monotonic, MonotonicScheduler sched) {
            switch (config.meshTransport()) {
                case JSON_TCP:
                    String target = config.meshHost() + ":" + config.meshPort();
                    return new JsonLinesMeshInterface(
                            new NettyTcpLineClient(new InetSocketAddress(config.meshHost(), config.meshPort())),
                            target, new MeshJsonCodec(), monotonic, sched, wallClock);
                case SIMULATOR:
                default:
                    log.info("Using simulated mesh interface");
                    return new SimulatedMeshInterface(monotonic, sched, wallClock);
            }
        }
    }
}
