package com.questrail.meshgate.cli;

import ch.qos.logback.classic.Level;
import com.questrail.meshgate.config.GatewayConfig;
import com.questrail.meshgate.config.GatewayConfigLoader;
import com.questrail.meshgate.observability.Slf4jBridgeObservabilitySink;
import com.questrail.meshgate.runtime.GatewayRuntime;
import com.questrail.meshgate.runtime.GatewayVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point: loads configuration, runs the gateway until the
 * JVM is asked to exit.
 *
 * <p>Exit status 1 when the listen port cannot be bound, 2 for invalid
 * configuration.</p>
 */
@Command(
        name = "meshgate",
        mixinStandardHelpOptions = true,
        versionProvider = GatewayCommand.VersionProvider.class,
        description = "Meshtastic IRC gateway: an IRC control channel for a Meshtastic mesh"
)
public final class GatewayCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(GatewayCommand.class);

    static final int EXIT_BIND_FAILURE = 1;
    static final int EXIT_BAD_CONFIG = 2;

    @Option(names = {"-H", "--host"}, description = "Address to listen on (default 0.0.0.0)")
    String host;

    @Option(names = {"-p", "--port"}, description = "IRC port to listen on (default 6667)")
    Integer port;

    @Option(names = {"-n", "--servername"}, description = "IRC server name (default meshgate.gw)")
    String serverName;

    @Option(names = {"--control-channel"}, description = "Control channel name (default #meshtastic-ctrl)")
    String controlChannel;

    @Option(names = {"--mesh-transport"}, description = "simulator or json-tcp (default simulator)")
    String meshTransport;

    @Option(names = {"--mesh-host"}, description = "Mesh daemon host for json-tcp")
    String meshHost;

    @Option(names = {"--mesh-port"}, description = "Mesh daemon port for json-tcp (default 4403)")
    Integer meshPort;

    @Option(names = {"--mesh-channel"}, description = "Default mesh channel index for SEND and ALARM (default 0)")
    Integer meshChannel;

    @Option(names = {"-c", "--config"}, description = "Properties file overriding the built-in configuration")
    Path configFile;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    boolean verbose;

    @Override
    public Integer call() throws InterruptedException {
        if (verbose) {
            enableDebugLogging();
        }

        final GatewayConfig config;
        try {
            config = new GatewayConfigLoader().load(configFile, overrides());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_BAD_CONFIG;
        }

        GatewayRuntime runtime = GatewayRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jBridgeObservabilitySink())
                .build();

        try {
            runtime.start();
        } catch (IllegalStateException e) {
            log.error("Gateway failed to start: {}", e.getMessage());
            return EXIT_BIND_FAILURE;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            runtime.stop();
            stopped.countDown();
        }, "meshgate-shutdown"));

        stopped.await();
        return 0;
    }

    /**
     * Options given on the command line, as configuration property keys.
     */
    Map<String, String> overrides() {
        Map<String, String> out = new LinkedHashMap<>();
        put(out, GatewayConfig.IRC_HOST, host);
        put(out, GatewayConfig.IRC_PORT, port);
        put(out, GatewayConfig.IRC_SERVER_NAME, serverName);
        put(out, GatewayConfig.IRC_CONTROL_CHANNEL, controlChannel);
        put(out, GatewayConfig.MESH_TRANSPORT, meshTransport);
        put(out, GatewayConfig.MESH_HOST, meshHost);
        put(out, GatewayConfig.MESH_PORT, meshPort);
        put(out, GatewayConfig.MESH_DEFAULT_CHANNEL, meshChannel);
        return out;
    }

    private static void put(Map<String, String> out, String key, Object value) {
        if (value != null) {
            out.put(key, value.toString());
        }
    }

    private static void enableDebugLogging() {
        Logger gatewayLogger = LoggerFactory.getLogger("com.questrail.meshgate");
        if (gatewayLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
            log.debug("Debug logging enabled");
        } else {
            log.warn("Cannot raise log level: SLF4J is not bound to Logback");
        }
    }

    public static final class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"meshgate " + GatewayVersion.VERSION};
        }
    }
}
