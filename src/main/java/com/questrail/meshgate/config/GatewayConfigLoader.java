package com.questrail.meshgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Assembles a {@link GatewayConfig} from its layered sources, lowest
 * precedence first:
 *
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>classpath resource {@value #RESOURCE}</li>
 *   <li>an optional external properties file</li>
 *   <li>command-line overrides</li>
 * </ol>
 *
 * A missing {@code weather.apiKey} falls back to the {@value #WEATHER_API_KEY_ENV}
 * environment variable.
 */
public final class GatewayConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(GatewayConfigLoader.class);

    public static final String RESOURCE = "meshgate.properties";
    public static final String WEATHER_API_KEY_ENV = "WEATHER_API_KEY";

    private final Map<String, String> environment;

    public GatewayConfigLoader()
    {
        this(System.getenv());
    }

    public GatewayConfigLoader(Map<String, String> environment)
    {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * @param externalFile optional properties file, may be {@code null}
     * @param overrides    property-key overrides from the command line
     * @throws IllegalArgumentException for an invalid or unreadable setting
     */
    public GatewayConfig load(Path externalFile, Map<String, String> overrides)
    {
        Objects.requireNonNull(overrides, "overrides");
        GatewayConfig.Builder builder = GatewayConfig.builder();

        builder.apply(classpathDefaults());
        if (externalFile != null) {
            builder.apply(readFile(externalFile));
        }

        Properties cli = new Properties();
        cli.putAll(overrides);
        builder.apply(cli);

        GatewayConfig config = builder.build();
        if (config.weatherApiKey() == null) {
            String fromEnv = environment.get(WEATHER_API_KEY_ENV);
            if (fromEnv != null && !fromEnv.isBlank()) {
                config = config.toBuilder().weatherApiKey(fromEnv.trim()).build();
            }
        }

        warnAboutDubiousSettings(config);
        return config;
    }

    private static Properties classpathDefaults()
    {
        Properties props = new Properties();
        try (InputStream in = GatewayConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath; using built-in defaults", RESOURCE);
                return props;
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource " + RESOURCE, e);
        }
        return props;
    }

    private static Properties readFile(Path file)
    {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
        log.info("Loaded configuration file {}", file);
        return props;
    }

    private static void warnAboutDubiousSettings(GatewayConfig config)
    {
        if (config.ircPort() < 1024) {
            log.warn("Port {} is privileged (< 1024) and may require root privileges", config.ircPort());
        }
        if (!config.weatherConfigured()) {
            log.warn("Weather API key or location not configured; WEATHER command will be unavailable");
        }
    }
}
