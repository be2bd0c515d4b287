package com.questrail.meshgate.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GatewayConfigLoaderTest
 * -----------------------------------------------------------------------------
 * Layering of classpath defaults, an external file, command-line overrides
 * and the weather key environment fallback.
 */
class GatewayConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void classpathDefaultsAloneProduceTheDefaultConfig() {
        GatewayConfig config = new GatewayConfigLoader(Map.of()).load(null, Map.of());

        assertEquals(6667, config.ircPort());
        assertEquals("#meshtastic-ctrl", config.controlChannel());
        assertEquals("Port Colborne,CA", config.weatherLocation());
        assertNull(config.weatherApiKey());
    }

    @Test
    void fileOverridesDefaultsAndCommandLineOverridesFile() throws IOException {
        Path file = tempDir.resolve("gw.properties");
        Files.writeString(file, "irc.port=7001\nirc.serverName=lake.gw\n", StandardCharsets.UTF_8);

        GatewayConfig config = new GatewayConfigLoader(Map.of())
                .load(file, Map.of(GatewayConfig.IRC_PORT, "7002"));

        assertEquals(7002, config.ircPort());
        assertEquals("lake.gw", config.serverName());
    }

    @Test
    void missingFileIsReportedAsInvalidConfiguration() {
        Path missing = tempDir.resolve("absent.properties");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new GatewayConfigLoader(Map.of()).load(missing, Map.of()));
        assertTrue(e.getMessage().contains("absent.properties"));
    }

    @Test
    void apiKeyFallsBackToTheEnvironment() {
        GatewayConfig config = new GatewayConfigLoader(Map.of(GatewayConfigLoader.WEATHER_API_KEY_ENV, " envkey "))
                .load(null, Map.of());

        assertEquals("envkey", config.weatherApiKey());
        assertTrue(config.weatherConfigured());
    }

    @Test
    void configuredApiKeyWinsOverTheEnvironment() {
        GatewayConfig config = new GatewayConfigLoader(Map.of(GatewayConfigLoader.WEATHER_API_KEY_ENV, "envkey"))
                .load(null, Map.of(GatewayConfig.WEATHER_API_KEY, "filekey"));

        assertEquals("filekey", config.weatherApiKey());
    }

    @Test
    void invalidOverrideSurfacesAsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> new GatewayConfigLoader(Map.of()).load(null, Map.of(GatewayConfig.MESH_TRANSPORT, "json-tcp")));
    }
}
