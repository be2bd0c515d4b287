package com.questrail.meshgate.command.builtin;

import com.questrail.meshgate.command.CommandFixture;
import com.questrail.meshgate.lookup.LookupResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LookupCommandsTest
 * -----------------------------------------------------------------------------
 * WEATHER and HFCONDITIONS relay lookup results to the requester.
 */
class LookupCommandsTest {

    private CommandFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new CommandFixture();
    }

    @Test
    void unconfiguredWeatherDoesNotCallTheService() {
        fixture.weather.configured = false;

        assertEquals(List.of("Weather command is not configured (API key or location missing)."),
                fixture.run("WEATHER"));
        assertEquals(0, fixture.weather.calls);
    }

    @Test
    void weatherLinesAreRelayed() {
        fixture.weather.result = new LookupResult.Available(List.of("line 1", "line 2"));

        assertEquals(List.of("Fetching weather for Port Colborne...", "line 1", "line 2"), fixture.run("weather"));
    }

    @Test
    void weatherFailureIsReported() {
        fixture.weather.result = new LookupResult.Unavailable("Invalid weather API key.");

        assertEquals(List.of("Fetching weather for Port Colborne...", "Error: Invalid weather API key."),
                fixture.run("WEATHER"));
    }

    @Test
    void hfConditionsAreRelayed() {
        assertEquals(List.of("Fetching HF conditions from NOAA SWPC...", "quiet sun"), fixture.run("HFCONDITIONS"));
    }

    @Test
    void hfConditionsFailureIsReported() {
        fixture.hfConditions.result = new LookupResult.Unavailable("NOAA SWPC returned status code 503.");

        assertEquals(List.of("Fetching HF conditions from NOAA SWPC...", "Error: NOAA SWPC returned status code 503."),
                fixture.run("HFCONDITIONS"));
    }
}
