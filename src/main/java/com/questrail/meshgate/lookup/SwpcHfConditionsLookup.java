package com.questrail.meshgate.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HfConditionsLookup} backed by a NOAA Space Weather Prediction Center
 * summary product.
 */
public final class SwpcHfConditionsLookup implements HfConditionsLookup
{
    private static final Logger log = LoggerFactory.getLogger(SwpcHfConditionsLookup.class);

    public static final URI DEFAULT_SOURCE =
            URI.create("https://services.swpc.noaa.gov/products/summary/3-day-forecast.json");

    private final URI source;
    private final HttpJsonFetcher fetcher;

    public SwpcHfConditionsLookup(URI source)
    {
        this(source, HttpJsonFetcher.defaultClient());
    }

    SwpcHfConditionsLookup(URI source, HttpClient http)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.fetcher = new HttpJsonFetcher(http, Duration.ofSeconds(15), "NOAA SWPC");
    }

    @Override
    public LookupResult currentConditions()
    {
        try {
            JsonNode data = fetcher.get(source, status -> "NOAA SWPC returned status code " + status + ".");
            log.debug("NOAA SWPC response: {}", data);
            Optional<SwpcSummaryParser.HfSummary> summary = SwpcSummaryParser.parse(data);
            if (summary.isEmpty()) {
                return new LookupResult.Unavailable("Could not parse relevant data from SWPC response.");
            }
            return new LookupResult.Available(SwpcSummaryParser.format(summary.get()));
        }
        catch (LookupException e) {
            return new LookupResult.Unavailable(e.getMessage());
        }
    }
}
