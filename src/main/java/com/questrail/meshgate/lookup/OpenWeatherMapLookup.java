package com.questrail.meshgate.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * {@link WeatherLookup} backed by the OpenWeatherMap current-weather API.
 */
public final class OpenWeatherMapLookup implements WeatherLookup
{
    private static final Logger log = LoggerFactory.getLogger(OpenWeatherMapLookup.class);

    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.openweathermap.org/data/2.5/weather");

    private final URI endpoint;
    private final String apiKey;
    private final String location;
    private final String units;
    private final HttpJsonFetcher fetcher;
    private final WeatherReportFormatter formatter;

    public OpenWeatherMapLookup(String apiKey, String location, String units)
    {
        this(DEFAULT_ENDPOINT, apiKey, location, units, HttpJsonFetcher.defaultClient(), ZoneId.systemDefault());
    }

    OpenWeatherMapLookup(URI endpoint, String apiKey, String location, String units, HttpClient http, ZoneId zone)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.apiKey = apiKey;
        this.location = location;
        this.units = Objects.requireNonNull(units, "units");
        this.fetcher = new HttpJsonFetcher(http, Duration.ofSeconds(10), "weather API");
        this.formatter = new WeatherReportFormatter(units, zone);
    }

    @Override
    public boolean isConfigured()
    {
        return apiKey != null && !apiKey.isBlank() && location != null && !location.isBlank();
    }

    @Override
    public String location()
    {
        return location;
    }

    @Override
    public LookupResult currentConditions()
    {
        if (!isConfigured()) {
            return new LookupResult.Unavailable("Weather command is not configured (API key or location missing).");
        }

        URI uri = URI.create(endpoint + "?q=" + encode(location)
                + "&appid=" + encode(apiKey)
                + "&units=" + encode(units));
        try {
            JsonNode data = fetcher.get(uri, this::statusMessage);
            log.debug("OpenWeatherMap response: {}", data);
            return new LookupResult.Available(formatter.format(data, location));
        }
        catch (LookupException e) {
            return new LookupResult.Unavailable(e.getMessage());
        }
    }

    private String statusMessage(int status)
    {
        switch (status) {
            case 401:
                return "Invalid weather API key.";
            case 404:
                return "Weather location '" + location + "' not found.";
            case 429:
                return "Weather API rate limit exceeded.";
            default:
                return "Weather API returned status code " + status + ".";
        }
    }

    private static String encode(String s)
    {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
