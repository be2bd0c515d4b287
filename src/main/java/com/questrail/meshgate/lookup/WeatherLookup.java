package com.questrail.meshgate.lookup;

/**
 * Current weather for the gateway's configured location.
 */
public interface WeatherLookup
{
    /** {@code false} when the API key or location is missing. */
    boolean isConfigured();

    String location();

    /**
     * Fetches current conditions. Never throws for service failures; they come
     * back as {@link LookupResult.Unavailable}.
     */
    LookupResult currentConditions();
}
