package com.questrail.meshgate.lookup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.meshgate.internal.json.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Blocking GET of a JSON document with display-ready failure messages.
 */
final class HttpJsonFetcher
{
    private static final Logger log = LoggerFactory.getLogger(HttpJsonFetcher.class);

    static final String USER_AGENT = "meshgate/0.1 (Meshtastic IRC gateway)";

    private final HttpClient http;
    private final Duration timeout;
    private final String serviceName;

    HttpJsonFetcher(HttpClient http, Duration timeout, String serviceName)
    {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
    }

    static HttpClient defaultClient()
    {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * @param statusMessage maps a non-2xx status to a display message
     * @throws LookupException on any failure
     */
    JsonNode get(URI uri, IntFunction<String> statusMessage)
    {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        }
        catch (HttpTimeoutException e) {
            log.error("{} request timed out", serviceName);
            throw new LookupException("Request to " + serviceName + " timed out.", e);
        }
        catch (IOException e) {
            log.error("{} request failed", serviceName, e);
            throw new LookupException("Error fetching data from " + serviceName + ": Network or connection issue.", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException("Request to " + serviceName + " was interrupted.", e);
        }

        int status = response.statusCode();
        if (status < 200 || status > 299) {
            log.error("{} HTTP error: {} - {}", serviceName, status, response.body());
            throw new LookupException(statusMessage.apply(status));
        }

        try {
            return Jsons.readTree(response.body());
        }
        catch (JsonProcessingException e) {
            log.error("Failed to decode JSON response from {}", serviceName, e);
            throw new LookupException("Received invalid data format from " + serviceName + ".", e);
        }
    }
}
