package com.questrail.meshgate.lookup;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns an OpenWeatherMap "current weather" document into chat lines.
 */
public final class WeatherReportFormatter
{
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT);
    private static final DateTimeFormatter REPORT_TIME = DateTimeFormatter.ofPattern("HH:mm:ss z", Locale.ROOT);

    private final String units;
    private final ZoneId zone;

    public WeatherReportFormatter(String units, ZoneId zone)
    {
        this.units = Objects.requireNonNull(units, "units");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * @param fallbackLocation shown when the document carries no place name
     * @throws LookupException if the document lacks the {@code main} or {@code weather} sections,
     *                         or carries a timestamp outside the representable range
     */
    public List<String> format(JsonNode data, String fallbackLocation)
    {
        JsonNode main = data.path("main");
        JsonNode weatherList = data.path("weather");
        if (!main.isObject() || !weatherList.isArray() || weatherList.isEmpty()) {
            throw new LookupException("Received unexpected data format from weather API.");
        }

        JsonNode weather = weatherList.get(0);
        JsonNode wind = data.path("wind");
        JsonNode sys = data.path("sys");

        boolean metric = "metric".equalsIgnoreCase(units);
        String tempSuffix = metric ? "°C" : "°F";
        String speedSuffix = metric ? "m/s" : "mph";

        String location = data.path("name").isTextual() && !data.path("name").asText().isEmpty()
                ? data.path("name").asText()
                : fallbackLocation;

        String windText = decimal(wind.path("speed"), speedSuffix);
        if (wind.path("deg").isNumber()) {
            windText += " (" + wind.path("deg").asText() + "°)";
        }

        List<String> lines = new ArrayList<>();
        lines.add("--- Weather for " + location + " (as of " + time(data.path("dt"), REPORT_TIME) + ") ---");
        lines.add("Conditions: " + capitalize(weather.path("description").asText("N/A")));
        lines.add("Temperature: " + decimal(main.path("temp"), tempSuffix)
                + " (Feels like: " + decimal(main.path("feels_like"), tempSuffix) + ")");
        lines.add("Humidity: " + plain(main.path("humidity"), "%")
                + " | Pressure: " + plain(main.path("pressure"), " hPa"));
        lines.add("Wind: " + windText);
        lines.add("Sunrise: " + time(sys.path("sunrise"), CLOCK) + " | Sunset: " + time(sys.path("sunset"), CLOCK));
        lines.add("--- End of Weather ---");
        return lines;
    }

    private static String decimal(JsonNode value, String suffix)
    {
        return value.isNumber() ? String.format(Locale.ROOT, "%.1f%s", value.asDouble(), suffix) : "N/A";
    }

    private static String plain(JsonNode value, String suffix)
    {
        return value.isNumber() ? value.asText() + suffix : "N/A";
    }

    private String time(JsonNode epochSeconds, DateTimeFormatter format)
    {
        if (!epochSeconds.isNumber() || epochSeconds.asLong() == 0) {
            return "N/A";
        }
        try {
            return format.format(Instant.ofEpochSecond(epochSeconds.asLong()).atZone(zone));
        }
        catch (DateTimeException e) {
            throw new LookupException("Received an invalid timestamp from weather API: " + epochSeconds.asText(), e);
        }
    }

    private static String capitalize(String s)
    {
        if (s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
