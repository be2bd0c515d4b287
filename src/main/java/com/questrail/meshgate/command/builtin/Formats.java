package com.questrail.meshgate.command.builtin;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

final class Formats
{
    static final String NOT_AVAILABLE = "N/A";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter TIMESTAMP_ZONE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ROOT);

    private Formats() {}

    static String timestamp(Instant instant, ZoneId zone)
    {
        return TIMESTAMP.format(instant.atZone(zone));
    }

    static String timestampWithZone(Instant instant, ZoneId zone)
    {
        return TIMESTAMP_ZONE.format(instant.atZone(zone));
    }

    /** {@code H:MM:SS}, or {@code Nd H:MM:SS} once a day has passed. */
    static String uptime(Duration uptime)
    {
        long seconds = Math.max(0, uptime.getSeconds());
        long days = seconds / 86_400;
        long rest = seconds % 86_400;
        String clock = String.format(Locale.ROOT, "%d:%02d:%02d", rest / 3600, (rest % 3600) / 60, rest % 60);
        return days > 0 ? days + "d " + clock : clock;
    }

    static String oneDecimal(Double value)
    {
        return value == null ? NOT_AVAILABLE : String.format(Locale.ROOT, "%.1f", value);
    }

    static String orNotAvailable(Object value)
    {
        return value == null ? NOT_AVAILABLE : value.toString();
    }

    static String usage(String help)
    {
        return "Usage: " + help;
    }
}
