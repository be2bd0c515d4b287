package com.questrail.meshgate.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts propagation indicators from a NOAA SWPC summary document and
 * renders them as chat lines.
 *
 * <p>The document is an array of forecast entries. The entry with the latest
 * {@code issue_datetime} is used. Field names vary between products, so each
 * indicator is looked up under its known aliases; list-valued fields use the
 * most recent Kp value and the first day of each forecast.</p>
 */
public final class SwpcSummaryParser
{
    private static final Logger log = LoggerFactory.getLogger(SwpcSummaryParser.class);

    private static final DateTimeFormatter ISSUE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    static final String NOT_AVAILABLE = "N/A";

    /** Indicators from one summary entry. */
    public record HfSummary(
            String issueTime,
            String kpIndex,
            String solarFlux,
            String radioBlackout,
            String geomagneticStorm,
            String solarRadiationStorm
    ) {
    }

    private SwpcSummaryParser() {}

    public static Optional<HfSummary> parse(JsonNode data)
    {
        if (data == null || !data.isArray() || data.isEmpty()) {
            log.warn("SWPC summary data is not a non-empty list.");
            return Optional.empty();
        }

        JsonNode latest = null;
        Instant latestIssued = null;
        for (JsonNode entry : data) {
            if (!entry.isObject() || !entry.path("issue_datetime").isTextual()) {
                continue;
            }
            Optional<Instant> issued = parseIssueTime(entry.path("issue_datetime").asText());
            if (issued.isEmpty()) {
                log.warn("Could not parse timestamp: {}", entry.path("issue_datetime").asText());
                continue;
            }
            if (latestIssued == null || issued.get().isAfter(latestIssued)) {
                latestIssued = issued.get();
                latest = entry;
            }
        }
        if (latest == null) {
            log.warn("Could not find a valid summary entry with an issue_datetime.");
            return Optional.empty();
        }

        return Optional.of(new HfSummary(
                ISSUE_FORMAT.format(latestIssued),
                pick(latest, true, "kp_index", "kp"),
                pick(latest, false, "10cm_flux", "f107"),
                pick(latest, false, "r_scale_forecast", "radio_blackout"),
                pick(latest, false, "g_scale_forecast", "geomagnetic_storm"),
                pick(latest, false, "s_scale_forecast", "solar_radiation_storm")));
    }

    public static List<String> format(HfSummary summary)
    {
        List<String> lines = new ArrayList<>();
        lines.add("--- HF Conditions (Source: NOAA SWPC @ " + summary.issueTime() + ") ---");
        lines.add("Solar Flux (10.7cm): " + summary.solarFlux());
        lines.add("Planetary K-Index (Kp): " + summary.kpIndex());
        lines.add(geomagneticActivity(summary.kpIndex()));
        lines.add("--- Forecasts (Next ~24hrs) ---");
        if (!NOT_AVAILABLE.equals(summary.radioBlackout())) {
            lines.add("Radio Blackout (R): " + summary.radioBlackout());
        }
        if (!NOT_AVAILABLE.equals(summary.geomagneticStorm())) {
            lines.add("Geomagnetic Storm (G): " + summary.geomagneticStorm());
        }
        if (!NOT_AVAILABLE.equals(summary.solarRadiationStorm())) {
            lines.add("Solar Radiation Storm (S): " + summary.solarRadiationStorm());
        }
        lines.add("--- End of HF Conditions ---");
        return lines;
    }

    static String describeKp(int kp)
    {
        if (kp <= 1) {
            return "Inactive";
        }
        switch (kp) {
            case 2:
                return "Quiet";
            case 3:
                return "Unsettled";
            case 4:
                return "Active";
            case 5:
                return "Minor Storm";
            case 6:
                return "Major Storm";
            default:
                return "Severe/Extreme Storm";
        }
    }

    private static String geomagneticActivity(String kpText)
    {
        try {
            int kp = (int) Double.parseDouble(kpText);
            return "Geomagnetic Activity: " + describeKp(kp) + " (Kp=" + kp + ")";
        }
        catch (NumberFormatException e) {
            return "Geomagnetic Activity: N/A (Kp=" + kpText + ")";
        }
    }

    private static String pick(JsonNode entry, boolean lastOfList, String... aliases)
    {
        for (String alias : aliases) {
            JsonNode value = entry.get(alias);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isArray()) {
                if (value.isEmpty()) {
                    continue;
                }
                value = lastOfList ? value.get(value.size() - 1) : value.get(0);
            }
            return value.isValueNode() ? value.asText() : value.toString();
        }
        return NOT_AVAILABLE;
    }

    private static Optional<Instant> parseIssueTime(String text)
    {
        String iso = text.trim().replace(' ', 'T');
        try {
            return Optional.of(OffsetDateTime.parse(iso, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        }
        catch (DateTimeParseException withoutOffset) {
            try {
                return Optional.of(LocalDateTime.parse(iso, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC));
            }
            catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }
}
