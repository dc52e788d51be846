package com.tradegate.calendar;

import com.tradegate.exception.ConfigurationException;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A recurring local-time interval tied to an IANA timezone, e.g. "London 08:00-16:00
 * Europe/London".
 *
 * <p>Start is inclusive, end is exclusive, and both fall on the same local calendar day.
 * A window that wraps past midnight (22:00-02:00) is rejected; configure it as two windows
 * (22:00-23:59:59.999 and 00:00-02:00) instead.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeWindow {

    String name;
    LocalTime start;
    LocalTime end;
    ZoneId zone;

    /**
     * Creates a validated window.
     *
     * @throws ConfigurationException if any part is missing or start is not before end
     */
    public static TimeWindow of(String name, LocalTime start, LocalTime end, ZoneId zone) {
        if (start == null || end == null || zone == null) {
            throw new ConfigurationException("Session window '" + name + "' needs a start, an end and a timezone");
        }
        if (!start.isBefore(end)) {
            throw new ConfigurationException(
                    "Session window '" + name + "' must start before it ends on the same day (" + start + "-" + end
                            + "); split overnight windows into two",
                    Map.of("window", String.valueOf(name), "start", start.toString(), "end", end.toString()));
        }
        String label = name == null || name.isBlank() ? start + "-" + end + " " + zone.getId() : name;
        return new TimeWindow(label, start, end, zone);
    }

    /**
     * Parses a window from its configuration strings ("08:00", "16:00", "Europe/London").
     *
     * @throws ConfigurationException on a malformed time or an unknown timezone identifier
     */
    public static TimeWindow parse(String name, String start, String end, String timezone) {
        LocalTime startTime = parseTime(name, "start", start);
        LocalTime endTime = parseTime(name, "end", end);
        ZoneId zone;
        try {
            zone = ZoneId.of(Objects.requireNonNull(timezone, "timezone").trim());
        } catch (NullPointerException | DateTimeException e) {
            throw new ConfigurationException("Session window '" + name + "' has an unknown timezone: " + timezone, e);
        }
        return of(name, startTime, endTime, zone);
    }

    private static LocalTime parseTime(String name, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Session window '" + name + "' is missing its " + field + " time");
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(
                    "Session window '" + name + "' has a malformed " + field + " time: " + value, e);
        }
    }

    @Override
    public String toString() {
        return name + " " + start + "-" + end + " " + zone.getId();
    }
}
