package com.dps.scheduler.booking.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses the scheduler API's date strings. Values usually come without an offset
 * ({@code 2024-05-01T08:00:00}) and are then taken as local time in the configured zone.
 */
public final class ApiDateTimes {
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("T.*(Z|[+-]\\d{2}:?\\d{2})$");
    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy hh:mm a", Locale.US);

    private ApiDateTimes() {
    }

    public static LocalDateTime toLocalDateTime(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (OFFSET_SUFFIX.matcher(trimmed).find()) {
                String isoOffset = COMPACT_OFFSET.matcher(trimmed).replaceFirst("$1:$2");
                return OffsetDateTime.parse(isoOffset).atZoneSameInstant(zone).toLocalDateTime();
            }
            if (trimmed.indexOf('T') > 0) {
                return LocalDateTime.parse(trimmed);
            }
            return LocalDate.parse(trimmed).atStartOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static LocalDate toLocalDate(String value, ZoneId zone) {
        LocalDateTime dateTime = toLocalDateTime(value, zone);
        return dateTime == null ? null : dateTime.toLocalDate();
    }

    public static String display(String value, ZoneId zone) {
        LocalDateTime dateTime = toLocalDateTime(value, zone);
        return dateTime == null ? String.valueOf(value) : DISPLAY_FORMAT.format(dateTime);
    }
}
