package io.lighting.renamer.format;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DateFormatter {
    private static final Logger LOGGER = LoggerFactory.getLogger(DateFormatter.class);
    public static final String DATE_PATTERN = "yyyy-MM-dd";
    public static final String DATE_TIME_PATTERN = "yyyy-MM-dd HH:mm:ss";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern(DATE_PATTERN, Locale.ROOT);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern(DATE_TIME_PATTERN, Locale.ROOT);

    private DateFormatter() {
    }

    public static String formatDate(LocalDate date, String spec) {
        return format(date, spec, DATE);
    }

    public static String formatDateTime(LocalDateTime dateTime, String spec) {
        return format(dateTime, spec, DATE_TIME);
    }

    // a time pattern applied to a LocalDate fails at format time, not at parse time
    private static String format(TemporalAccessor value, String spec, DateTimeFormatter fallback) {
        if (spec == null || spec.isBlank()) {
            return fallback.format(value);
        }
        try {
            return DateTimeFormatter.ofPattern(spec, Locale.ROOT).format(value);
        } catch (IllegalArgumentException | DateTimeException ex) {
            LOGGER.debug("Invalid date pattern '{}', using default", spec, ex);
            return fallback.format(value);
        }
    }
}
