package io.lighting.renamer.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class DateFormatterTest {
    private static final LocalDate DATE = LocalDate.of(2024, 3, 9);
    private static final LocalDateTime DATE_TIME = LocalDateTime.of(2024, 3, 9, 7, 5, 3);

    @Test
    void usesDefaultPatternsWhenSpecIsEmpty() {
        assertEquals("2024-03-09", DateFormatter.formatDate(DATE, ""));
        assertEquals("2024-03-09 07:05:03", DateFormatter.formatDateTime(DATE_TIME, null));
    }

    @Test
    void appliesCustomPatterns() {
        assertEquals("20240309", DateFormatter.formatDate(DATE, "yyyyMMdd"));
        assertEquals("2024年03月09日", DateFormatter.formatDate(DATE, "yyyy年MM月dd日"));
        assertEquals("070503", DateFormatter.formatDateTime(DATE_TIME, "HHmmss"));
    }

    @Test
    void fallsBackOnInvalidOrInapplicablePatterns() {
        assertEquals("2024-03-09", DateFormatter.formatDate(DATE, "HH:mm"));
        assertEquals("2024-03-09 07:05:03", DateFormatter.formatDateTime(DATE_TIME, "{bad"));
    }
}
