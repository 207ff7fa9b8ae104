package com.drivehr.jobsync.sync.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Best-effort parsing of the date strings the upstream feed sends. Values without an offset are
 * read as UTC. Unparseable input yields null.
 */
public final class LenientDateParser {
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT),
        DateTimeFormatter.ofPattern("M/d/yyyy H:mm", Locale.ROOT)
    );
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT),
        DateTimeFormatter.ofPattern("yyyy/M/d", Locale.ROOT),
        caseInsensitive("MMMM d, yyyy"),
        caseInsensitive("MMM d, yyyy"),
        caseInsensitive("d MMMM yyyy"),
        caseInsensitive("d MMM yyyy")
    );

    private LenientDateParser() {
    }

    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        Instant parsed = attempt(() -> OffsetDateTime.parse(value).toInstant());
        if (parsed == null) {
            parsed = attempt(() -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        }
        for (int i = 0; parsed == null && i < DATE_TIME_FORMATS.size(); i++) {
            DateTimeFormatter format = DATE_TIME_FORMATS.get(i);
            parsed = attempt(() -> LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC));
        }
        for (int i = 0; parsed == null && i < DATE_FORMATS.size(); i++) {
            DateTimeFormatter format = DATE_FORMATS.get(i);
            parsed = attempt(() -> LocalDate.parse(value, format).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (parsed == null && value.length() <= 12 && value.chars().allMatch(Character::isDigit)) {
            parsed = Instant.ofEpochSecond(Long.parseLong(value));
        }
        return parsed;
    }

    private static Instant attempt(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}
