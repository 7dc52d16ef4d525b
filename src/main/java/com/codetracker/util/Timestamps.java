package com.codetracker.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Text form of timestamps in the database and in export files.
 * Second precision keeps lexicographic order equal to chronological order.
 */
public final class Timestamps {

    private static final DateTimeFormatter STORAGE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private Timestamps() {
    }

    public static String format(LocalDateTime value) {
        Objects.requireNonNull(value, "value");
        return STORAGE_FORMAT.format(value.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Accepts any ISO-8601 local date-time, fractions included.
     *
     * @throws java.time.format.DateTimeParseException if the text is not ISO-8601
     */
    public static LocalDateTime parse(String text) {
        Objects.requireNonNull(text, "text");
        return LocalDateTime.parse(text.trim(), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
