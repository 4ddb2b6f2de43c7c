package com.bcnjobs.tracker.scrape.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date normalization for source payloads. Every parser returns null instead of guessing.
 */
public final class PostingDates {
    private static final List<DateTimeFormatter> ENGLISH_FORMATS = List.of(
        englishFormat("MMMM d, yyyy"),
        englishFormat("MMM d, yyyy"),
        englishFormat("d MMM yyyy"),
        englishFormat("d MMMM yyyy"),
        DateTimeFormatter.ISO_LOCAL_DATE
    );
    private static final Pattern DAYS_AGO = Pattern.compile("(\\d+)\\s+days?\\s+ago", Pattern.CASE_INSENSITIVE);

    private PostingDates() {
    }

    public static LocalDate parseIsoDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        if (candidate.length() >= 10) {
            candidate = candidate.substring(0, 10);
        }
        try {
            return LocalDate.parse(candidate);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    public static LocalDate fromEpochMillis(long epochMillis) {
        if (epochMillis <= 0) {
            return null;
        }
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * Parses human-readable English dates such as "January 13, 2026" or "13 Jan 2026".
     */
    public static LocalDate parseEnglishDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim().replaceAll("\\s+", " ");
        for (DateTimeFormatter format : ENGLISH_FORMATS) {
            try {
                return LocalDate.parse(candidate, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    /**
     * Parses Workday-style relative labels ("Posted Today", "Posted 3 Days Ago").
     * Open-ended labels such as "30+ Days Ago" carry no reliable date.
     */
    public static LocalDate parseRelative(String value, LocalDate today) {
        if (value == null || value.isBlank() || today == null) {
            return null;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("+")) {
            return null;
        }
        if (lower.contains("today")) {
            return today;
        }
        if (lower.contains("yesterday")) {
            return today.minusDays(1);
        }
        Matcher matcher = DAYS_AGO.matcher(lower);
        if (matcher.find()) {
            try {
                return today.minusDays(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException | DateTimeException ignored) {
                return null;
            }
        }
        return null;
    }

    private static DateTimeFormatter englishFormat(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}
