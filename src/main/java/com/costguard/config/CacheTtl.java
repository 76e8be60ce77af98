package com.costguard.config;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TTL limits, parsing and formatting for the query cache.
 *
 * Accepted TTL formats:
 * - Integer seconds: "3600"
 * - Duration shorthand: "1h", "30m", "1h30m", "90s"
 * - ISO-8601: "PT1H"
 */
@Slf4j
public final class CacheTtl {

    public static final int DEFAULT_TTL_SECONDS = 3600;      // 1 hour
    public static final int MIN_TTL_SECONDS = 60;            // 1 minute
    public static final int MAX_TTL_SECONDS = 604800;        // 7 days
    public static final int DEFAULT_MAX_SIZE_MB = 100;

    private static final Pattern SHORTHAND = Pattern.compile("^(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?$");

    private CacheTtl() {
    }

    /**
     * Parse a TTL string into seconds and validate the allowed range.
     *
     * @param value TTL string
     * @return TTL in seconds
     * @throws IllegalArgumentException if the format is unknown or out of range
     */
    public static int parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("invalid TTL format: empty value");
        }

        String trimmed = value.trim();
        long seconds;

        if (trimmed.chars().allMatch(Character::isDigit)) {
            seconds = Long.parseLong(trimmed);
        } else {
            seconds = parseDuration(trimmed).getSeconds();
        }

        if (!isValid(seconds)) {
            throw new IllegalArgumentException(String.format(
                    "TTL must be between %d and %d seconds: got %d", MIN_TTL_SECONDS, MAX_TTL_SECONDS, seconds));
        }

        return (int) seconds;
    }

    private static Duration parseDuration(String value) {
        String lower = value.toLowerCase(Locale.ROOT);

        if (lower.startsWith("p")) {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid TTL format: " + value, e);
            }
        }

        Matcher matcher = SHORTHAND.matcher(lower);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("invalid TTL format: " + value);
        }

        Duration duration = Duration.ZERO;
        if (matcher.group(1) != null) {
            duration = duration.plusHours(Long.parseLong(matcher.group(1)));
        }
        if (matcher.group(2) != null) {
            duration = duration.plusMinutes(Long.parseLong(matcher.group(2)));
        }
        if (matcher.group(3) != null) {
            duration = duration.plusSeconds(Long.parseLong(matcher.group(3)));
        }
        return duration;
    }

    public static boolean isValid(long seconds) {
        return seconds >= MIN_TTL_SECONDS && seconds <= MAX_TTL_SECONDS;
    }

    /**
     * Return the configured TTL, or the default when it is out of range.
     */
    public static int sanitizeTtl(int seconds) {
        if (!isValid(seconds)) {
            log.warn("Cache TTL {}s outside [{}, {}], using default {}s",
                    seconds, MIN_TTL_SECONDS, MAX_TTL_SECONDS, DEFAULT_TTL_SECONDS);
            return DEFAULT_TTL_SECONDS;
        }
        return seconds;
    }

    /**
     * Return the configured max size, or the default when negative.
     * Zero means unlimited.
     */
    public static int sanitizeMaxSize(int maxSizeMb) {
        if (maxSizeMb < 0) {
            log.warn("Cache max size {}MB is negative, using default {}MB", maxSizeMb, DEFAULT_MAX_SIZE_MB);
            return DEFAULT_MAX_SIZE_MB;
        }
        return maxSizeMb;
    }

    /**
     * Format a duration for humans: "30s", "5m", "2h", "2h30m", "3d", "3d2h".
     */
    public static String format(Duration duration) {
        long seconds = duration.getSeconds();

        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m";
        }
        if (seconds < 86400) {
            long hours = seconds / 3600;
            long minutes = (seconds % 3600) / 60;
            return minutes == 0 ? hours + "h" : hours + "h" + minutes + "m";
        }

        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        return hours == 0 ? days + "d" : days + "d" + hours + "h";
    }
}
