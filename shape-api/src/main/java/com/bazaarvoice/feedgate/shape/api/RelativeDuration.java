package com.bazaarvoice.feedgate.shape.api;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the compact duration strings callers use for time windows and limiter intervals, such as
 * "24h", "8d" or "1w2d3hr4m5s".  Each group is a non-negative integer followed by one of {@code w}, {@code d},
 * {@code hr}, {@code h}, {@code m} or {@code s}; groups may appear in any order and repeated units accumulate.
 */
public final class RelativeDuration {

    private static final Pattern WHOLE = Pattern.compile("(?:\\d+(?:w|d|hr|h|m|s))+");
    private static final Pattern GROUP = Pattern.compile("(\\d+)(w|d|hr|h|m|s)");

    private RelativeDuration() {
        // empty
    }

    /**
     * Returns the parsed duration, or empty if the string is null, empty or does not match the grammar.
     */
    public static Optional<Duration> parse(@Nullable String value) {
        if (value == null || !WHOLE.matcher(value).matches()) {
            return Optional.empty();
        }
        Duration total = Duration.ZERO;
        Matcher matcher = GROUP.matcher(value);
        try {
            while (matcher.find()) {
                long amount = Long.parseLong(matcher.group(1));
                total = total.plus(unitOf(matcher.group(2)).multipliedBy(amount));
            }
        } catch (ArithmeticException | NumberFormatException e) {
            // Too large to represent
            return Optional.empty();
        }
        return Optional.of(total);
    }

    public static boolean isValid(@Nullable String value) {
        return parse(value).isPresent();
    }

    private static Duration unitOf(String unit) {
        switch (unit) {
            case "w":
                return Duration.ofDays(7);
            case "d":
                return Duration.ofDays(1);
            case "hr":
            case "h":
                return Duration.ofHours(1);
            case "m":
                return Duration.ofMinutes(1);
            case "s":
                return Duration.ofSeconds(1);
            default:
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
    }
}
