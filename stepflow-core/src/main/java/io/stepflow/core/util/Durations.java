package io.stepflow.core.util;

import io.stepflow.core.exception.ValidationException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses configuration durations into milliseconds.
///
/// Accepted forms:
/// - a number, taken as milliseconds
/// - a string with a unit suffix: `ms`, `s`, `m`, `h`, `d` (for example `"60s"`, `"100ms"`,
///   `"1.5m"`)
/// - a bare numeric string, taken as milliseconds
///
/// {@snippet :
/// long timeout = Durations.parseMillis("60s"); // 60000
/// long poll = Durations.parseMillis(250);      // 250
/// }
public final class Durations {

    private static final Pattern DURATION =
            Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h|d)?$");

    private Durations() {}

    /// Converts a duration value into milliseconds.
    ///
    /// @param value number or duration string, not null
    /// @return duration in milliseconds, never negative
    /// @throws ValidationException if the value is null, negative or malformed
    public static long parseMillis(Object value) {
        if (value == null) {
            throw new ValidationException("Duration must not be null");
        }
        if (value instanceof Number number) {
            double ms = number.doubleValue();
            if (ms < 0 || Double.isNaN(ms)) {
                throw new ValidationException("Duration must not be negative: " + value);
            }
            return Math.round(ms);
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        Matcher matcher = DURATION.matcher(text);
        if (!matcher.matches()) {
            throw new ValidationException(
                    "Invalid duration '"
                            + value
                            + "': expected a number with unit ms, s, m, h or d");
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        double multiplier =
                switch (unit) {
                    case "s" -> 1_000d;
                    case "m" -> 60_000d;
                    case "h" -> 3_600_000d;
                    case "d" -> 86_400_000d;
                    default -> 1d;
                };
        return Math.round(amount * multiplier);
    }

    /// Converts a duration value into milliseconds, falling back when the value is absent.
    ///
    /// @param value number or duration string, may be null
    /// @param defaultMillis value returned when `value` is null
    /// @return duration in milliseconds
    public static long parseMillis(Object value, long defaultMillis) {
        return value == null ? defaultMillis : parseMillis(value);
    }
}
