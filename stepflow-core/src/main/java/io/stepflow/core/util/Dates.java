package io.stepflow.core.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/// Date coercion and token formatting shared by template filters and the date operations.
///
/// All calendar arithmetic and formatting happens in UTC.
public final class Dates {

    private static final Logger logger = Logger.getLogger(Dates.class.getName());

    private static final List<Function<String, Instant>> PARSERS =
            List.of(
                    Instant::parse,
                    text -> OffsetDateTime.parse(text).toInstant(),
                    text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
                    text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

    private Dates() {}

    /// Coerces a value to an instant.
    ///
    /// Numbers (and numeric strings) are epoch milliseconds. Strings may be ISO-8601 instants,
    /// offset date-times, local date-times (taken as UTC) or plain dates (UTC midnight).
    ///
    /// @param value value to convert, may be null
    /// @return the instant, or null when the value cannot be read as a date
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof TemporalAccessor temporal) {
            return fromTemporal(temporal);
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.matches("-?\\d+")) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                logger.finest("Date parser rejected '" + text + "': " + e.getMessage());
            }
        }
        return null;
    }

    /// Formats an instant with `YYYY`, `MM`, `DD`, `HH`, `mm` and `ss` tokens.
    ///
    /// @param instant instant to format, not null
    /// @param pattern token pattern, not null
    /// @return formatted text in UTC
    public static String formatTokens(Instant instant, String pattern) {
        ZonedDateTime date = instant.atZone(ZoneOffset.UTC);
        return pattern.replace("YYYY", String.format("%04d", date.getYear()))
                .replace("MM", pad(date.getMonthValue()))
                .replace("DD", pad(date.getDayOfMonth()))
                .replace("HH", pad(date.getHour()))
                .replace("mm", pad(date.getMinute()))
                .replace("ss", pad(date.getSecond()));
    }

    private static String pad(int value) {
        return value < 10 ? "0" + value : Integer.toString(value);
    }

    private static Instant fromTemporal(TemporalAccessor temporal) {
        if (temporal instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (temporal instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (temporal instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (temporal instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return null;
    }
}
