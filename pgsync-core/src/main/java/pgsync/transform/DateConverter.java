package pgsync.transform;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Objects;

/**
 * Converts date-like values to epoch seconds.
 *
 * <p>Accepted inputs:
 * <ul>
 *   <li>{@code null} → {@code null}</li>
 *   <li>any {@link Number} → its integral part</li>
 *   <li>{@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime}, {@link java.util.Date}
 *       (including {@code java.sql.Timestamp})</li>
 *   <li>{@link LocalDateTime}, {@link LocalDate}, {@code java.sql.Date} → interpreted in the
 *       configured zone; dates at start of day</li>
 *   <li>strings: ISO-8601 first ({@code Z} read as {@code +00:00}, {@code T} or space
 *       separator, optional offset), then {@code yyyy-MM-dd HH:mm:ss[.ffffff]},
 *       {@code yyyy-MM-ddTHH:mm:ss[.ffffff]} and {@code yyyy-MM-dd}</li>
 * </ul>
 * Anything else, including time-of-day values, raises {@link IllegalArgumentException}.
 */
public final class DateConverter {

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
        fallbackDateTime(' '),
        fallbackDateTime('T'),
        fallbackDate());

    private final ZoneId zone;

    public DateConverter(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * @return epoch seconds, or {@code null} if {@code value} is {@code null}
     * @throws IllegalArgumentException if the value cannot be interpreted as a date
     */
    public Long toEpochSeconds(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            return parse(s);
        }
        Long converted = fromTemporal(value);
        if (converted == null) {
            throw new IllegalArgumentException("Unsupported date type: "
                + value.getClass().getSimpleName() + ". Value: " + value);
        }
        return converted;
    }

    /**
     * Converts native date/time objects; returns {@code null} for anything else,
     * including strings and numbers.
     */
    Long fromTemporal(Object value) {
        if (value instanceof Instant i) {
            return i.getEpochSecond();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toEpochSecond();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toEpochSecond();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atZone(zone).toEpochSecond();
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay(zone).toEpochSecond();
        }
        if (value instanceof java.sql.Date d) {
            return d.toLocalDate().atStartOfDay(zone).toEpochSecond();
        }
        if (value instanceof java.sql.Time) {
            return null;
        }
        if (value instanceof java.util.Date d) {
            return d.toInstant().getEpochSecond();
        }
        return null;
    }

    private long parse(String raw) {
        String value = raw.trim();
        Long iso = parseIso(value.replace("Z", "+00:00"));
        if (iso != null) {
            return iso;
        }
        for (DateTimeFormatter format : FALLBACK_FORMATS) {
            try {
                TemporalAccessor parsed = format.parseBest(value, LocalDateTime::from, LocalDate::from);
                return fromTemporal(parsed);
            } catch (DateTimeException ignoredFormat) {
                // next format
            }
        }
        throw new IllegalArgumentException("Unable to parse date string: " + raw
            + ". Expected formats: ISO 8601 or standard date/datetime formats");
    }

    private Long parseIso(String value) {
        String candidate = value.length() > 10 && value.charAt(10) == ' '
            ? value.substring(0, 10) + 'T' + value.substring(11)
            : value;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(candidate,
                OffsetDateTime::from, LocalDateTime::from);
            return fromTemporal(parsed);
        } catch (DateTimeException notDateTime) {
            try {
                return fromTemporal(LocalDate.parse(candidate, DateTimeFormatter.ISO_LOCAL_DATE));
            } catch (DateTimeException notDate) {
                return null;
            }
        }
    }

    private static DateTimeFormatter fallbackDateTime(char separator) {
        return new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .appendLiteral('-')
            .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .appendLiteral(separator)
            .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, true)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter fallbackDate() {
        return new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .appendLiteral('-')
            .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, java.time.format.SignStyle.NOT_NEGATIVE)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
