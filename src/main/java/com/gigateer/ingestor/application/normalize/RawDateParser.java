package com.gigateer.ingestor.application.normalize;

import com.gigateer.ingestor.domain.exception.NormalizationException;
import com.gigateer.ingestor.domain.model.SourceConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date strings venue sites publish into UTC instants.
 *
 * <p>Accepted, in order: relative words ({@code tonight}, {@code today},
 * {@code tomorrow}, optionally followed by a time), ISO-8601 with offset,
 * ISO local date-time, {@code yyyy-MM-dd HH:mm[:ss]}, ISO date, then the
 * source's own patterns. Local values are placed in the source's
 * {@code timezoneDefault}; a local time that falls in a DST overlap takes
 * the earlier offset, one in a gap is shifted forward. Nothing else is
 * guessed.
 */
public class RawDateParser {

    private static final Pattern RELATIVE =
        Pattern.compile("^(tonight|today|tomorrow)(?:\\s*(?:at|@|,|-)?\\s*(.+))?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TWELVE_HOUR =
        Pattern.compile("^(\\d{1,2})(?:[:.](\\d{2}))?\\s*([ap])\\.?m\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TWENTY_FOUR_HOUR = Pattern.compile("^(\\d{1,2})[:.](\\d{2})$");
    private static final Pattern SEPT = Pattern.compile("\\bSept\\b", Pattern.CASE_INSENSITIVE);

    private static final LocalTime TONIGHT_DEFAULT = LocalTime.of(20, 0);

    private static final DateTimeFormatter SPACED_LOCAL = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .appendPattern("HH:mm[:ss]")
        .toFormatter(Locale.ROOT);

    private final Clock clock;
    private final Map<String, DateTimeFormatter> customFormatters = new ConcurrentHashMap<>();

    public RawDateParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * Compiles a source-specific pattern the way {@link #parse} will use it.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static DateTimeFormatter compilePattern(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }

    /**
     * @param field name of the field being parsed, used in the error message
     * @param raw   non-blank raw value
     * @throws NormalizationException with kind INVALID_DATE when no format matches
     */
    public Instant parse(String field, String raw, SourceConfig config) throws NormalizationException {
        String text = NormalizationUtils.collapseWhitespace(raw);
        if (text == null) {
            throw NormalizationException.invalidDate(field, raw);
        }
        ZoneId zone = config.timezoneDefault();

        Matcher relative = RELATIVE.matcher(text);
        if (relative.matches()) {
            return parseRelative(field, raw, relative, config);
        }

        List<Function<String, Instant>> builtIn = List.of(
            value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            value -> atZone(LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME), zone),
            value -> atZone(LocalDateTime.parse(value, SPACED_LOCAL), zone),
            value -> atZone(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atTime(dateOnlyTime(config)), zone)
        );
        for (Function<String, Instant> format : builtIn) {
            Instant parsed = tryParse(format, text);
            if (parsed != null) {
                return parsed;
            }
        }

        // patterns use three-letter English months; British listings also write "Sept"
        String english = SEPT.matcher(text).replaceAll("Sep");
        for (String pattern : config.dateFormats()) {
            DateTimeFormatter formatter = customFormatters.computeIfAbsent(pattern, RawDateParser::compilePattern);
            Instant parsed = tryCustom(formatter, english, config);
            if (parsed != null) {
                return parsed;
            }
        }

        throw NormalizationException.invalidDate(field, raw);
    }

    private Instant tryCustom(DateTimeFormatter formatter, String text, SourceConfig config) {
        return tryParse(value -> {
            TemporalAccessor parsed = formatter.parseBest(value,
                ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            if (parsed instanceof LocalDateTime) {
                return atZone((LocalDateTime) parsed, config.timezoneDefault());
            }
            return atZone(((LocalDate) parsed).atTime(dateOnlyTime(config)), config.timezoneDefault());
        }, text);
    }

    private static Instant tryParse(Function<String, Instant> format, String text) {
        try {
            return format.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Instant parseRelative(String field, String raw, Matcher matcher, SourceConfig config)
            throws NormalizationException {
        ZoneId zone = config.timezoneDefault();
        String word = matcher.group(1).toLowerCase(Locale.ROOT);
        LocalDate day = LocalDate.now(clock.withZone(zone));
        if ("tomorrow".equals(word)) {
            day = day.plusDays(1);
        }

        String timeText = matcher.group(2);
        LocalTime time;
        if (timeText == null) {
            if (config.defaultStartTime() != null) {
                time = config.defaultStartTime();
            } else {
                time = "tonight".equals(word) ? TONIGHT_DEFAULT : LocalTime.MIDNIGHT;
            }
        } else {
            time = parseTime(timeText.trim());
            if (time == null) {
                throw NormalizationException.invalidDate(field, raw);
            }
        }
        return atZone(day.atTime(time), zone);
    }

    /**
     * Parses "7pm", "7:30 PM", "7.30pm" or "19:30". Returns null otherwise.
     */
    static LocalTime parseTime(String text) {
        Matcher twelve = TWELVE_HOUR.matcher(text);
        if (twelve.matches()) {
            int hour = Integer.parseInt(twelve.group(1));
            int minute = twelve.group(2) != null ? Integer.parseInt(twelve.group(2)) : 0;
            if (hour < 1 || hour > 12 || minute > 59) {
                return null;
            }
            boolean pm = twelve.group(3).equalsIgnoreCase("p");
            if (pm && hour != 12) {
                hour += 12;
            } else if (!pm && hour == 12) {
                hour = 0;
            }
            return LocalTime.of(hour, minute);
        }
        Matcher twentyFour = TWENTY_FOUR_HOUR.matcher(text);
        if (twentyFour.matches()) {
            int hour = Integer.parseInt(twentyFour.group(1));
            int minute = Integer.parseInt(twentyFour.group(2));
            if (hour > 23 || minute > 59) {
                return null;
            }
            return LocalTime.of(hour, minute);
        }
        return null;
    }

    private static LocalTime dateOnlyTime(SourceConfig config) {
        return config.defaultStartTime() != null ? config.defaultStartTime() : LocalTime.MIDNIGHT;
    }

    private static Instant atZone(LocalDateTime local, ZoneId zone) {
        return ZonedDateTime.of(local, zone).toInstant();
    }
}
