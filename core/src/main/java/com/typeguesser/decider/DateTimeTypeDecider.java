package com.typeguesser.decider;

import com.typeguesser.config.CultureConfig;
import com.typeguesser.config.DateOrder;
import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recognizes calendar dates with an optional time of day.
 *
 * <p>Candidates are matched, in order, against the settings' explicit formats,
 * the ISO-8601 layouts and a generated list of culture layouts: day, month and
 * year separated by {@code /}, {@code -} or {@code .}, with numeric or named
 * months and two- or four-digit years, ordered by the culture's
 * {@link DateOrder}. Year-first layouts are always tried. A time of day may
 * follow after a space, in 24-hour or 12-hour form.
 *
 * <p>Anything the decimal or duration deciders accept is never a date, unless
 * the explicit date policy flags it as one. A string column needs
 * {@value #RENDERED_LENGTH} characters to hold any rendered date and time.
 */
public final class DateTimeTypeDecider implements TypeDecider {

    private static final DateTimeTypeDecider INSTANCE = new DateTimeTypeDecider();

    /** Width of {@code uuuu-MM-dd HH:mm:ss.fffffff}, the longest rendering kept. */
    public static final int RENDERED_LENGTH = 27;

    private static final DataSize TEXT_SIZE = DataSize.ofLength(RENDERED_LENGTH);

    private static final String[] DATE_SEPARATORS = {"/", "-", "."};
    private static final String[] MONTH_FIELDS = {"M", "MMM", "MMMM"};
    private static final String[] YEAR_FIELDS = {"uuuu", "uu"};

    private record FormatKey(Locale locale, DateOrder order) {}

    private static final Map<FormatKey, List<DateTimeFormatter>> DATE_FORMATS = new ConcurrentHashMap<>();
    private static final Map<Locale, List<DateTimeFormatter>> TIME_FORMATS = new ConcurrentHashMap<>();

    private final Set<Class<?>> scalarTypes = DeciderSupport.scalarTypes(TypeTag.DATE_TIME,
        LocalDate.class, LocalDateTime.class, OffsetDateTime.class, ZonedDateTime.class, Instant.class);

    private DateTimeTypeDecider() {}

    public static DateTimeTypeDecider get() {
        return INSTANCE;
    }

    @Override
    public TypeTag typeTag() {
        return TypeTag.DATE_TIME;
    }

    @Override
    public CompatibilityGroup compatibilityGroup() {
        return CompatibilityGroup.TEMPORAL;
    }

    @Override
    public Set<Class<?>> scalarTypes() {
        return scalarTypes;
    }

    @Override
    public DataSize sizeIfAcceptable(String candidate, GuessSettings settings) {
        return valueOf(candidate, settings) != null ? TEXT_SIZE : null;
    }

    /**
     * Parses an accepted date.
     *
     * @return a {@link LocalDateTime}, or an {@link OffsetDateTime} when the text carries an offset
     */
    @Override
    public Object parse(String candidate, GuessSettings settings) {
        Object value = valueOf(candidate, settings);
        if (value == null) {
            throw new TypeParseException(candidate, TypeTag.DATE_TIME);
        }
        return value;
    }

    @Override
    public DataSize sizeOfScalar(Object value) {
        return DataSize.ofLength(Math.max(RENDERED_LENGTH, value.toString().length()));
    }

    @Override
    public int renderedLength(int integerDigits, int fractionalDigits, int stringLength) {
        return Math.max(stringLength, RENDERED_LENGTH);
    }

    /**
     * Decides whether day-first or month-first reading fits a sample better.
     *
     * <p>The date part of each sample is read both ways; the order under which strictly more
     * samples parse wins. Ties, including a sample where every date is
     * ambiguous, keep the culture's own order.
     *
     * @param samples candidate date strings
     * @param culture the culture supplying separators, month names and the fallback order
     * @return the better fitting order
     */
    public static DateOrder guessDateOrder(Iterable<String> samples, CultureConfig culture) {
        int dayFirst = 0;
        int monthFirst = 0;
        for (String sample : samples) {
            String token = DeciderSupport.token(sample);
            if (token == null) {
                continue;
            }
            int space = token.indexOf(' ');
            if (space > 0) {
                token = token.substring(0, space);
            }
            if (parseCultureDate(token, culture.locale(), DateOrder.DAY_FIRST) != null) {
                dayFirst++;
            }
            if (parseCultureDate(token, culture.locale(), DateOrder.MONTH_FIRST) != null) {
                monthFirst++;
            }
        }
        if (dayFirst != monthFirst) {
            return dayFirst > monthFirst ? DateOrder.DAY_FIRST : DateOrder.MONTH_FIRST;
        }
        return culture.dateOrder();
    }

    private static Object valueOf(String candidate, GuessSettings settings) {
        String token = DeciderSupport.token(candidate);
        if (token == null) {
            return null;
        }
        boolean explicit = settings.getExplicitDatePolicy().isExplicitDate(token, settings);
        if (!explicit
            && (DecimalTypeDecider.get().isAcceptable(token, settings)
                || DurationTypeDecider.get().isAcceptable(token, settings))) {
            return null;
        }
        TemporalAccessor parsed = settings.parseExplicitDate(token);
        Object explicitValue = parsed == null ? null : toDateTime(parsed);
        if (explicitValue != null) {
            return explicitValue;
        }
        return parseText(token, settings.getCultureConfig());
    }

    private static Object parseText(String token, CultureConfig culture) {
        OffsetDateTime offset = TemporalText.parse(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME, token, OffsetDateTime::from);
        if (offset != null) {
            return offset;
        }
        LocalDateTime iso = TemporalText.parse(DateTimeFormatter.ISO_LOCAL_DATE_TIME, token, LocalDateTime::from);
        if (iso != null) {
            return iso;
        }

        int space = token.indexOf(' ');
        if (space < 0) {
            LocalDate date = parseCultureDate(token, culture.locale(), culture.dateOrder());
            return date == null ? null : date.atStartOfDay();
        }
        LocalDate date = parseCultureDate(token.substring(0, space), culture.locale(), culture.dateOrder());
        if (date == null) {
            return null;
        }
        LocalTime time = parseTime(token.substring(space + 1).strip(), culture.locale());
        return time == null ? null : date.atTime(time);
    }

    private static LocalDate parseCultureDate(String text, Locale locale, DateOrder order) {
        for (DateTimeFormatter formatter : dateFormats(locale, order)) {
            LocalDate date = TemporalText.parse(formatter, text, LocalDate::from);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalTime parseTime(String text, Locale locale) {
        for (DateTimeFormatter formatter : TIME_FORMATS.computeIfAbsent(locale, DateTimeTypeDecider::buildTimeFormats)) {
            LocalTime time = TemporalText.parse(formatter, text, LocalTime::from);
            if (time != null) {
                return time;
            }
        }
        return null;
    }

    private static List<DateTimeFormatter> dateFormats(Locale locale, DateOrder order) {
        return DATE_FORMATS.computeIfAbsent(new FormatKey(locale, order), DateTimeTypeDecider::buildDateFormats);
    }

    private static List<DateTimeFormatter> buildDateFormats(FormatKey key) {
        List<String> patterns = new ArrayList<>();
        for (String separator : DATE_SEPARATORS) {
            for (String month : MONTH_FIELDS) {
                for (String year : YEAR_FIELDS) {
                    patterns.add(key.order() == DateOrder.DAY_FIRST
                        ? String.join(separator, "d", month, year)
                        : String.join(separator, month, "d", year));
                }
                patterns.add(String.join(separator, "uuuu", month, "d"));
            }
        }
        List<DateTimeFormatter> formatters = new ArrayList<>(patterns.size() + 1);
        for (String pattern : patterns) {
            formatters.add(strict(pattern, key.locale()));
        }
        // compact yyyyMMdd last, reachable only for tokens the numeric deciders gave up
        formatters.add(DateTimeFormatter.BASIC_ISO_DATE.withResolverStyle(ResolverStyle.STRICT));
        return List.copyOf(formatters);
    }

    private static List<DateTimeFormatter> buildTimeFormats(Locale locale) {
        DateTimeFormatter twentyFourHour = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("H:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter(locale)
            .withResolverStyle(ResolverStyle.STRICT);
        return List.of(twentyFourHour, strict("h:mm[:ss] a", locale));
    }

    private static DateTimeFormatter strict(String pattern, Locale locale) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(locale)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static Object toDateTime(TemporalAccessor parsed) {
        LocalDate date = parsed.query(TemporalQueries.localDate());
        if (date == null) {
            return null;
        }
        LocalTime time = parsed.query(TemporalQueries.localTime());
        LocalDateTime local = date.atTime(time == null ? LocalTime.MIDNIGHT : time);
        ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS)
            ? ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS))
            : null;
        return offset == null ? local : local.atOffset(offset);
    }
}
