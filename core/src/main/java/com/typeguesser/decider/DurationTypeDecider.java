package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes times of day and elapsed durations.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>clock text {@code [-][d.]H:mm[:ss[.fffffffff]]} with hours below 24</li>
 *   <li>twelve-hour text {@code h:mm[:ss] AM}, in the culture's language</li>
 *   <li>ISO-8601 durations such as {@code PT1H30M}</li>
 * </ul>
 */
public final class DurationTypeDecider implements TypeDecider {

    private static final DurationTypeDecider INSTANCE = new DurationTypeDecider();

    private static final Pattern CLOCK = Pattern.compile(
        "^(-)?(?:(\\d+)\\.)?(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,9}))?)?$");

    private static final Map<Locale, DateTimeFormatter> TWELVE_HOUR = new ConcurrentHashMap<>();

    private final Set<Class<?>> scalarTypes =
        DeciderSupport.scalarTypes(TypeTag.DURATION, Duration.class, LocalTime.class);

    private DurationTypeDecider() {}

    public static DurationTypeDecider get() {
        return INSTANCE;
    }

    @Override
    public TypeTag typeTag() {
        return TypeTag.DURATION;
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
        return valueOf(candidate, settings) != null ? DataSize.EMPTY : null;
    }

    @Override
    public Object parse(String candidate, GuessSettings settings) {
        Duration value = valueOf(candidate, settings);
        if (value == null) {
            throw new TypeParseException(candidate, TypeTag.DURATION);
        }
        return value;
    }

    @Override
    public DataSize sizeOfScalar(Object value) {
        return DataSize.ofLength(value.toString().length());
    }

    private static Duration valueOf(String candidate, GuessSettings settings) {
        String token = DeciderSupport.token(candidate);
        if (token == null) {
            return null;
        }
        Duration clock = parseClock(token);
        if (clock != null) {
            return clock;
        }
        char first = token.charAt(0);
        if (first == 'P' || first == 'p' || first == '-' || first == '+') {
            return parseIso(token);
        }
        return parseTwelveHour(token, settings.getCultureConfig().locale());
    }

    private static Duration parseClock(String token) {
        Matcher m = CLOCK.matcher(token);
        if (!m.matches()) {
            return null;
        }
        long hours = Long.parseLong(m.group(3));
        long minutes = Long.parseLong(m.group(4));
        long seconds = m.group(5) == null ? 0 : Long.parseLong(m.group(5));
        if (hours >= 24 || minutes >= 60 || seconds >= 60) {
            return null;
        }
        String days = m.group(2);
        if (days != null && days.length() > 9) {
            return null;
        }
        Duration result = Duration.ofDays(days == null ? 0 : Long.parseLong(days))
            .plusHours(hours)
            .plusMinutes(minutes)
            .plusSeconds(seconds);
        String fraction = m.group(6);
        if (fraction != null) {
            long nanos = Long.parseLong(fraction);
            for (int i = fraction.length(); i < 9; i++) {
                nanos *= 10;
            }
            result = result.plusNanos(nanos);
        }
        return m.group(1) != null ? result.negated() : result;
    }

    private static Duration parseIso(String token) {
        try {
            return Duration.parse(token.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Duration parseTwelveHour(String token, Locale locale) {
        DateTimeFormatter formatter = TWELVE_HOUR.computeIfAbsent(locale, DurationTypeDecider::twelveHourFormatter);
        LocalTime time = TemporalText.parse(formatter, token, LocalTime::from);
        return time == null ? null : Duration.ofNanos(time.toNanoOfDay());
    }

    private static DateTimeFormatter twelveHourFormatter(Locale locale) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("h:mm[:ss] a")
            .toFormatter(locale)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
