package com.typeguesser.config;

import java.text.DecimalFormatSymbols;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.FormatStyle;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Culture-dependent rules used by the deciders: number separators, the order
 * of day and month in dates, and the words recognized as booleans.
 *
 * <p>Instances are immutable and safe to share between guessers. They are
 * passed explicitly to every decider call; no process-wide locale is consulted.
 *
 * <p>Example usage:
 * <pre>
 *   CultureConfig german = CultureConfig.forLocale(Locale.GERMANY);
 *   CultureConfig custom = CultureConfig.neutral().withDateOrder(DateOrder.DAY_FIRST);
 * </pre>
 */
public final class CultureConfig {

    private static final Set<String> DEFAULT_TRUE_WORDS = Set.of("true", "yes", "ja", ".t.");
    private static final Set<String> DEFAULT_FALSE_WORDS = Set.of("false", "no", "nein", ".f.");
    private static final String DEFAULT_TRUE_CHARS = "TYJ";
    private static final String DEFAULT_FALSE_CHARS = "FN";

    private static final CultureConfig NEUTRAL = new CultureConfig(
        Locale.ENGLISH, '.', ',', DateOrder.MONTH_FIRST,
        DEFAULT_TRUE_WORDS, DEFAULT_FALSE_WORDS, DEFAULT_TRUE_CHARS, DEFAULT_FALSE_CHARS);

    private final Locale locale;
    private final char decimalSeparator;
    private final char groupingSeparator;
    private final DateOrder dateOrder;
    private final Set<String> trueWords;
    private final Set<String> falseWords;
    private final String trueChars;
    private final String falseChars;

    private CultureConfig(Locale locale, char decimalSeparator, char groupingSeparator, DateOrder dateOrder,
                          Set<String> trueWords, Set<String> falseWords, String trueChars, String falseChars) {
        this.locale = Objects.requireNonNull(locale, "locale must not be null");
        if (decimalSeparator == groupingSeparator) {
            throw new IllegalArgumentException(
                "decimal and grouping separators must differ, both were '" + decimalSeparator + "'");
        }
        this.decimalSeparator = decimalSeparator;
        this.groupingSeparator = groupingSeparator;
        this.dateOrder = Objects.requireNonNull(dateOrder, "dateOrder must not be null");
        this.trueWords = normalize(trueWords);
        this.falseWords = normalize(falseWords);
        this.trueChars = trueChars.toUpperCase(Locale.ROOT);
        this.falseChars = falseChars.toUpperCase(Locale.ROOT);
    }

    /**
     * The locale-neutral default: {@code .} decimal separator, {@code ,}
     * grouping, month-first dates, English month names and English/German
     * boolean words.
     *
     * @return the neutral configuration
     */
    public static CultureConfig neutral() {
        return NEUTRAL;
    }

    /**
     * Derives separators from the locale's number symbols and the date order
     * from the locale's short date pattern.
     *
     * @param locale the locale to follow
     * @return a configuration for the locale
     */
    public static CultureConfig forLocale(Locale locale) {
        Objects.requireNonNull(locale, "locale must not be null");
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(locale);
        return new CultureConfig(locale, symbols.getDecimalSeparator(), symbols.getGroupingSeparator(),
            dateOrderOf(locale), NEUTRAL.trueWords, NEUTRAL.falseWords, NEUTRAL.trueChars, NEUTRAL.falseChars);
    }

    private static DateOrder dateOrderOf(Locale locale) {
        String pattern = DateTimeFormatterBuilder.getLocalizedDateTimePattern(
            FormatStyle.SHORT, null, IsoChronology.INSTANCE, locale);
        return pattern.indexOf('M') > pattern.indexOf('d') ? DateOrder.DAY_FIRST : DateOrder.MONTH_FIRST;
    }

    private static Set<String> normalize(Set<String> words) {
        Set<String> result = new LinkedHashSet<>();
        for (String word : words) {
            result.add(word.strip().toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(result);
    }

    public CultureConfig withDateOrder(DateOrder order) {
        return new CultureConfig(locale, decimalSeparator, groupingSeparator, order,
            trueWords, falseWords, trueChars, falseChars);
    }

    public CultureConfig withSeparators(char decimal, char grouping) {
        return new CultureConfig(locale, decimal, grouping, dateOrder,
            trueWords, falseWords, trueChars, falseChars);
    }

    /**
     * Replaces the words recognized as booleans (matched case-insensitively).
     *
     * @param trueWords words meaning true
     * @param falseWords words meaning false
     * @return a copy with the new word sets
     */
    public CultureConfig withBooleanWords(Set<String> trueWords, Set<String> falseWords) {
        return new CultureConfig(locale, decimalSeparator, groupingSeparator, dateOrder,
            trueWords, falseWords, trueChars, falseChars);
    }

    /**
     * Replaces the single letters recognized as booleans when
     * {@link GuessSettings#isCharCanBeBoolean()} is set.
     *
     * @param trueChars letters meaning true, e.g. {@code "TY"}
     * @param falseChars letters meaning false, e.g. {@code "FN"}
     * @return a copy with the new letters
     */
    public CultureConfig withBooleanChars(String trueChars, String falseChars) {
        return new CultureConfig(locale, decimalSeparator, groupingSeparator, dateOrder,
            trueWords, falseWords, trueChars, falseChars);
    }

    /**
     * Interprets a whitespace-stripped token as a boolean.
     *
     * @param token the token
     * @param allowChars whether single letters count
     * @return the boolean value, or null if the token is not a boolean
     */
    public Boolean booleanValue(String token, boolean allowChars) {
        if (token.length() == 1) {
            if (!allowChars) {
                return null;
            }
            char c = Character.toUpperCase(token.charAt(0));
            if (trueChars.indexOf(c) >= 0) {
                return Boolean.TRUE;
            }
            if (falseChars.indexOf(c) >= 0) {
                return Boolean.FALSE;
            }
            return null;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        if (trueWords.contains(lower)) {
            return Boolean.TRUE;
        }
        if (falseWords.contains(lower)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public Locale locale() {
        return locale;
    }

    public char decimalSeparator() {
        return decimalSeparator;
    }

    public char groupingSeparator() {
        return groupingSeparator;
    }

    public DateOrder dateOrder() {
        return dateOrder;
    }

    public Set<String> trueWords() {
        return trueWords;
    }

    public Set<String> falseWords() {
        return falseWords;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CultureConfig)) return false;
        CultureConfig that = (CultureConfig) obj;
        return decimalSeparator == that.decimalSeparator
            && groupingSeparator == that.groupingSeparator
            && locale.equals(that.locale)
            && dateOrder == that.dateOrder
            && trueWords.equals(that.trueWords)
            && falseWords.equals(that.falseWords)
            && trueChars.equals(that.trueChars)
            && falseChars.equals(that.falseChars);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locale, decimalSeparator, groupingSeparator, dateOrder, trueWords, falseWords,
            trueChars, falseChars);
    }

    @Override
    public String toString() {
        return "CultureConfig{locale=" + locale.toLanguageTag()
            + ", decimal='" + decimalSeparator + "', grouping='" + groupingSeparator
            + "', dateOrder=" + dateOrder + "}";
    }
}
