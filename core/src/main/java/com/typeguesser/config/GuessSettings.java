package com.typeguesser.config;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Options that steer decisions where the right type is ambiguous.
 *
 * <p>Settings are mutable and may be changed before or between values; a
 * change only affects subsequent acceptance tests. Each guesser owns its own
 * instance.
 *
 * <p>Example usage:
 * <pre>
 *   GuessSettings settings = new GuessSettings()
 *       .withCharCanBeBoolean(true)
 *       .withCultureConfig(CultureConfig.forLocale(Locale.GERMANY));
 *   Guesser guesser = new Guesser(settings);
 * </pre>
 */
public class GuessSettings {

    private CultureConfig cultureConfig = CultureConfig.neutral();
    private boolean charCanBeBoolean = false;
    private List<String> explicitDateFormats = Collections.emptyList();
    private List<DateTimeFormatter> explicitDateFormatters = Collections.emptyList();
    private ExplicitDatePolicy explicitDatePolicy = ExplicitDatePolicy.explicitFormats();
    private int extraLengthPerNonAsciiCharacter = 0;
    private HardTypedConflictPolicy hardTypedConflictPolicy = HardTypedConflictPolicy.FAIL;

    public GuessSettings withCultureConfig(CultureConfig config) {
        this.cultureConfig = Objects.requireNonNull(config, "cultureConfig must not be null");
        return this;
    }

    /**
     * Sets whether single letters such as {@code Y}/{@code N} count as booleans.
     *
     * @param value true to accept single letters
     * @return this settings object
     */
    public GuessSettings withCharCanBeBoolean(boolean value) {
        this.charCanBeBoolean = value;
        return this;
    }

    /**
     * Sets date patterns (in {@link DateTimeFormatter} syntax) that are tried
     * before the built-in ones. Tokens matching one of them count as explicit
     * dates under the default {@link ExplicitDatePolicy}. Patterns resolve
     * smartly, so both {@code yyyy} and {@code uuuu} work.
     *
     * @param patterns the patterns, empty to clear
     * @return this settings object
     * @throws IllegalArgumentException if a pattern is invalid
     */
    public GuessSettings withExplicitDateFormats(List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        List<DateTimeFormatter> formatters = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            formatters.add(new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter()
                .withResolverStyle(ResolverStyle.SMART));
        }
        this.explicitDateFormats = List.copyOf(patterns);
        this.explicitDateFormatters = List.copyOf(formatters);
        return this;
    }

    public GuessSettings withExplicitDatePolicy(ExplicitDatePolicy policy) {
        this.explicitDatePolicy = Objects.requireNonNull(policy, "explicitDatePolicy must not be null");
        return this;
    }

    /**
     * Sets the extra width counted for every non-ASCII character, for targets
     * that size text columns in bytes.
     *
     * @param extra extra characters per non-ASCII character (0 = none)
     * @return this settings object
     */
    public GuessSettings withExtraLengthPerNonAsciiCharacter(int extra) {
        if (extra < 0) {
            throw new IllegalArgumentException("extraLengthPerNonAsciiCharacter must be non-negative");
        }
        this.extraLengthPerNonAsciiCharacter = extra;
        return this;
    }

    public GuessSettings withHardTypedConflictPolicy(HardTypedConflictPolicy policy) {
        this.hardTypedConflictPolicy = Objects.requireNonNull(policy, "hardTypedConflictPolicy must not be null");
        return this;
    }

    /**
     * Parses a token with the explicit date formats.
     *
     * @param token the stripped token
     * @return the parsed temporal, or null if no explicit format matches
     */
    public TemporalAccessor parseExplicitDate(String token) {
        for (DateTimeFormatter formatter : explicitDateFormatters) {
            try {
                return formatter.withLocale(cultureConfig.locale()).parse(token);
            } catch (DateTimeParseException e) {
                // try the next pattern
            }
        }
        return null;
    }

    /**
     * Returns an independent copy of these settings.
     *
     * @return the copy
     */
    public GuessSettings copy() {
        GuessSettings copy = new GuessSettings();
        copy.copyFrom(this);
        return copy;
    }

    /**
     * Overwrites every option with the other settings' values.
     *
     * @param other the settings to copy
     */
    public void copyFrom(GuessSettings other) {
        this.cultureConfig = other.cultureConfig;
        this.charCanBeBoolean = other.charCanBeBoolean;
        this.explicitDateFormats = other.explicitDateFormats;
        this.explicitDateFormatters = other.explicitDateFormatters;
        this.explicitDatePolicy = other.explicitDatePolicy;
        this.extraLengthPerNonAsciiCharacter = other.extraLengthPerNonAsciiCharacter;
        this.hardTypedConflictPolicy = other.hardTypedConflictPolicy;
    }

    public CultureConfig getCultureConfig() {
        return cultureConfig;
    }

    public boolean isCharCanBeBoolean() {
        return charCanBeBoolean;
    }

    public List<String> getExplicitDateFormats() {
        return explicitDateFormats;
    }

    public ExplicitDatePolicy getExplicitDatePolicy() {
        return explicitDatePolicy;
    }

    public int getExtraLengthPerNonAsciiCharacter() {
        return extraLengthPerNonAsciiCharacter;
    }

    public HardTypedConflictPolicy getHardTypedConflictPolicy() {
        return hardTypedConflictPolicy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GuessSettings)) return false;
        GuessSettings that = (GuessSettings) obj;
        return charCanBeBoolean == that.charCanBeBoolean
            && extraLengthPerNonAsciiCharacter == that.extraLengthPerNonAsciiCharacter
            && cultureConfig.equals(that.cultureConfig)
            && explicitDateFormats.equals(that.explicitDateFormats)
            && explicitDatePolicy == that.explicitDatePolicy
            && hardTypedConflictPolicy == that.hardTypedConflictPolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cultureConfig, charCanBeBoolean, explicitDateFormats,
            extraLengthPerNonAsciiCharacter, hardTypedConflictPolicy);
    }

    @Override
    public String toString() {
        return "GuessSettings{culture=" + cultureConfig
            + ", charCanBeBoolean=" + charCanBeBoolean
            + ", explicitDateFormats=" + explicitDateFormats
            + ", extraLengthPerNonAsciiCharacter=" + extraLengthPerNonAsciiCharacter
            + ", hardTypedConflictPolicy=" + hardTypedConflictPolicy + "}";
    }
}
