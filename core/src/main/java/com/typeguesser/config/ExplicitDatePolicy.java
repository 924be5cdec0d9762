package com.typeguesser.config;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Objects;

/**
 * Decides whether a token is unambiguously a date even though it also looks
 * like a number, e.g. {@code 20010131}.
 *
 * <p>Numeric deciders reject tokens this policy flags so that the date/time
 * decider can claim them. Policies are stateless and shared.
 */
@FunctionalInterface
public interface ExplicitDatePolicy {

    ExplicitDatePolicy NONE = (token, settings) -> false;

    ExplicitDatePolicy EXPLICIT_FORMATS = (token, settings) -> settings.parseExplicitDate(token) != null;

    /**
     * Returns whether the whitespace-stripped token must be treated as a date.
     *
     * @param token the candidate, already stripped
     * @param settings the active settings
     * @return true if the token is an explicit date
     */
    boolean isExplicitDate(String token, GuessSettings settings);

    /**
     * Combines two policies; a token is explicit if either says so.
     *
     * @param other the other policy
     * @return the combined policy
     */
    default ExplicitDatePolicy or(ExplicitDatePolicy other) {
        Objects.requireNonNull(other, "other must not be null");
        return (token, settings) -> isExplicitDate(token, settings) || other.isExplicitDate(token, settings);
    }

    /**
     * Never flags anything; numbers always stay numbers.
     */
    static ExplicitDatePolicy none() {
        return NONE;
    }

    /**
     * Flags tokens matching one of {@link GuessSettings#getExplicitDateFormats()}.
     * This is the default policy.
     */
    static ExplicitDatePolicy explicitFormats() {
        return EXPLICIT_FORMATS;
    }

    /**
     * Flags 8-digit {@code yyyyMMdd} tokens that name a real calendar date.
     */
    static ExplicitDatePolicy compactIsoDates() {
        return CompactIsoDates.INSTANCE;
    }

    /**
     * Holder for the compact date check.
     */
    final class CompactIsoDates implements ExplicitDatePolicy {

        static final CompactIsoDates INSTANCE = new CompactIsoDates();

        private static final DateTimeFormatter COMPACT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

        private CompactIsoDates() {}

        @Override
        public boolean isExplicitDate(String token, GuessSettings settings) {
            if (token.length() != 8) {
                return false;
            }
            for (int i = 0; i < 8; i++) {
                char c = token.charAt(i);
                if (c < '0' || c > '9') {
                    return false;
                }
            }
            try {
                COMPACT.parse(token);
                return true;
            } catch (DateTimeParseException e) {
                // digits but not a calendar date, e.g. 20011332
                return false;
            }
        }
    }
}
