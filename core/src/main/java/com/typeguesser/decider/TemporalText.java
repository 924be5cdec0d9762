package com.typeguesser.decider;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalQuery;

/**
 * Non-throwing parse helper for the temporal deciders.
 */
final class TemporalText {

    private TemporalText() {}

    /**
     * Parses the whole text with the formatter.
     *
     * <p>An unresolved pre-parse rejects non-matching text without building an
     * exception; only text that matches the layout but names an impossible
     * date pays for one.
     *
     * @return the parsed value, or null if the text does not fit
     */
    static <T> T parse(DateTimeFormatter formatter, String text, TemporalQuery<T> query) {
        ParsePosition position = new ParsePosition(0);
        if (formatter.parseUnresolved(text, position) == null
            || position.getErrorIndex() >= 0
            || position.getIndex() != text.length()) {
            return null;
        }
        try {
            return formatter.parse(text, query);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
