package com.typeguesser.engine;

import com.typeguesser.types.DatabaseTypeRequest;

/**
 * Snapshot of a guesser's findings.
 *
 * @param request the guessed type and size
 * @param requiresUnicode true if any value held a non-ASCII character
 * @param valueCount non-null, non-blank values absorbed
 * @param nullCount null values seen
 */
public record GuessResult(DatabaseTypeRequest request, boolean requiresUnicode, long valueCount, long nullCount) {
}
