package com.typeguesser.engine;

/**
 * The kind of input a guesser has been fed since its last reset.
 *
 * <p>A guesser commits to strings or to hard-typed values with its first
 * non-null value; mixing the two is a usage error.
 */
public enum InputRegime {
    /** Nothing but nulls or blanks seen yet. */
    UNSET,
    /** Fed text that is classified by the deciders. */
    STRING,
    /** Fed already-typed Java values. */
    HARD_TYPED
}
