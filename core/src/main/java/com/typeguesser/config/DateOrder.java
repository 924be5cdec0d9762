package com.typeguesser.config;

/**
 * Relative order of day and month in numeric dates such as {@code 03/04/2001}.
 *
 * <p>Year-first dates ({@code 2001-04-03}) are recognized under either order.
 */
public enum DateOrder {
    /** {@code dd/MM/yyyy}, used by most European locales. */
    DAY_FIRST,
    /** {@code MM/dd/yyyy}, used by the neutral configuration and US locales. */
    MONTH_FIRST
}
