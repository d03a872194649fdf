package com.cryptofolio.backend.portfolio;

/**
 * How a weekly rebalancing schedule picks its boundaries.
 */
public enum WeeklyBoundary {
    /** First timestamp that falls in a new ISO-8601 week. */
    ISO_WEEK,
    /** Every seventh calendar day counted from the first timestamp. */
    FIXED_STRIDE
}
