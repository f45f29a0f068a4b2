package com.tradejournal.domain.enums;

/**
 * Listing cadence of an underlying's option expirations.
 *
 * <p>Drives where the far leg of a calendar or diagonal lands when the editor
 * does not pick one explicitly.
 */
public enum ExpirationPattern {
    /** Every weekday (SPX, SPY style 0DTE listings). */
    DAILY,

    /** Fridays only. */
    WEEKLY,

    /** Third Friday of the month. */
    MONTHLY
}
