package com.tradejournal.calendar;

import com.tradejournal.domain.enums.ExpirationPattern;
import java.time.DayOfWeek;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds option expiration dates for US listings by expiration pattern.
 *
 * <p>DAILY listings expire every weekday, WEEKLY on Fridays and MONTHLY on the third
 * Friday of the month (the Friday falling on day 15 to 21). Weekends never expire.
 * Exchange holidays are not modelled; the editor lets the user override any date.
 *
 * <p>Used by the canonical leg builder to place the far leg of calendars and
 * diagonals one expiration after the near leg.
 */
@Service
public class ExpirationCalendar {

    private static final Logger log = LoggerFactory.getLogger(ExpirationCalendar.class);

    /** Longest gap between two monthly expirations, with margin. */
    static final int MAX_SCAN_DAYS = 35;

    /**
     * Returns true if options following the given pattern expire on this date.
     */
    public boolean isExpirationDay(LocalDate date, ExpirationPattern pattern) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        return switch (pattern) {
            case DAILY -> true;
            case WEEKLY -> day == DayOfWeek.FRIDAY;
            case MONTHLY -> day == DayOfWeek.FRIDAY && date.getDayOfMonth() >= 15 && date.getDayOfMonth() <= 21;
        };
    }

    /**
     * Returns the first expiration strictly after the given date.
     * Scans at most {@value #MAX_SCAN_DAYS} days forward.
     */
    public LocalDate nextExpiration(LocalDate after, ExpirationPattern pattern) {
        LocalDate next = after;
        for (int i = 0; i < MAX_SCAN_DAYS; i++) {
            next = next.plusDays(1);
            if (isExpirationDay(next, pattern)) {
                return next;
            }
        }
        log.warn("No {} expiration within {} days after {}", pattern, MAX_SCAN_DAYS, after);
        return next;
    }

    /**
     * Returns the given date if it is an expiration day, otherwise the next one.
     */
    public LocalDate currentOrNextExpiration(LocalDate reference, ExpirationPattern pattern) {
        if (isExpirationDay(reference, pattern)) {
            return reference;
        }
        return nextExpiration(reference, pattern);
    }
}
