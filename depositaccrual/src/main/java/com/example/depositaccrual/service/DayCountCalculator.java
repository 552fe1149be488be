package com.example.depositaccrual.service;

import com.example.depositaccrual.entity.DayCountConvention;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Counts the days of a date range under a day-count convention.
 *
 * Both conventions count inclusively at both ends, so a range starting and ending on the
 * same date is one day. Callers wanting zero days must not ask for such a range.
 * A range ending before it starts yields zero or fewer days under ACTUAL_ACTUAL.
 */
@Component
public class DayCountCalculator {

    private static final int DAYS_PER_MONTH_30_360 = 30;
    private static final int DAYS_PER_YEAR_30_360 = 360;

    /**
     * Count the days from start to end
     *
     * @param start First day of the range
     * @param end Last day of the range
     * @param convention The day-count convention
     * @return Number of days, inclusive of both ends
     */
    public int days(LocalDate start, LocalDate end, DayCountConvention convention) {
        if (convention == DayCountConvention.THIRTY_360) {
            return thirty360Days(start, end);
        }
        return actualDays(start, end);
    }

    /**
     * Calendar days from start to end, both inclusive
     */
    public int actualDays(LocalDate start, LocalDate end) {
        return Math.toIntExact(ChronoUnit.DAYS.between(start, end) + 1);
    }

    private int thirty360Days(LocalDate start, LocalDate end) {
        int startDay = Math.min(start.getDayOfMonth(), DAYS_PER_MONTH_30_360);
        int endDay = Math.min(end.getDayOfMonth(), DAYS_PER_MONTH_30_360);

        return (end.getYear() - start.getYear()) * DAYS_PER_YEAR_30_360
                + (end.getMonthValue() - start.getMonthValue()) * DAYS_PER_MONTH_30_360
                + (endDay - startDay)
                + 1;
    }
}
