package com.example.depositaccrual.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.Year;

/**
 * Resolves the annualization denominator for ACTUAL_ACTUAL accruals.
 *
 * A range inside one calendar year uses that year's length (365 or 366).
 * A range spanning several years uses the day-weighted average of the lengths of the
 * years it touches: sum(days_i * basis_i) / sum(days_i), days_i counted inclusively.
 */
@Component
@RequiredArgsConstructor
public class YearBasisResolver {

    static final BigDecimal DEFAULT_BASIS = BigDecimal.valueOf(365);

    private final DayCountCalculator dayCountCalculator;

    /**
     * Get the year basis for a date range
     *
     * @param start First day of the range
     * @param end Last day of the range
     * @return 365, 366 or the weighted multi-year basis; 365 if the range covers no day
     */
    public BigDecimal yearBasis(LocalDate start, LocalDate end) {
        if (start.getYear() == end.getYear()) {
            return BigDecimal.valueOf(Year.of(start.getYear()).length());
        }

        long totalDays = 0;
        long weightedDays = 0;

        for (int year = start.getYear(); year <= end.getYear(); year++) {
            LocalDate yearStart = LocalDate.of(year, 1, 1);
            LocalDate yearEnd = LocalDate.of(year, 12, 31);
            LocalDate segmentStart = start.isAfter(yearStart) ? start : yearStart;
            LocalDate segmentEnd = end.isBefore(yearEnd) ? end : yearEnd;

            int segmentDays = dayCountCalculator.actualDays(segmentStart, segmentEnd);
            if (segmentDays <= 0) {
                continue;
            }
            totalDays += segmentDays;
            weightedDays += (long) segmentDays * Year.of(year).length();
        }

        if (totalDays == 0) {
            return DEFAULT_BASIS;
        }

        return BigDecimal.valueOf(weightedDays)
                .divide(BigDecimal.valueOf(totalDays), MathContext.DECIMAL64);
    }
}
