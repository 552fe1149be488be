package com.example.depositaccrual.service;

import com.example.depositaccrual.dto.AccrualResult;
import com.example.depositaccrual.dto.AccrualWindow;
import com.example.depositaccrual.entity.DayCountConvention;
import com.example.depositaccrual.entity.Position;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Interest accrual for deposit positions
 *
 * Interest = Nominal × (Rate / 100) × (Days / Year_Basis), rounded half away from zero to 2 decimals.
 * Every query clips its window to the position term first. An empty or inverted window is a
 * zero-interest result, never an error. Nothing is cached; each call recomputes from the position.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterestAccrualEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal BASIS_30_360 = BigDecimal.valueOf(360);
    private static final int AMOUNT_SCALE = 2;

    private final DayCountCalculator dayCountCalculator;
    private final YearBasisResolver yearBasisResolver;

    /**
     * Accrue interest of a position over a window
     *
     * @param position The position
     * @param window The requested window, clipped to the position term
     * @return Days, year basis and rounded interest; zero interest if the clipped window is empty
     */
    public AccrualResult accrue(Position position, AccrualWindow window) {
        AccrualWindow clipped = window.clipTo(position.getStartDate(), position.getEndDate());
        DayCountConvention convention = conventionOf(position);

        if (clipped.isEmpty()) {
            log.debug("Empty accrual window {} - {} for account {}",
                    clipped.getFrom(), clipped.getTo(), position.getAccountNumber());
            return zero(resolveBasis(clipped.getFrom(), clipped.getTo(), convention));
        }

        return calculate(position.getNominal(), position.getAnnualRatePercent(), convention,
                clipped.getFrom(), clipped.getTo());
    }

    /**
     * Calculate interest for a principal and rate over a date range
     *
     * @param nominal The principal
     * @param annualRatePercent Annual rate in percent (5 means 5%)
     * @param convention Day-count convention, ACTUAL_ACTUAL if null
     * @param from First day of the range
     * @param to Last day of the range
     * @return Days, year basis and rounded interest; zero interest when the range has no days
     */
    public AccrualResult calculate(BigDecimal nominal, BigDecimal annualRatePercent,
                                   DayCountConvention convention, LocalDate from, LocalDate to) {
        DayCountConvention effective = convention != null ? convention : DayCountConvention.ACTUAL_ACTUAL;
        BigDecimal basis = resolveBasis(from, to, effective);

        // 30/360 day capping can count an inverted range as positive
        if (to.isBefore(from)) {
            log.debug("Inverted accrual range {} - {}", from, to);
            return zero(basis);
        }

        int days = dayCountCalculator.days(from, to, effective);

        if (days <= 0) {
            return zero(basis);
        }

        // Divide once, after the full numerator is built
        BigDecimal numerator = nominal.multiply(annualRatePercent).multiply(BigDecimal.valueOf(days));
        BigDecimal rawInterest = numerator.divide(HUNDRED.multiply(basis), MathContext.DECIMAL64);
        BigDecimal interest = rawInterest.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);

        log.debug("Accrual {} {} - {}: {} × {}% × {}/{} = {} -> {}",
                effective, from, to, nominal, annualRatePercent, days, basis, rawInterest, interest);

        return AccrualResult.builder()
                .days(days)
                .yearBasis(basis)
                .interest(interest)
                .build();
    }

    /**
     * Interest over the whole term of a position
     */
    public AccrualResult fullTerm(Position position) {
        return accrue(position, AccrualWindow.of(position.getStartDate(), position.getEndDate()));
    }

    /**
     * Interest earned from the start date up to and including the cutoff
     */
    public AccrualResult accruedToCutoff(Position position, LocalDate cutoff) {
        return accrue(position, AccrualWindow.of(position.getStartDate(), cutoff));
    }

    /**
     * Interest falling into a reporting window, e.g. a quarter.
     * A window entirely outside the term yields zero.
     */
    public AccrualResult inWindow(Position position, LocalDate windowStart, LocalDate windowEnd) {
        return accrue(position, AccrualWindow.of(windowStart, windowEnd));
    }

    /**
     * Accrued-to-cutoff interest not yet booked. Negative when more was booked than accrued.
     */
    public BigDecimal reserve(Position position, LocalDate cutoff) {
        return accruedToCutoff(position, cutoff).getInterest().subtract(bookedInterestOf(position));
    }

    /**
     * Booked interest of a position, zero when never booked
     */
    public BigDecimal bookedInterestOf(Position position) {
        return position.getBookedInterest() != null ? position.getBookedInterest() : BigDecimal.ZERO;
    }

    private BigDecimal resolveBasis(LocalDate from, LocalDate to, DayCountConvention convention) {
        if (convention == DayCountConvention.THIRTY_360) {
            return BASIS_30_360;
        }
        return yearBasisResolver.yearBasis(from, to);
    }

    private DayCountConvention conventionOf(Position position) {
        return position.getDayCountConvention() != null
                ? position.getDayCountConvention()
                : DayCountConvention.ACTUAL_ACTUAL;
    }

    private AccrualResult zero(BigDecimal basis) {
        return AccrualResult.builder()
                .days(0)
                .yearBasis(basis)
                .interest(BigDecimal.ZERO.setScale(AMOUNT_SCALE))
                .build();
    }
}
