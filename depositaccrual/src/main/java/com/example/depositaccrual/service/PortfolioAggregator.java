package com.example.depositaccrual.service;

import com.example.depositaccrual.dto.AccrualTotalsDTO;
import com.example.depositaccrual.dto.AccrualWindow;
import com.example.depositaccrual.dto.BankAccrualDTO;
import com.example.depositaccrual.dto.PortfolioAccrualDTO;
import com.example.depositaccrual.dto.PositionAccrualDTO;
import com.example.depositaccrual.entity.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.Collator;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Folds per-position accruals into bank groups and grand totals.
 *
 * Totals add up the already rounded per-position amounts, so every total equals the
 * visible sum of its rows. Positions ending less than a month after the reference date
 * (the cutoff, or today without one) are flagged as maturing soon.
 */
@Service
@Slf4j
public class PortfolioAggregator {

    private static final int MATURITY_WARNING_MONTHS = 1;

    private final InterestAccrualEngine interestAccrualEngine;
    private final Clock clock;
    private final Comparator<String> bankNameOrder;

    public PortfolioAggregator(InterestAccrualEngine interestAccrualEngine, Clock clock,
                               @Value("${accrual.grouping.locale:de-DE}") String groupingLocale) {
        this.interestAccrualEngine = interestAccrualEngine;
        this.clock = clock;

        Collator collator = Collator.getInstance(Locale.forLanguageTag(groupingLocale));
        collator.setStrength(Collator.TERTIARY);
        Comparator<String> byCollator = collator::compare;
        this.bankNameOrder = byCollator.thenComparing(Comparator.naturalOrder());
    }

    /**
     * Aggregate accruals of a collection of positions
     *
     * @param positions The positions, in input order
     * @param window Reporting window for in-window interest, or null for none
     * @param cutoff Cutoff date for accrued interest and reserve, or null to accrue the full term
     * @return Per-position rows, per-bank groups and grand totals
     */
    public PortfolioAccrualDTO aggregate(List<Position> positions, AccrualWindow window, LocalDate cutoff) {
        log.debug("Aggregating {} positions, window: {}, cutoff: {}", positions.size(), window, cutoff);

        List<PositionAccrualDTO> perPosition = new ArrayList<>(positions.size());
        Map<String, List<PositionAccrualDTO>> byBank = new TreeMap<>(bankNameOrder);

        for (Position position : positions) {
            PositionAccrualDTO row = accruePosition(position, window, cutoff);
            perPosition.add(row);
            byBank.computeIfAbsent(nullToEmpty(position.getBankName()), bank -> new ArrayList<>()).add(row);
        }

        Map<String, BankAccrualDTO> perBank = new LinkedHashMap<>();
        byBank.forEach((bankName, rows) -> perBank.put(bankName, BankAccrualDTO.builder()
                .bankName(bankName)
                .positions(rows)
                .totals(sum(rows))
                .build()));

        return PortfolioAccrualDTO.builder()
                .windowStart(window != null ? window.getFrom() : null)
                .windowEnd(window != null ? window.getTo() : null)
                .cutoff(cutoff)
                .perPosition(perPosition)
                .perBank(perBank)
                .grandTotal(sum(perPosition))
                .build();
    }

    /**
     * Compute all accrual figures of a single position
     *
     * @param position The position
     * @param window Reporting window, or null for none
     * @param cutoff Cutoff date, or null to accrue the full term
     * @return The position row
     */
    public PositionAccrualDTO accruePosition(Position position, AccrualWindow window, LocalDate cutoff) {
        BigDecimal fullTerm = interestAccrualEngine.fullTerm(position).getInterest();
        BigDecimal windowInterest = window != null
                ? interestAccrualEngine.inWindow(position, window.getFrom(), window.getTo()).getInterest()
                : BigDecimal.ZERO.setScale(2);
        BigDecimal accrued = cutoff != null
                ? interestAccrualEngine.accruedToCutoff(position, cutoff).getInterest()
                : fullTerm;
        BigDecimal booked = interestAccrualEngine.bookedInterestOf(position);
        LocalDate reference = cutoff != null ? cutoff : LocalDate.now(clock);

        return PositionAccrualDTO.builder()
                .id(position.getId())
                .bankName(position.getBankName())
                .accountNumber(position.getAccountNumber())
                .startDate(position.getStartDate())
                .endDate(position.getEndDate())
                .termMonths(ChronoUnit.MONTHS.between(position.getStartDate(), position.getEndDate()))
                .annualRatePercent(position.getAnnualRatePercent())
                .dayCountConvention(position.getDayCountConvention())
                .nominal(position.getNominal())
                .fullTermInterest(fullTerm)
                .windowInterest(windowInterest)
                .accruedInterest(accrued)
                .bookedInterest(booked)
                .reserve(accrued.subtract(booked))
                .maturingSoon(isMaturingSoon(position, reference))
                .build();
    }

    private boolean isMaturingSoon(Position position, LocalDate reference) {
        return position.getEndDate() != null
                && position.getEndDate().isBefore(reference.plusMonths(MATURITY_WARNING_MONTHS));
    }

    private AccrualTotalsDTO sum(List<PositionAccrualDTO> rows) {
        return AccrualTotalsDTO.builder()
                .positionCount(rows.size())
                .nominal(total(rows, PositionAccrualDTO::getNominal))
                .fullTermInterest(total(rows, PositionAccrualDTO::getFullTermInterest))
                .windowInterest(total(rows, PositionAccrualDTO::getWindowInterest))
                .accruedInterest(total(rows, PositionAccrualDTO::getAccruedInterest))
                .bookedInterest(total(rows, PositionAccrualDTO::getBookedInterest))
                .reserve(total(rows, PositionAccrualDTO::getReserve))
                .build();
    }

    private BigDecimal total(List<PositionAccrualDTO> rows, Function<PositionAccrualDTO, BigDecimal> figure) {
        return rows.stream()
                .map(figure)
                .map(amount -> amount != null ? amount : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
