package com.example.depositaccrual.service;

import com.example.depositaccrual.dto.AccrualRequestDTO;
import com.example.depositaccrual.dto.AccrualResult;
import com.example.depositaccrual.dto.AccrualWindow;
import com.example.depositaccrual.dto.PortfolioAccrualDTO;
import com.example.depositaccrual.dto.PositionAccrualDTO;
import com.example.depositaccrual.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Accrual queries over the stored positions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccrualService {

    private final PositionService positionService;
    private final PortfolioAggregator portfolioAggregator;
    private final InterestAccrualEngine interestAccrualEngine;

    /**
     * Accrual overview of all stored positions
     *
     * @param windowStart Start of the reporting window, or null
     * @param windowEnd End of the reporting window, or null
     * @param cutoff Cutoff date for accrued interest, or null for full term
     * @return The portfolio overview
     * @throws BusinessException if only one window bound is given
     */
    public PortfolioAccrualDTO getPortfolioAccruals(LocalDate windowStart, LocalDate windowEnd, LocalDate cutoff) {
        AccrualWindow window = toWindow(windowStart, windowEnd);
        PortfolioAccrualDTO portfolio = portfolioAggregator.aggregate(positionService.getAllPositions(), window, cutoff);

        log.info("Portfolio accruals: {} positions in {} banks, interest={}, window interest={}, reserve={}",
                portfolio.getGrandTotal().getPositionCount(), portfolio.getPerBank().size(),
                portfolio.getGrandTotal().getFullTermInterest(), portfolio.getGrandTotal().getWindowInterest(),
                portfolio.getGrandTotal().getReserve());
        return portfolio;
    }

    /**
     * Accrual figures of one stored position
     *
     * @param id The position id
     * @param windowStart Start of the reporting window, or null
     * @param windowEnd End of the reporting window, or null
     * @param cutoff Cutoff date for accrued interest, or null for full term
     * @return The position row
     */
    public PositionAccrualDTO getPositionAccruals(String id, LocalDate windowStart, LocalDate windowEnd,
                                                  LocalDate cutoff) {
        AccrualWindow window = toWindow(windowStart, windowEnd);
        return portfolioAggregator.accruePosition(positionService.getPosition(id), window, cutoff);
    }

    /**
     * Ad hoc interest calculation for a principal and rate over a date range
     */
    public AccrualResult calculate(AccrualRequestDTO request) {
        return interestAccrualEngine.calculate(request.getNominal(), request.getAnnualRatePercent(),
                request.getDayCountConvention(), request.getFrom(), request.getTo());
    }

    private AccrualWindow toWindow(LocalDate windowStart, LocalDate windowEnd) {
        if (windowStart == null && windowEnd == null) {
            return null;
        }
        if (windowStart == null || windowEnd == null) {
            throw new BusinessException("Reporting window needs both windowStart and windowEnd");
        }
        return AccrualWindow.of(windowStart, windowEnd);
    }
}
