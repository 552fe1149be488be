package com.example.depositaccrual.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Portfolio overview: per-position rows, per-bank groups in presentation order, and grand totals
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioAccrualDTO {

    private LocalDate windowStart;
    private LocalDate windowEnd;
    private LocalDate cutoff;
    private List<PositionAccrualDTO> perPosition;
    private Map<String, BankAccrualDTO> perBank;
    private AccrualTotalsDTO grandTotal;
}
