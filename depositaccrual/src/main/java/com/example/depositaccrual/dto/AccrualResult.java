package com.example.depositaccrual.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of a single accrual: day count, year basis and interest rounded to 2 decimals
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccrualResult {

    private int days;
    private BigDecimal yearBasis;
    private BigDecimal interest;
}
