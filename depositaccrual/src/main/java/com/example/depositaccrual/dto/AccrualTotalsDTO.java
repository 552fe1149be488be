package com.example.depositaccrual.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Summed accrual figures of a group of positions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccrualTotalsDTO {

    private int positionCount;
    private BigDecimal nominal;
    private BigDecimal fullTermInterest;
    private BigDecimal windowInterest;
    private BigDecimal accruedInterest;
    private BigDecimal bookedInterest;
    private BigDecimal reserve;
}
