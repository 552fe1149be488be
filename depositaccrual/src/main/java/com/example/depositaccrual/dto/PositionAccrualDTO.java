package com.example.depositaccrual.dto;

import com.example.depositaccrual.entity.DayCountConvention;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Accrual figures of one position for a reporting window and cutoff
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionAccrualDTO {

    private String id;
    private String bankName;
    private String accountNumber;
    private LocalDate startDate;
    private LocalDate endDate;
    private long termMonths;           // Whole months between start and end date
    private BigDecimal annualRatePercent;
    private DayCountConvention dayCountConvention;
    private BigDecimal nominal;
    private BigDecimal fullTermInterest;
    private BigDecimal windowInterest;  // Zero when no window was requested
    private BigDecimal accruedInterest; // Start date up to the cutoff
    private BigDecimal bookedInterest;
    private BigDecimal reserve;         // Accrued minus booked, may be negative
    private boolean maturingSoon;       // End date less than one month after the cutoff, or today without one
}
