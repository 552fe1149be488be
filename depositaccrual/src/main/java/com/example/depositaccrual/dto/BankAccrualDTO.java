package com.example.depositaccrual.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Positions of one bank with their totals
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankAccrualDTO {

    private String bankName;
    private List<PositionAccrualDTO> positions;
    private AccrualTotalsDTO totals;
}
