package com.example.depositaccrual.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO carrying the interest amount already booked for a position
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookInterestRequestDTO {

    @NotNull
    @DecimalMin("0")
    private BigDecimal bookedInterest;
}
