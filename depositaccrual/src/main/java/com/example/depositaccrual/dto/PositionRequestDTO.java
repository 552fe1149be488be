package com.example.depositaccrual.dto;

import com.example.depositaccrual.entity.DayCountConvention;
import com.example.depositaccrual.util.IsoDateDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for creating or replacing a deposit position
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRequestDTO {

    @NotBlank
    private String bankName;

    @NotBlank
    private String accountNumber;

    @NotNull
    @JsonDeserialize(using = IsoDateDeserializer.class)
    private LocalDate startDate;

    @NotNull
    @JsonDeserialize(using = IsoDateDeserializer.class)
    private LocalDate endDate;

    @NotNull
    @DecimalMin("0")
    private BigDecimal nominal;

    @NotNull
    @DecimalMin("0")
    private BigDecimal annualRatePercent;

    private DayCountConvention dayCountConvention; // null means configured default

    @DecimalMin("0")
    private BigDecimal bookedInterest;
}
