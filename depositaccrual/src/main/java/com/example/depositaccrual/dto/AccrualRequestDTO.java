package com.example.depositaccrual.dto;

import com.example.depositaccrual.entity.DayCountConvention;
import com.example.depositaccrual.util.IsoDateDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for an ad hoc interest calculation over a date range, without a stored position
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccrualRequestDTO {

    @NotNull
    @DecimalMin("0")
    private BigDecimal nominal;

    @NotNull
    @DecimalMin("0")
    private BigDecimal annualRatePercent;

    private DayCountConvention dayCountConvention;

    @NotNull
    @JsonDeserialize(using = IsoDateDeserializer.class)
    private LocalDate from;

    @NotNull
    @JsonDeserialize(using = IsoDateDeserializer.class)
    private LocalDate to;
}
