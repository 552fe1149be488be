package com.example.depositaccrual.entity;

import com.example.depositaccrual.util.IsoDateDeserializer;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A fixed-term deposit held at a bank.
 * Start and end date are both inclusive boundaries of the accrual term.
 * The German aliases are the field names of the legacy desktop data file.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String id;

    private String bankName;

    @JsonAlias("kontoNumber")
    private String accountNumber;

    @JsonAlias("startDatum")
    @JsonDeserialize(using = IsoDateDeserializer.class)
    private LocalDate startDate;

    @JsonAlias("endDatum")
    @JsonDeserialize(using = IsoDateDeserializer.class)
    private LocalDate endDate;

    private BigDecimal nominal;

    @JsonAlias("zinssatz")
    private BigDecimal annualRatePercent;

    @Builder.Default
    private DayCountConvention dayCountConvention = DayCountConvention.ACTUAL_ACTUAL;

    @JsonAlias("verbuchteRueckstellung")
    @Builder.Default
    private BigDecimal bookedInterest = BigDecimal.ZERO;
}
