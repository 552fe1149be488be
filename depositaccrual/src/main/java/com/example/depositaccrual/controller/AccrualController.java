package com.example.depositaccrual.controller;

import com.example.depositaccrual.dto.AccrualRequestDTO;
import com.example.depositaccrual.dto.AccrualResult;
import com.example.depositaccrual.dto.PortfolioAccrualDTO;
import com.example.depositaccrual.dto.PositionAccrualDTO;
import com.example.depositaccrual.service.AccrualService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * REST controller for interest accrual queries
 */
@RestController
@RequestMapping("/api/accruals")
@RequiredArgsConstructor
public class AccrualController {

    private final AccrualService accrualService;

    /**
     * Get per-position, per-bank and total accruals of all positions
     *
     * @param windowStart Optional start of the reporting window (e.g. quarter begin)
     * @param windowEnd Optional end of the reporting window (e.g. quarter end)
     * @param cutoff Optional cutoff date for accrued interest and reserve
     * @return The portfolio overview
     */
    @GetMapping("/portfolio")
    public ResponseEntity<PortfolioAccrualDTO> getPortfolioAccruals(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowEnd,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cutoff) {
        return ResponseEntity.ok(accrualService.getPortfolioAccruals(windowStart, windowEnd, cutoff));
    }

    @GetMapping("/positions/{id}")
    public ResponseEntity<PositionAccrualDTO> getPositionAccruals(
            @PathVariable String id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowEnd,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cutoff) {
        return ResponseEntity.ok(accrualService.getPositionAccruals(id, windowStart, windowEnd, cutoff));
    }

    /**
     * Calculate interest for a principal and rate over a date range
     *
     * @param request Principal, rate, convention and date range
     * @return Days, year basis and rounded interest
     */
    @PostMapping("/calculate")
    public ResponseEntity<AccrualResult> calculate(@Valid @RequestBody AccrualRequestDTO request) {
        return ResponseEntity.ok(accrualService.calculate(request));
    }
}
