package com.example.depositaccrual.controller;

import com.example.depositaccrual.service.AccrualReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * REST controller for downloading the position overview report
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    private static final MediaType CSV = MediaType.parseMediaType("text/csv");

    private final AccrualReportService accrualReportService;

    @GetMapping("/overview.xlsx")
    public ResponseEntity<byte[]> downloadOverviewExcel(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowEnd,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cutoff)
            throws IOException {
        byte[] content = accrualReportService.generateOverviewExcel(windowStart, windowEnd, cutoff);
        return attachment(content, fileName("xlsx"), XLSX);
    }

    @GetMapping("/overview.csv")
    public ResponseEntity<byte[]> downloadOverviewCsv(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate windowEnd,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cutoff) {
        byte[] content = accrualReportService.generateOverviewCsv(windowStart, windowEnd, cutoff);
        return attachment(content, fileName("csv"), CSV);
    }

    private String fileName(String extension) {
        return "DepositOverview_" + LocalDate.now().format(DateTimeFormatter.ofPattern("yyyyMMdd")) + "." + extension;
    }

    private ResponseEntity<byte[]> attachment(byte[] content, String fileName, MediaType mediaType) {
        log.info("Sending report {} ({} bytes)", fileName, content.length);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(mediaType)
                .contentLength(content.length)
                .body(content);
    }
}
