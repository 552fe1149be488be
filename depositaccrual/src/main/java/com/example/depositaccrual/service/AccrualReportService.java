package com.example.depositaccrual.service;

import com.example.depositaccrual.dto.AccrualTotalsDTO;
import com.example.depositaccrual.dto.BankAccrualDTO;
import com.example.depositaccrual.dto.PortfolioAccrualDTO;
import com.example.depositaccrual.dto.PositionAccrualDTO;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Bank-grouped overview report of all positions, as Excel workbook or CSV.
 * Figures come from the portfolio aggregation, so report totals match the API totals.
 */
@Service
@Slf4j
public class AccrualReportService {

    static final String[] COLUMNS = {
            "Account_No", "Start_Date", "End_Date", "Months", "Rate_Pct", "Nominal",
            "Interest", "Window_Interest", "Accrued_Interest", "Booked_Interest", "Reserve", "Maturing_Soon"
    };

    private static final int MATURING_COLUMN = 11;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final AccrualService accrualService;
    private final String reportTitle;

    public AccrualReportService(AccrualService accrualService,
                                @Value("${reports.title:Deposit Overview}") String reportTitle) {
        this.accrualService = accrualService;
        this.reportTitle = reportTitle;
    }

    /**
     * Generate the overview as Excel workbook (in memory)
     *
     * @param windowStart Start of the reporting window, or null
     * @param windowEnd End of the reporting window, or null
     * @param cutoff Cutoff date for accrued interest, or null for full term
     * @return byte array containing xlsx content
     */
    public byte[] generateOverviewExcel(LocalDate windowStart, LocalDate windowEnd, LocalDate cutoff)
            throws IOException {
        PortfolioAccrualDTO portfolio = accrualService.getPortfolioAccruals(windowStart, windowEnd, cutoff);

        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet("Overview");

            CellStyle titleStyle = createTitleStyle(workbook);
            CellStyle headerStyle = createBandStyle(workbook, 11, true);
            CellStyle bankStyle = createBandStyle(workbook, 12, false);
            CellStyle dataStyle = createDataStyle(workbook);
            CellStyle numberStyle = createAmountStyle(workbook, false);
            CellStyle totalStyle = createAmountStyle(workbook, true);
            CellStyle warningStyle = createWarningStyle(workbook);

            int currentRow = 0;

            Row titleRow = sheet.createRow(currentRow++);
            createStyledCell(titleRow, 0, reportTitle, titleStyle);
            sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, COLUMNS.length - 1));

            Row periodRow = sheet.createRow(currentRow++);
            createStyledCell(periodRow, 0, describePeriod(portfolio), dataStyle);

            // Spacer
            currentRow++;

            Row headerRow = sheet.createRow(currentRow++);
            for (int i = 0; i < COLUMNS.length; i++) {
                createStyledCell(headerRow, i, COLUMNS[i], headerStyle);
            }

            for (BankAccrualDTO bank : portfolio.getPerBank().values()) {
                Row bankRow = sheet.createRow(currentRow);
                createStyledCell(bankRow, 0, bank.getBankName(), bankStyle);
                sheet.addMergedRegion(new CellRangeAddress(currentRow, currentRow, 0, COLUMNS.length - 1));
                currentRow++;

                for (PositionAccrualDTO position : bank.getPositions()) {
                    Row row = sheet.createRow(currentRow++);
                    createStyledCell(row, 0, position.getAccountNumber(), dataStyle);
                    createStyledCell(row, 1, formatDate(position.getStartDate()), dataStyle);
                    createStyledCell(row, 2, formatDate(position.getEndDate()), dataStyle);
                    Cell monthsCell = row.createCell(3);
                    monthsCell.setCellValue(position.getTermMonths());
                    monthsCell.setCellStyle(dataStyle);
                    createStyledNumericCell(row, 4, position.getAnnualRatePercent(), dataStyle);
                    writeFigures(row, position.getNominal(), position.getFullTermInterest(),
                            position.getWindowInterest(), position.getAccruedInterest(),
                            position.getBookedInterest(), position.getReserve(), numberStyle);
                    if (position.isMaturingSoon()) {
                        createStyledCell(row, MATURING_COLUMN, "Yes", warningStyle);
                    }
                }

                Row totalRow = sheet.createRow(currentRow++);
                createStyledCell(totalRow, 0, "Total", totalStyle);
                writeTotals(totalRow, bank.getTotals(), totalStyle);
            }

            // Empty row before grand total
            currentRow++;

            Row grandTotalRow = sheet.createRow(currentRow);
            createStyledCell(grandTotalRow, 0, "GRAND TOTAL", totalStyle);
            writeTotals(grandTotalRow, portfolio.getGrandTotal(), totalStyle);

            sheet.setColumnWidth(0, 20 * 256);
            sheet.setColumnWidth(1, 12 * 256);
            sheet.setColumnWidth(2, 12 * 256);
            sheet.setColumnWidth(3, 8 * 256);
            sheet.setColumnWidth(4, 10 * 256);
            for (int i = 5; i < MATURING_COLUMN; i++) {
                sheet.setColumnWidth(i, 16 * 256);
            }
            sheet.setColumnWidth(MATURING_COLUMN, 14 * 256);

            workbook.write(outputStream);
            log.info("Overview Excel report generated in memory ({} bytes): {} banks, {} positions",
                    outputStream.size(), portfolio.getPerBank().size(), portfolio.getGrandTotal().getPositionCount());

            return outputStream.toByteArray();
        }
    }

    /**
     * Generate the overview as CSV
     *
     * Format:
     * Bank, Account_No, Start_Date, End_Date, Months, Rate_Pct, Nominal, Interest, Window_Interest,
     * Accrued_Interest, Booked_Interest, Reserve, Maturing_Soon
     *
     * One "Total" row per bank, footer row "TOTAL" with the grand totals. Total rows leave
     * Maturing_Soon empty.
     */
    public byte[] generateOverviewCsv(LocalDate windowStart, LocalDate windowEnd, LocalDate cutoff) {
        PortfolioAccrualDTO portfolio = accrualService.getPortfolioAccruals(windowStart, windowEnd, cutoff);

        StringBuilder csvContent = new StringBuilder();
        csvContent.append("Bank,").append(String.join(",", COLUMNS)).append('\n');

        for (BankAccrualDTO bank : portfolio.getPerBank().values()) {
            for (PositionAccrualDTO position : bank.getPositions()) {
                csvContent.append(String.format("%s,%s,%s,%s,%d,%s,%s,%s,%s,%s,%s,%s,%s\n",
                        csvField(bank.getBankName()), csvField(position.getAccountNumber()),
                        position.getStartDate(), position.getEndDate(), position.getTermMonths(),
                        plain(position.getAnnualRatePercent()), plain(position.getNominal()),
                        plain(position.getFullTermInterest()), plain(position.getWindowInterest()),
                        plain(position.getAccruedInterest()), plain(position.getBookedInterest()),
                        plain(position.getReserve()), position.isMaturingSoon()));
            }
            csvContent.append(totalsLine(csvField(bank.getBankName()), "Total", bank.getTotals()));
        }
        csvContent.append(totalsLine("TOTAL", "", portfolio.getGrandTotal()));

        log.info("Overview CSV report generated: {} banks, {} positions",
                portfolio.getPerBank().size(), portfolio.getGrandTotal().getPositionCount());

        return csvContent.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String totalsLine(String first, String second, AccrualTotalsDTO totals) {
        return String.format("%s,%s,,,,,%s,%s,%s,%s,%s,%s,\n", first, second,
                plain(totals.getNominal()), plain(totals.getFullTermInterest()), plain(totals.getWindowInterest()),
                plain(totals.getAccruedInterest()), plain(totals.getBookedInterest()), plain(totals.getReserve()));
    }

    private void writeTotals(Row row, AccrualTotalsDTO totals, CellStyle style) {
        writeFigures(row, totals.getNominal(), totals.getFullTermInterest(), totals.getWindowInterest(),
                totals.getAccruedInterest(), totals.getBookedInterest(), totals.getReserve(), style);
    }

    private void writeFigures(Row row, BigDecimal nominal, BigDecimal interest, BigDecimal windowInterest,
                              BigDecimal accrued, BigDecimal booked, BigDecimal reserve, CellStyle style) {
        createStyledNumericCell(row, 5, nominal, style);
        createStyledNumericCell(row, 6, interest, style);
        createStyledNumericCell(row, 7, windowInterest, style);
        createStyledNumericCell(row, 8, accrued, style);
        createStyledNumericCell(row, 9, booked, style);
        createStyledNumericCell(row, 10, reserve, style);
    }

    private String describePeriod(PortfolioAccrualDTO portfolio) {
        StringBuilder period = new StringBuilder();
        if (portfolio.getWindowStart() != null) {
            period.append("Window: ").append(formatDate(portfolio.getWindowStart()))
                    .append(" - ").append(formatDate(portfolio.getWindowEnd()));
        } else {
            period.append("Window: none");
        }
        period.append(", Cutoff: ")
                .append(portfolio.getCutoff() != null ? formatDate(portfolio.getCutoff()) : "end of term");
        return period.toString();
    }

    private String formatDate(LocalDate date) {
        return date != null ? date.format(DATE_FORMAT) : "";
    }

    private String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "";
    }

    /**
     * Quote a CSV field when it contains a separator, quote or line break
     */
    private String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private Font boldFont(Workbook workbook, int points) {
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) points);
        return font;
    }

    private CellStyle createTitleStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setFont(boldFont(workbook, 14));
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    /**
     * Grey band for the column header (boxed, centered) and the bank rows
     */
    private CellStyle createBandStyle(Workbook workbook, int fontPoints, boolean boxed) {
        CellStyle style = workbook.createCellStyle();
        style.setFont(boldFont(workbook, fontPoints));
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        if (boxed) {
            style.setAlignment(HorizontalAlignment.CENTER);
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
        }
        return style;
    }

    private CellStyle createDataStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setAlignment(HorizontalAlignment.LEFT);
        return style;
    }

    private CellStyle createAmountStyle(Workbook workbook, boolean total) {
        CellStyle style = workbook.createCellStyle();
        style.setDataFormat(workbook.createDataFormat().getFormat("#,##0.00"));
        style.setAlignment(HorizontalAlignment.RIGHT);
        if (total) {
            style.setFont(boldFont(workbook, 11));
            style.setBorderTop(BorderStyle.DOUBLE);
        }
        return style;
    }

    private CellStyle createWarningStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setFillForegroundColor(IndexedColors.LIGHT_YELLOW.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    private void createStyledCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private void createStyledNumericCell(Row row, int column, BigDecimal value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value != null ? value.doubleValue() : 0d);
        cell.setCellStyle(style);
    }
}
