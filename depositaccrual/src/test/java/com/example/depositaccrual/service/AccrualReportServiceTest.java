package com.example.depositaccrual.service;

import com.example.depositaccrual.dto.AccrualWindow;
import com.example.depositaccrual.dto.PortfolioAccrualDTO;
import com.example.depositaccrual.entity.DayCountConvention;
import com.example.depositaccrual.entity.Position;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccrualReportService Unit Tests")
class AccrualReportServiceTest {

    private static final LocalDate WINDOW_START = LocalDate.of(2024, 1, 1);
    private static final LocalDate WINDOW_END = LocalDate.of(2024, 3, 31);
    private static final LocalDate CUTOFF = LocalDate.of(2024, 6, 30);

    @Mock
    private AccrualService accrualService;

    private AccrualReportService reportService;
    private PortfolioAggregator aggregator;
    private List<Position> positions;
    private PortfolioAccrualDTO portfolio;

    @BeforeEach
    void setUp() {
        reportService = new AccrualReportService(accrualService, "Deposit Overview");

        DayCountCalculator dayCountCalculator = new DayCountCalculator();
        InterestAccrualEngine engine = new InterestAccrualEngine(dayCountCalculator,
                new YearBasisResolver(dayCountCalculator));
        aggregator = new PortfolioAggregator(engine,
                Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC), "de-DE");
        positions = List.of(
                position("Sparkasse", "A-1", "1000", "5", "10.00"),
                position("Bank, Frankfurt", "B-1", "2000", "4", "0"),
                position("Sparkasse", "A-2", "500", "2", "0"));
    }

    private void stubQuarterPortfolio() {
        portfolio = aggregator.aggregate(positions, AccrualWindow.of(WINDOW_START, WINDOW_END), CUTOFF);
        when(accrualService.getPortfolioAccruals(WINDOW_START, WINDOW_END, CUTOFF)).thenReturn(portfolio);
    }

    private static Position position(String bank, String account, String nominal, String rate, String booked) {
        return Position.builder()
                .id(account)
                .bankName(bank)
                .accountNumber(account)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .nominal(new BigDecimal(nominal))
                .annualRatePercent(new BigDecimal(rate))
                .dayCountConvention(DayCountConvention.ACTUAL_ACTUAL)
                .bookedInterest(new BigDecimal(booked))
                .build();
    }

    @Test
    @DisplayName("Excel overview lists banks in order with group and grand totals")
    void excelOverview() throws Exception {
        stubQuarterPortfolio();
        byte[] content = reportService.generateOverviewExcel(WINDOW_START, WINDOW_END, CUTOFF);

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(content))) {
            Sheet sheet = workbook.getSheet("Overview");
            assertThat(sheet).isNotNull();

            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Deposit Overview");
            assertThat(sheet.getRow(1).getCell(0).getStringCellValue())
                    .isEqualTo("Window: 01.01.2024 - 31.03.2024, Cutoff: 30.06.2024");
            assertThat(sheet.getRow(3).getCell(0).getStringCellValue()).isEqualTo("Account_No");
            assertThat(sheet.getRow(3).getCell(11).getStringCellValue()).isEqualTo("Maturing_Soon");

            // First group: "Bank, Frankfurt"
            assertThat(sheet.getRow(4).getCell(0).getStringCellValue()).isEqualTo("Bank, Frankfurt");
            assertThat(sheet.getRow(5).getCell(0).getStringCellValue()).isEqualTo("B-1");
            assertThat(sheet.getRow(6).getCell(0).getStringCellValue()).isEqualTo("Total");

            // Second group: Sparkasse with two positions
            assertThat(sheet.getRow(7).getCell(0).getStringCellValue()).isEqualTo("Sparkasse");
            assertThat(sheet.getRow(8).getCell(0).getStringCellValue()).isEqualTo("A-1");
            assertThat(sheet.getRow(8).getCell(3).getNumericCellValue()).isEqualTo(11d);
            assertThat(sheet.getRow(8).getCell(6).getNumericCellValue()).isCloseTo(50.00, within(0.001));
            assertThat(sheet.getRow(8).getCell(11)).isNull();
            assertThat(sheet.getRow(9).getCell(0).getStringCellValue()).isEqualTo("A-2");
            Row sparkasseTotal = sheet.getRow(10);
            assertThat(sparkasseTotal.getCell(0).getStringCellValue()).isEqualTo("Total");
            assertThat(sparkasseTotal.getCell(5).getNumericCellValue()).isCloseTo(1500.00, within(0.001));
            assertThat(sparkasseTotal.getCell(6).getNumericCellValue()).isCloseTo(60.00, within(0.001));

            Row grandTotal = sheet.getRow(12);
            assertThat(grandTotal.getCell(0).getStringCellValue()).isEqualTo("GRAND TOTAL");
            assertThat(grandTotal.getCell(6).getNumericCellValue())
                    .isCloseTo(portfolio.getGrandTotal().getFullTermInterest().doubleValue(), within(0.001));
            assertThat(grandTotal.getCell(10).getNumericCellValue())
                    .isCloseTo(portfolio.getGrandTotal().getReserve().doubleValue(), within(0.001));
        }
    }

    @Test
    @DisplayName("CSV overview quotes bank names and ends with a TOTAL row")
    void csvOverview() {
        stubQuarterPortfolio();
        String csv = new String(reportService.generateOverviewCsv(WINDOW_START, WINDOW_END, CUTOFF),
                StandardCharsets.UTF_8);
        String[] lines = csv.split("\n");

        assertThat(lines[0]).isEqualTo("Bank,Account_No,Start_Date,End_Date,Months,Rate_Pct,Nominal,Interest,"
                + "Window_Interest,Accrued_Interest,Booked_Interest,Reserve,Maturing_Soon");
        assertThat(lines[1]).startsWith("\"Bank, Frankfurt\",B-1,2024-01-01,2024-12-31,11,4,2000,80.00,");
        assertThat(lines[2]).startsWith("\"Bank, Frankfurt\",Total,,,,,2000.00,80.00,");
        assertThat(lines[3]).isEqualTo("Sparkasse,A-1,2024-01-01,2024-12-31,11,5,1000,50.00,12.43,24.86,10.00,14.86,false");
        assertThat(lines).hasSize(7);
        assertThat(lines[6]).startsWith("TOTAL,,,,,,3500.00,140.00,");
    }

    @Test
    @DisplayName("Positions ending within a month of the cutoff are marked in both formats")
    void maturingSoonMarked() throws Exception {
        LocalDate yearEnd = LocalDate.of(2024, 12, 15);
        when(accrualService.getPortfolioAccruals(null, null, yearEnd))
                .thenReturn(aggregator.aggregate(positions, null, yearEnd));

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(
                reportService.generateOverviewExcel(null, null, yearEnd)))) {
            Sheet sheet = workbook.getSheet("Overview");
            assertThat(sheet.getRow(1).getCell(0).getStringCellValue())
                    .isEqualTo("Window: none, Cutoff: 15.12.2024");
            assertThat(sheet.getRow(5).getCell(11).getStringCellValue()).isEqualTo("Yes");
            assertThat(sheet.getRow(8).getCell(11).getStringCellValue()).isEqualTo("Yes");
            assertThat(sheet.getRow(6).getCell(11)).isNull();
        }

        String[] lines = new String(reportService.generateOverviewCsv(null, null, yearEnd), StandardCharsets.UTF_8)
                .split("\n");
        assertThat(lines[1]).endsWith(",true");
        assertThat(lines[2]).endsWith(",");
        assertThat(lines[3]).endsWith(",true");
    }
}
