package com.milkledger.report;

import com.milkledger.domain.MilkRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MonthlyReportCalculatorTest {

    private final MonthlyReportCalculator calculator = new MonthlyReportCalculator();

    private static MilkRecord record(long id, String date, String qty) {
        MilkRecord record = new MilkRecord(1L, LocalDate.parse(date), new BigDecimal(qty));
        ReflectionTestUtils.setField(record, "id", id);
        return record;
    }

    @Test @DisplayName("₹50/litre: Jan 2.0 + 1.5, Feb 3.0 → {01-2025: 175.00, 02-2025: 150.00}")
    void referenceScenario() {
        List<MilkRecord> records = List.of(
                record(1, "2025-01-10", "2.0"),
                record(2, "2025-01-20", "1.5"),
                record(3, "2025-02-05", "3.0"));

        MonthlyReport report = calculator.compute(records, new BigDecimal("50"));

        assertThat(report.getSubtotals())
            .containsEntry(YearMonth.of(2025, 1), new BigDecimal("175.00"))
            .containsEntry(YearMonth.of(2025, 2), new BigDecimal("150.00"));
        assertThat(report.getTotalRecords()).isEqualTo(3);
        assertThat(report.getGrandTotal()).isEqualByComparingTo("325.00");
        assertThat(report.getBuckets().get(YearMonth.of(2025, 1)))
            .extracting(MonthlyReport.PricedRecord::cost)
            .containsExactly(new BigDecimal("100.00"), new BigDecimal("75.00"));
    }

    @Test @DisplayName("empty input → empty report, not an error")
    void emptyInput() {
        MonthlyReport report = calculator.compute(List.of(), new BigDecimal("50"));

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.getBuckets()).isEmpty();
        assertThat(report.getSubtotals()).isEmpty();
        assertThat(report.getGrandTotal()).isEqualByComparingTo("0");
    }

    @Test @DisplayName("zero price → every cost and subtotal is zero")
    void zeroPrice() {
        MonthlyReport report = calculator.compute(
                List.of(record(1, "2025-03-01", "2.5"), record(2, "2025-04-01", "1.0")),
                BigDecimal.ZERO);

        assertThat(report.getSubtotals().values()).allSatisfy(v -> assertThat(v).isEqualByComparingTo("0"));
        assertThat(report.getTotalRecords()).isEqualTo(2);
    }

    @Test @DisplayName("negative price or null records → IllegalArgumentException")
    void invalidInput() {
        assertThatThrownBy(() -> calculator.compute(List.of(), new BigDecimal("-1")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.compute(List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.compute(null, BigDecimal.ONE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test @DisplayName("months are chronological: 09-2024 < 01-2025 < 02-2025 < 10-2025")
    void chronologicalMonths() {
        List<MilkRecord> records = List.of(
                record(1, "2025-10-01", "1"),
                record(2, "2025-02-01", "1"),
                record(3, "2024-09-30", "1"),
                record(4, "2025-01-15", "1"));

        MonthlyReport report = calculator.compute(records, BigDecimal.TEN);

        assertThat(report.getBuckets().keySet()).containsExactly(
                YearMonth.of(2024, 9), YearMonth.of(2025, 1), YearMonth.of(2025, 2), YearMonth.of(2025, 10));
        assertThat(report.getSubtotals().keySet()).containsExactlyElementsOf(report.getBuckets().keySet());
    }

    @Test @DisplayName("same month in different years → separate buckets")
    void yearIsPartOfTheKey() {
        MonthlyReport report = calculator.compute(
                List.of(record(1, "2024-01-05", "1"), record(2, "2025-01-05", "1")),
                BigDecimal.ONE);

        assertThat(report.getBuckets()).hasSize(2);
    }

    @Test @DisplayName("within a month: date ascending, then id ascending")
    void ordering() {
        List<MilkRecord> records = new ArrayList<>(List.of(
                record(5, "2025-01-20", "1"),
                record(9, "2025-01-10", "1"),
                record(3, "2025-01-10", "1"),
                record(1, "2025-01-31", "1")));

        MonthlyReport report = calculator.compute(records, BigDecimal.ONE);

        assertThat(report.getBuckets().get(YearMonth.of(2025, 1)))
            .extracting(MonthlyReport.PricedRecord::id)
            .containsExactly(3L, 9L, 5L, 1L);
    }

    @Test @DisplayName("every record lands in exactly one bucket")
    void bucketMembership() {
        List<MilkRecord> records = List.of(
                record(1, "2025-01-01", "1"),
                record(2, "2025-01-31", "1"),
                record(3, "2025-02-01", "1"),
                record(4, "2025-12-31", "1"),
                record(5, "2026-01-01", "1"));

        MonthlyReport report = calculator.compute(records, BigDecimal.ONE);

        List<Long> allIds = report.getBuckets().values().stream()
                .flatMap(List::stream)
                .map(MonthlyReport.PricedRecord::id)
                .toList();
        assertThat(allIds).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
        report.getBuckets().forEach((month, bucket) ->
                assertThat(bucket).allSatisfy(r -> assertThat(YearMonth.from(r.date())).isEqualTo(month)));
    }

    @Test @DisplayName("subtotal rounds the month's unrounded sum HALF_UP, not the rounded costs")
    void perMonthRounding() {
        // 3 × 0.335 × 1.00 = 1.005 → 1.01; per-record costs each round to 0.34 (sum 1.02)
        List<MilkRecord> records = List.of(
                record(1, "2025-05-01", "0.335"),
                record(2, "2025-05-02", "0.335"),
                record(3, "2025-05-03", "0.335"));

        MonthlyReport report = calculator.compute(records, new BigDecimal("1.00"));

        assertThat(report.getSubtotals().get(YearMonth.of(2025, 5))).isEqualTo(new BigDecimal("1.01"));
        assertThat(report.getBuckets().get(YearMonth.of(2025, 5)))
            .extracting(MonthlyReport.PricedRecord::cost)
            .containsOnly(new BigDecimal("0.34"));
    }

    @Test @DisplayName("same records, new price → every month re-priced")
    void repricing() {
        List<MilkRecord> records = List.of(
                record(1, "2025-01-10", "2.0"),
                record(2, "2025-02-05", "3.0"));

        MonthlyReport before = calculator.compute(records, new BigDecimal("50"));
        MonthlyReport after  = calculator.compute(records, new BigDecimal("60"));

        assertThat(before.getSubtotals().get(YearMonth.of(2025, 1))).isEqualByComparingTo("100");
        assertThat(after.getSubtotals().get(YearMonth.of(2025, 1))).isEqualByComparingTo("120");
        assertThat(after.getSubtotals().get(YearMonth.of(2025, 2))).isEqualByComparingTo("180");
    }

    @Test @DisplayName("costOf → quantity × price rounded to 2 dp")
    void costOf() {
        assertThat(calculator.costOf(record(1, "2025-01-01", "1.255"), BigDecimal.ONE))
            .isEqualTo(new BigDecimal("1.26"));
    }
}
