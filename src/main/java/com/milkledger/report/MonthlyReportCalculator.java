package com.milkledger.report;

import com.milkledger.domain.MilkRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns a user's flat record list into a month-keyed cost report.
 *
 * RULES:
 *   1. cost = quantity × unitPrice, computed on every call (never stored)
 *   2. bucket key = YearMonth of the record date
 *   3. within a bucket: date ascending, then id ascending
 *   4. subtotal = sum of the bucket's unrounded costs, rounded to 2 dp HALF_UP
 *   5. buckets ordered chronologically
 *
 * Pure: no repository access, no clock.
 */
@Component
public class MonthlyReportCalculator {

    static final int MONEY_SCALE = 2;

    private static final Comparator<MilkRecord> RECORD_ORDER = Comparator
            .comparing(MilkRecord::getDate)
            .thenComparing(MilkRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * @throws IllegalArgumentException if records is null, or unitPrice is null or negative
     */
    public MonthlyReport compute(List<MilkRecord> records, BigDecimal unitPrice) {
        if (records == null) {
            throw new IllegalArgumentException("Records cannot be null");
        }
        if (unitPrice == null || unitPrice.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException(
                "Unit price must be zero or greater. Got: " + unitPrice);
        }

        SortedMap<YearMonth, List<MilkRecord>> grouped = new TreeMap<>();
        for (MilkRecord record : records) {
            grouped.computeIfAbsent(YearMonth.from(record.getDate()), k -> new ArrayList<>()).add(record);
        }

        SortedMap<YearMonth, List<MonthlyReport.PricedRecord>> buckets = new TreeMap<>();
        SortedMap<YearMonth, BigDecimal> subtotals = new TreeMap<>();
        BigDecimal grandTotal = BigDecimal.ZERO.setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        for (Map.Entry<YearMonth, List<MilkRecord>> entry : grouped.entrySet()) {
            List<MilkRecord> monthRecords = entry.getValue();
            monthRecords.sort(RECORD_ORDER);

            List<MonthlyReport.PricedRecord> priced = new ArrayList<>(monthRecords.size());
            BigDecimal unrounded = BigDecimal.ZERO;
            for (MilkRecord record : monthRecords) {
                BigDecimal cost = record.getQuantity().multiply(unitPrice);
                unrounded = unrounded.add(cost);
                priced.add(new MonthlyReport.PricedRecord(
                        record.getId(),
                        record.getDate(),
                        record.getQuantity(),
                        roundMoney(cost)));
            }

            BigDecimal subtotal = roundMoney(unrounded);
            buckets.put(entry.getKey(), List.copyOf(priced));
            subtotals.put(entry.getKey(), subtotal);
            grandTotal = grandTotal.add(subtotal);
        }

        return new MonthlyReport(buckets, subtotals, records.size(), grandTotal);
    }

    /** Cost of a single record, rounded for display. */
    public BigDecimal costOf(MilkRecord record, BigDecimal unitPrice) {
        return roundMoney(record.getQuantity().multiply(unitPrice));
    }

    private static BigDecimal roundMoney(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
