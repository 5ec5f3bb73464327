package com.milkledger.report;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

/**
 * Milk records priced and grouped by calendar month.
 *
 * Both maps iterate in chronological month order. Every record appears in
 * exactly one bucket. Immutable once built by MonthlyReportCalculator.
 */
public final class MonthlyReport {

    /**
     * A record with its cost at the unit price the report was computed with.
     * {@code cost} is rounded to 2 dp for display.
     */
    public record PricedRecord(Long id, LocalDate date, BigDecimal quantity, BigDecimal cost) {}

    private final SortedMap<YearMonth, List<PricedRecord>> buckets;
    private final SortedMap<YearMonth, BigDecimal>         subtotals;
    private final int                                      totalRecords;
    private final BigDecimal                               grandTotal;

    MonthlyReport(SortedMap<YearMonth, List<PricedRecord>> buckets,
                  SortedMap<YearMonth, BigDecimal>         subtotals,
                  int                                      totalRecords,
                  BigDecimal                               grandTotal) {
        this.buckets      = Collections.unmodifiableSortedMap(buckets);
        this.subtotals    = Collections.unmodifiableSortedMap(subtotals);
        this.totalRecords = totalRecords;
        this.grandTotal   = grandTotal;
    }

    public SortedMap<YearMonth, List<PricedRecord>> getBuckets() {
        return buckets;
    }

    public SortedMap<YearMonth, BigDecimal> getSubtotals() {
        return subtotals;
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    /** Sum of the per-month subtotals. */
    public BigDecimal getGrandTotal() {
        return grandTotal;
    }

    public boolean isEmpty() {
        return totalRecords == 0;
    }
}
