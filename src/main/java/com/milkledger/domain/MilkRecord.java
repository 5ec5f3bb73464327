package com.milkledger.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One milk delivery: a dated quantity owned by exactly one user.
 *
 * Cost is not stored. It is derived as quantity x the owner's
 * current price whenever a report is computed, so a price change re-prices
 * every historical record.
 *
 * Several records may share the same date for one user.
 */
@Entity
@Table(
    name = "milk_records",
    indexes = {
        @Index(name = "idx_milk_user_id", columnList = "user_id"),
        @Index(name = "idx_milk_user_date", columnList = "user_id,record_date")
    }
)
public class MilkRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "record_date", nullable = false)
    private LocalDate date;

    /**
     * Litres delivered. Never negative.
     */
    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal quantity;

    protected MilkRecord() {
    }

    /**
     * @param userId   owning user (must not be null)
     * @param date     delivery day (must not be null)
     * @param quantity litres (must not be null or negative)
     */
    public MilkRecord(Long userId, LocalDate date, BigDecimal quantity) {
        if (userId == null) {
            throw new IllegalArgumentException("Owner cannot be null");
        }
        this.userId = userId;
        changeDate(date);
        changeQuantity(quantity);
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public LocalDate getDate() {
        return date;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public void changeDate(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
        this.date = date;
    }

    public void changeQuantity(BigDecimal quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("Milk quantity is required");
        }
        if (quantity.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Milk quantity must not be negative. Got: " + quantity);
        }
        this.quantity = quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MilkRecord that = (MilkRecord) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "MilkRecord{" +
                "id=" + id +
                ", userId=" + userId +
                ", date=" + date +
                ", quantity=" + quantity +
                '}';
    }
}
