package com.milkledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * DTO for creating or editing a milk record.
 *
 * JSON: {@code {"milk_qty": 1.5, "date": "2025-01-10"}}. Dates are ISO.
 *
 * Both fields are optional at this level. On create, the controller insists
 * on milk_qty and a missing date means today; on update, a missing field
 * keeps its current value.
 */
public class MilkRecordRequest {

    @DecimalMin(value = "0.0", message = "Milk quantity must not be negative")
    @Digits(integer = 9, fraction = 3, message = "Milk quantity allows at most 3 decimal places")
    private BigDecimal milkQty;

    private LocalDate date;

    public MilkRecordRequest() {
    }

    public MilkRecordRequest(BigDecimal milkQty, LocalDate date) {
        this.milkQty = milkQty;
        this.date = date;
    }

    public BigDecimal getMilkQty() {
        return milkQty;
    }

    public void setMilkQty(BigDecimal milkQty) {
        this.milkQty = milkQty;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }
}
