package com.milkledger.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Partial settings update. Absent fields are left unchanged.
 */
public class SettingsRequest {

    @DecimalMin(value = "0.0", message = "Milk price per litre must not be negative")
    @Digits(integer = 10, fraction = 2, message = "Milk price allows at most 2 decimal places")
    private BigDecimal milkPricePerLitre;

    @Size(min = 3, max = 10, message = "Currency must be 3-10 characters (e.g., INR, USD)")
    private String currency;

    @Size(min = 1, max = 5, message = "Currency symbol must be 1-5 characters")
    private String currencySymbol;

    public SettingsRequest() {
    }

    public SettingsRequest(BigDecimal milkPricePerLitre, String currency, String currencySymbol) {
        this.milkPricePerLitre = milkPricePerLitre;
        this.currency = currency;
        this.currencySymbol = currencySymbol;
    }

    public BigDecimal getMilkPricePerLitre() {
        return milkPricePerLitre;
    }

    public void setMilkPricePerLitre(BigDecimal milkPricePerLitre) {
        this.milkPricePerLitre = milkPricePerLitre;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getCurrencySymbol() {
        return currencySymbol;
    }

    public void setCurrencySymbol(String currencySymbol) {
        this.currencySymbol = currencySymbol;
    }
}
