package com.milkledger.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Currencies offered on the settings screen.
 * Amounts are never converted; the code and symbol are labels only.
 */
public enum SupportedCurrency {
    INR("₹", "Indian Rupee"),
    USD("$", "US Dollar"),
    EUR("€", "Euro"),
    GBP("£", "British Pound"),
    JPY("¥", "Japanese Yen"),
    AUD("A$", "Australian Dollar"),
    CAD("C$", "Canadian Dollar"),
    CHF("Fr", "Swiss Franc"),
    CNY("¥", "Chinese Yuan"),
    AED("د.إ", "UAE Dirham");

    private final String symbol;
    private final String displayName;

    SupportedCurrency(String symbol, String displayName) {
        this.symbol = symbol;
        this.displayName = displayName;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Case-insensitive lookup by ISO code. */
    public static Optional<SupportedCurrency> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(code.strip()))
                .findFirst();
    }
}
