package com.milkledger.dto;

import com.milkledger.domain.MilkRecord;
import com.milkledger.domain.SupportedCurrency;
import com.milkledger.domain.User;
import com.milkledger.report.MonthlyReport;
import com.milkledger.security.TokenPair;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTOs for API endpoints.
 *
 * Property names are rendered snake_case by the global Jackson naming
 * strategy (spring.jackson.property-naming-strategy). Map keys are not
 * renamed, so month keys go out exactly as formatted here.
 */
public class ApiResponses {

    /** Day format used in every response body. */
    public static final DateTimeFormatter DATE_FORMAT  = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    /** Month key format; zero-padded so keys never mis-sort as "9-2025" after "10-2025". */
    public static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("MM-yyyy");

    public static String formatDate(LocalDate date) {
        return date.format(DATE_FORMAT);
    }

    public static String formatMonth(YearMonth month) {
        return month.format(MONTH_FORMAT);
    }

    /**
     * Public view of a user, embedded in auth responses.
     */
    public static class UserSummary {
        private final Long id;
        private final String email;
        private final String username;
        private final String currencySymbol;

        public UserSummary(User user) {
            this.id = user.getId();
            this.email = user.getEmail();
            this.username = user.getUsername();
            this.currencySymbol = user.getCurrencySymbol();
        }

        public Long getId() { return id; }
        public String getEmail() { return email; }
        public String getUsername() { return username; }
        public String getCurrencySymbol() { return currencySymbol; }
    }

    /**
     * Full profile returned by GET /auth/me.
     */
    public static class UserProfile {
        private final Long id;
        private final String email;
        private final String username;
        private final String currency;
        private final String currencySymbol;
        private final BigDecimal milkPricePerLitre;
        private final Instant createdAt;

        public UserProfile(User user) {
            this.id = user.getId();
            this.email = user.getEmail();
            this.username = user.getUsername();
            this.currency = user.getCurrency();
            this.currencySymbol = user.getCurrencySymbol();
            this.milkPricePerLitre = user.getMilkPricePerLitre();
            this.createdAt = user.getCreatedAt();
        }

        public Long getId() { return id; }
        public String getEmail() { return email; }
        public String getUsername() { return username; }
        public String getCurrency() { return currency; }
        public String getCurrencySymbol() { return currencySymbol; }
        public BigDecimal getMilkPricePerLitre() { return milkPricePerLitre; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Register / login response: a fresh token pair plus the user.
     */
    public static class AuthResponse {
        private final String message;
        private final String accessToken;
        private final String refreshToken;
        private final String tokenType = "Bearer";
        private final Instant accessExpiresAt;
        private final UserSummary user;

        public AuthResponse(String message, TokenPair pair, User user) {
            this.message = message;
            this.accessToken = pair.accessToken();
            this.refreshToken = pair.refreshToken();
            this.accessExpiresAt = pair.accessExpiresAt();
            this.user = new UserSummary(user);
        }

        public String getMessage() { return message; }
        public String getAccessToken() { return accessToken; }
        public String getRefreshToken() { return refreshToken; }
        public String getTokenType() { return tokenType; }
        public Instant getAccessExpiresAt() { return accessExpiresAt; }
        public UserSummary getUser() { return user; }
    }

    /**
     * Refresh response: the rotated pair.
     */
    public static class TokenResponse {
        private final String accessToken;
        private final String refreshToken;
        private final String tokenType = "Bearer";
        private final Instant accessExpiresAt;

        public TokenResponse(TokenPair pair) {
            this.accessToken = pair.accessToken();
            this.refreshToken = pair.refreshToken();
            this.accessExpiresAt = pair.accessExpiresAt();
        }

        public String getAccessToken() { return accessToken; }
        public String getRefreshToken() { return refreshToken; }
        public String getTokenType() { return tokenType; }
        public Instant getAccessExpiresAt() { return accessExpiresAt; }
    }

    public static class ProfileResponse {
        private final UserProfile user;

        public ProfileResponse(User user) {
            this.user = new UserProfile(user);
        }

        public UserProfile getUser() { return user; }
    }

    public static class MessageResponse {
        private final String message;

        public MessageResponse(String message) {
            this.message = message;
        }

        public String getMessage() { return message; }
    }

    /**
     * One priced milk record.
     */
    public static class RecordResponse {
        private final Long id;
        private final String date;
        private final BigDecimal milkQty;
        private final BigDecimal cost;

        public RecordResponse(MonthlyReport.PricedRecord priced) {
            this.id = priced.id();
            this.date = formatDate(priced.date());
            this.milkQty = priced.quantity();
            this.cost = priced.cost();
        }

        public RecordResponse(MilkRecord record, BigDecimal cost) {
            this.id = record.getId();
            this.date = formatDate(record.getDate());
            this.milkQty = record.getQuantity();
            this.cost = cost;
        }

        public Long getId() { return id; }
        public String getDate() { return date; }
        public BigDecimal getMilkQty() { return milkQty; }
        public BigDecimal getCost() { return cost; }
    }

    /**
     * Single-record envelope. {@code message} is omitted on plain reads.
     */
    public static class RecordEnvelope {
        private final String message;
        private final RecordResponse record;

        public RecordEnvelope(String message, RecordResponse record) {
            this.message = message;
            this.record = record;
        }

        public String getMessage() { return message; }
        public RecordResponse getRecord() { return record; }
    }

    /**
     * Month-grouped listing.
     *
     * Both maps are LinkedHashMaps filled from the report's sorted maps, so
     * the JSON object keys appear in chronological order.
     */
    public static class MonthlyRecordsResponse {
        private final Map<String, List<RecordResponse>> monthlyData;
        private final Map<String, BigDecimal> monthlyTotals;
        private final int totalRecords;
        private final BigDecimal totalCost;
        private final String currencySymbol;

        public MonthlyRecordsResponse(MonthlyReport report, String currencySymbol) {
            this.monthlyData = new LinkedHashMap<>();
            report.getBuckets().forEach((month, records) ->
                    monthlyData.put(formatMonth(month),
                            records.stream().map(RecordResponse::new).collect(Collectors.toList())));
            this.monthlyTotals = new LinkedHashMap<>();
            report.getSubtotals().forEach((month, subtotal) ->
                    monthlyTotals.put(formatMonth(month), subtotal));
            this.totalRecords = report.getTotalRecords();
            this.totalCost = report.getGrandTotal();
            this.currencySymbol = currencySymbol;
        }

        public Map<String, List<RecordResponse>> getMonthlyData() { return monthlyData; }
        public Map<String, BigDecimal> getMonthlyTotals() { return monthlyTotals; }
        public int getTotalRecords() { return totalRecords; }
        public BigDecimal getTotalCost() { return totalCost; }
        public String getCurrencySymbol() { return currencySymbol; }
    }

    public static class CurrencyOption {
        private final String code;
        private final String symbol;
        private final String name;

        public CurrencyOption(SupportedCurrency currency) {
            this.code = currency.name();
            this.symbol = currency.getSymbol();
            this.name = currency.getDisplayName();
        }

        public String getCode() { return code; }
        public String getSymbol() { return symbol; }
        public String getName() { return name; }
    }

    /**
     * Settings screen: the user's current values plus the currency catalogue.
     */
    public static class SettingsResponse {
        private final String message;
        private final Map<String, Object> settings;
        private final List<CurrencyOption> currencies;

        public SettingsResponse(String message, User user) {
            this.message = message;
            this.settings = new LinkedHashMap<>();
            settings.put("milk_price_per_litre", user.getMilkPricePerLitre());
            settings.put("currency", user.getCurrency());
            settings.put("currency_symbol", user.getCurrencySymbol());
            this.currencies = Arrays.stream(SupportedCurrency.values())
                    .map(CurrencyOption::new)
                    .collect(Collectors.toList());
        }

        public String getMessage() { return message; }
        public Map<String, Object> getSettings() { return settings; }
        public List<CurrencyOption> getCurrencies() { return currencies; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
