package com.milkledger.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * User entity: the identity that owns milk records and refresh tokens.
 *
 * Design decisions:
 * - No Lombok to keep behavior explicit and visible
 * - Email stored lower-cased, so the unique index is effectively case-insensitive
 * - Password stored as hash only (never plaintext)
 * - refreshToken holds the single live refresh token; null means "no session".
 *   It is written through UserRepository's conditional updates, never through
 *   a setter, so rotation stays atomic.
 * - Price and currency are user settings; record costs are derived from the
 *   current price at read time
 */
@Entity
@Table(
    name = "users",
    indexes = {
        @Index(name = "idx_users_email", columnList = "email", unique = true)
    }
)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 120)
    private String email;

    @Column(length = 80)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "milk_price_per_litre", nullable = false, precision = 12, scale = 2)
    private BigDecimal milkPricePerLitre;

    @Column(nullable = false, length = 10)
    private String currency;

    @Column(name = "currency_symbol", nullable = false, length = 5)
    private String currencySymbol;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "refresh_token", length = 512)
    private String refreshToken;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * JPA requires a no-arg constructor.
     */
    protected User() {
    }

    /**
     * Constructor for creating a new user with default settings.
     *
     * @param email          normalized (lower-case) email
     * @param username       display name, may be null
     * @param passwordHash   bcrypt hash
     * @param pricePerLitre  initial unit price
     * @param currency       ISO currency code
     * @param currencySymbol symbol shown next to amounts
     */
    public User(String email, String username, String passwordHash,
                BigDecimal pricePerLitre, String currency, String currencySymbol) {
        this.email = email;
        this.username = username;
        this.passwordHash = passwordHash;
        this.milkPricePerLitre = pricePerLitre;
        this.currency = currency;
        this.currencySymbol = currencySymbol;
        this.emailVerified = true;
        this.createdAt = Instant.now();
    }

    // Getters
    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public BigDecimal getMilkPricePerLitre() {
        return milkPricePerLitre;
    }

    public String getCurrency() {
        return currency;
    }

    public String getCurrencySymbol() {
        return currencySymbol;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // Business methods (controlled mutations)

    /**
     * Change the unit price used for every future cost computation.
     *
     * @throws IllegalArgumentException if price is null or negative
     */
    public void changePrice(BigDecimal pricePerLitre) {
        if (pricePerLitre == null || pricePerLitre.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException(
                "Milk price per litre must be zero or greater. Got: " + pricePerLitre);
        }
        this.milkPricePerLitre = pricePerLitre;
    }

    public void changeCurrency(String currency, String currencySymbol) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency must not be blank");
        }
        if (currencySymbol == null || currencySymbol.isBlank()) {
            throw new IllegalArgumentException("Currency symbol must not be blank");
        }
        this.currency = currency;
        this.currencySymbol = currencySymbol;
    }

    /**
     * Flag the address as unconfirmed. Unverified accounts cannot log in.
     */
    public void markEmailUnverified() {
        this.emailVerified = false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        return Objects.equals(email, user.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email);
    }

    @Override
    public String toString() {
        return "User{" +
                "id=" + id +
                ", email='" + email + '\'' +
                ", username='" + username + '\'' +
                ", currency=" + currency +
                ", createdAt=" + createdAt +
                '}';
    }
}
