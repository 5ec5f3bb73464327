package com.milkledger.service;

import com.milkledger.domain.SupportedCurrency;
import com.milkledger.domain.User;
import com.milkledger.exception.UnauthorizedException;
import com.milkledger.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Service for user accounts and their pricing settings.
 *
 * Password hashing uses BCryptPasswordEncoder (cost factor 12).
 * Plaintext passwords are never stored or logged.
 *
 * Emails are trimmed and lower-cased before every lookup or insert.
 */
@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final String BAD_CREDENTIALS = "Invalid email or password";

    private final UserRepository  userRepository;
    private final PasswordEncoder passwordEncoder;
    private final BigDecimal      defaultPrice;
    private final String          defaultCurrency;
    private final String          defaultCurrencySymbol;

    public UserService(UserRepository  userRepository,
                       PasswordEncoder passwordEncoder,
                       @Value("${milkledger.defaults.price-per-litre:50.00}") BigDecimal defaultPrice,
                       @Value("${milkledger.defaults.currency:INR}")          String     defaultCurrency,
                       @Value("${milkledger.defaults.currency-symbol:₹}")     String     defaultCurrencySymbol) {
        this.userRepository        = userRepository;
        this.passwordEncoder       = passwordEncoder;
        this.defaultPrice          = defaultPrice;
        this.defaultCurrency       = defaultCurrency;
        this.defaultCurrencySymbol = defaultCurrencySymbol;
    }

    /**
     * Register a new user with a BCrypt-hashed password and default settings.
     *
     * @param email         user's email (must be unique, compared case-insensitively)
     * @param username      display name; the email's local part is used when blank
     * @param plainPassword plaintext password, hashed immediately and never stored
     * @return created user
     * @throws IllegalStateException if the email is already registered
     */
    public User register(String email, String username, String plainPassword) {
        String normalized = normalizeEmail(email);
        log.info("=== USER REGISTRATION START === email={}", normalized);

        if (userRepository.existsByEmail(normalized)) {
            log.warn("✗ Email already registered - email={}", normalized);
            throw new IllegalStateException("Email already registered: " + normalized);
        }

        String displayName = (username == null || username.isBlank())
                ? localPart(normalized)
                : username.strip();

        log.debug("Hashing password with BCrypt (cost=12)");
        String hash = passwordEncoder.encode(plainPassword);

        // a concurrent duplicate that slipped past existsByEmail fails here on the unique index
        User user = userRepository.saveAndFlush(new User(
                normalized,
                displayName,
                hash,
                defaultPrice,
                defaultCurrency,
                defaultCurrencySymbol));

        log.info("=== USER REGISTRATION SUCCESS === userId={}, email={}", user.getId(), normalized);
        return user;
    }

    /**
     * Check credentials.
     *
     * Unknown email and wrong password fail with the same message so callers
     * cannot probe which addresses are registered.
     *
     * @throws UnauthorizedException if the email is unknown or the password does not match
     * @throws SecurityException     if the account's email has not been verified
     */
    @Transactional(readOnly = true)
    public User authenticate(String email, String plainPassword) {
        String normalized = normalizeEmail(email);
        log.info("Login attempt: email={}", normalized);

        User user = userRepository.findByEmail(normalized)
                .orElseThrow(() -> {
                    log.warn("Login failed: user not found - email={}", normalized);
                    return new UnauthorizedException(BAD_CREDENTIALS);
                });

        if (!passwordEncoder.matches(plainPassword, user.getPasswordHash())) {
            log.warn("Login failed: password mismatch - userId={}", user.getId());
            throw new UnauthorizedException(BAD_CREDENTIALS);
        }

        if (!user.isEmailVerified()) {
            log.warn("Login failed: email not verified - userId={}", user.getId());
            throw new SecurityException("Please verify your email before logging in");
        }

        log.info("✓ Credentials valid - userId={}", user.getId());
        return user;
    }

    /**
     * @throws NoSuchElementException if no user has this id
     */
    @Transactional(readOnly = true)
    public User getById(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NoSuchElementException("User not found: " + userId));
    }

    /**
     * Partial update of pricing settings. Null arguments leave the current value.
     *
     * When only the currency code changes and it is a supported currency, the
     * symbol follows the code. Since record costs are never stored, the next
     * report re-prices every record at the new price.
     *
     * @throws IllegalArgumentException if the price is negative or the currency is blank
     * @throws NoSuchElementException   if no user has this id
     */
    public User updateSettings(Long userId, BigDecimal pricePerLitre, String currency, String currencySymbol) {
        User user = getById(userId);

        if (pricePerLitre != null) {
            log.info("Price change - userId={}, from={}, to={}", userId, user.getMilkPricePerLitre(), pricePerLitre);
            user.changePrice(pricePerLitre);
        }

        if (currency != null || currencySymbol != null) {
            String code = currency != null ? currency.strip().toUpperCase(Locale.ROOT) : user.getCurrency();
            String symbol = currencySymbol;
            if (symbol == null) {
                symbol = currency != null
                        ? SupportedCurrency.fromCode(code).map(SupportedCurrency::getSymbol).orElse(user.getCurrencySymbol())
                        : user.getCurrencySymbol();
            }
            user.changeCurrency(code, symbol.strip());
            log.info("Currency change - userId={}, currency={}, symbol={}", userId, code, symbol);
        }

        return userRepository.save(user);
    }

    private static String localPart(String email) {
        int at = email.indexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
