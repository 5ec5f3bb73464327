package com.milkledger.config;

import com.milkledger.security.TokenCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the clock and the token codec.
 *
 * Both are plain objects so tests can build their own with a fixed clock
 * or a different key, without a Spring context.
 */
@Configuration
public class TokenConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(@Value("${milkledger.jwt.secret}") String secret, Clock clock) {
        return new TokenCodec(secret, clock);
    }
}
