package com.milkledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for MilkLedger: daily milk deliveries, monthly
 * cost totals, and JWT access/refresh authentication for API clients.
 */
@SpringBootApplication
@EnableTransactionManagement
public class MilkLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MilkLedgerApplication.class, args);
    }

}
