package com.ledgerradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerRadarApplication.class, args);
    }
}
