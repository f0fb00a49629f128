package com.ledgerradar.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caffeine in-process caches backing the per-account statement-chain locks and the cancelled-job registry.
 */
@Configuration
public class CaffeineConfig {

    public static final String ACCOUNT_LOCK_CACHE = "accountLockCache";
    public static final String CANCELLED_JOB_CACHE = "cancelledJobCache";

    /** Weak values: a lock lives as long as some thread holds a reference to it. */
    @Bean(name = ACCOUNT_LOCK_CACHE)
    public Cache<String, ReentrantLock> accountLockCache() {
        return Caffeine.newBuilder()
                .weakValues()
                .build();
    }

    @Bean(name = CANCELLED_JOB_CACHE)
    public Cache<String, Instant> cancelledJobCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(6, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build();
    }
}
