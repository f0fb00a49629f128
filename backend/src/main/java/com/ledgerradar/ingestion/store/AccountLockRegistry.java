package com.ledgerradar.ingestion.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.ledgerradar.config.CaffeineConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes statement-chain writes per account. Jobs for different accounts never contend.
 */
@Component
public class AccountLockRegistry {

    private final Cache<String, ReentrantLock> locks;

    public AccountLockRegistry(@Qualifier(CaffeineConfig.ACCOUNT_LOCK_CACHE) Cache<String, ReentrantLock> locks) {
        this.locks = locks;
    }

    public <T> T withAccountLock(String accountId, Supplier<T> action) {
        ReentrantLock lock = locks.get(accountId, k -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
