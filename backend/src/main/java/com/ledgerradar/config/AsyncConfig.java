package com.ledgerradar.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: import-job-executor (job worker loops), page-executor (per-page extraction),
 * reconcile-executor (reconciliation after ingestion).
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String IMPORT_JOB_EXECUTOR = "import-job-executor";
    public static final String PAGE_EXECUTOR = "page-executor";
    public static final String RECONCILE_EXECUTOR = "reconcile-executor";

    /** Each worker loop holds a thread for its lifetime; sized to ledgerradar.jobs.worker-threads. */
    @Bean(name = IMPORT_JOB_EXECUTOR)
    public Executor importJobExecutor(@Value("${ledgerradar.jobs.worker-threads:5}") int workerThreads) {
        int size = Math.max(1, workerThreads);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("import-job-");
        e.initialize();
        return e;
    }

    @Bean(name = PAGE_EXECUTOR)
    public Executor pageExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(16);
        e.setThreadNamePrefix("page-");
        e.initialize();
        return e;
    }

    @Bean(name = RECONCILE_EXECUTOR)
    public Executor reconcileExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }
}
