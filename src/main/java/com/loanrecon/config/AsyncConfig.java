package com.loanrecon.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: intake-executor (fingerprinting and oracle calls), compliance-executor
 * (rule-parallel evaluation), reconciliation-executor (async run requests, one loan per thread).
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String INTAKE_EXECUTOR = "intake-executor";
    public static final String COMPLIANCE_EXECUTOR = "compliance-executor";
    public static final String RECONCILIATION_EXECUTOR = "reconciliation-executor";

    @Bean(name = INTAKE_EXECUTOR)
    public Executor intakeExecutor(@Value("${loanrecon.intake.concurrency:4}") int concurrency) {
        int size = Math.max(1, concurrency);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("intake-");
        e.initialize();
        return e;
    }

    @Bean(name = COMPLIANCE_EXECUTOR)
    public Executor complianceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("compliance-");
        e.initialize();
        return e;
    }

    /** Coordinator pool: each thread blocks on the intake barrier, so it stays separate from intake-executor. */
    @Bean(name = RECONCILIATION_EXECUTOR)
    public Executor reconciliationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }
}
