package com.loanrecon.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.INTAKE_EXECUTOR)
    Executor intakeExecutor;

    @Autowired
    @Qualifier(AsyncConfig.COMPLIANCE_EXECUTOR)
    Executor complianceExecutor;

    @Autowired
    @Qualifier(AsyncConfig.RECONCILIATION_EXECUTOR)
    Executor reconciliationExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("rule catalog cache is created and usable")
    void ruleCatalogCache() {
        assertThat(cacheManager.getCache(CaffeineConfig.RULE_CATALOG_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.RULE_CATALOG_CACHE).put("active", "rules");
        assertThat(cacheManager.getCache(CaffeineConfig.RULE_CATALOG_CACHE).get("active").get()).isEqualTo("rules");
    }

    @Test
    @DisplayName("named executors are created with their pool sizes")
    void executorsCreated() {
        assertThat(intakeExecutor).isInstanceOfSatisfying(ThreadPoolTaskExecutor.class, e -> {
            assertThat(e.getCorePoolSize()).isEqualTo(4);
            assertThat(e.getMaxPoolSize()).isEqualTo(4);
            assertThat(e.getThreadNamePrefix()).isEqualTo("intake-");
        });
        assertThat(complianceExecutor).isInstanceOfSatisfying(ThreadPoolTaskExecutor.class,
                e -> assertThat(e.getMaxPoolSize()).isEqualTo(4));
        assertThat(reconciliationExecutor).isInstanceOfSatisfying(ThreadPoolTaskExecutor.class,
                e -> assertThat(e.getCorePoolSize()).isEqualTo(2));
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(1);
    }
}
