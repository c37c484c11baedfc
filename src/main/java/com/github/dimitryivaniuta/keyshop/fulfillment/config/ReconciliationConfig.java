package com.github.dimitryivaniuta.keyshop.fulfillment.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for remote credential checks.
 *
 * <p>The pool size is the reconciliation fan-out, i.e. the most panel calls a pass has in flight. The queue is
 * unbounded: a pass submits one page of credentials at a time.</p>
 */
@Slf4j
@Configuration
public class ReconciliationConfig {

    public static final String RECONCILIATION_EXECUTOR = "reconciliationExecutor";

    @Bean(name = RECONCILIATION_EXECUTOR)
    public ThreadPoolTaskExecutor reconciliationExecutor(AppProperties properties) {
        int fanOut = Math.max(1, properties.getReconciliation().getFanOut());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fanOut);
        executor.setMaxPoolSize(fanOut);
        executor.setThreadNamePrefix("reconcile-");
        executor.setDaemon(true);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        // checks are read-only and repeated on the next pass
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Reconciliation executor configured fanOut={}", fanOut);
        return executor;
    }
}
