package com.soulsense.backend.modules.audit.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for audit writes deferred past the caller's transaction. One writer thread keeps
 * entries in submission order and holds at most one pool connection.
 */
@Configuration
public class AuditConfig {

    public static final String AUDIT_EXECUTOR = "auditTaskExecutor";

    @Bean(name = AUDIT_EXECUTOR)
    public Executor auditTaskExecutor(
            @Value("${soulsense.audit.async:true}") boolean async,
            @Value("${soulsense.audit.queue-capacity:1000}") int queueCapacity
    ) {
        if (!async) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("audit-");
        // a full queue is logged and the entry dropped; the write never runs on a request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
