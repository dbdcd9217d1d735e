package com.tapas.drivertips.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Worker pool shared by batch items, the two bucket increments of a tip and the
 * two bucket reads of a query.
 */
@Configuration
public class TipsExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(TipsExecutorConfig.class);

    @Value("${tips.executor.core-pool-size:8}")
    private int corePoolSize;

    @Value("${tips.executor.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${tips.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = "tipsExecutor")
    public ThreadPoolTaskExecutor tipsExecutor() {
        log.info("Creating tips executor: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("tips-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
