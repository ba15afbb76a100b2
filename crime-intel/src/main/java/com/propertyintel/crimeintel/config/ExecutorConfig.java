package com.propertyintel.crimeintel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool shared by the detection and linkage fan-out.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(CrimeIntelProperties properties) {
        CrimeIntelProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
