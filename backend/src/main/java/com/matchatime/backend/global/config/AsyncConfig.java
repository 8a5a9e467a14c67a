package com.matchatime.backend.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools kept apart from the servlet request threads.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    public static final String PASSWORD_HASH_EXECUTOR = "passwordHashExecutor";

    @Bean(PASSWORD_HASH_EXECUTOR)
    public ThreadPoolTaskExecutor passwordHashExecutor(AuthProperties authProperties) {
        int poolSize = Math.max(1, authProperties.hashPoolSize());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(poolSize);
        ex.setMaxPoolSize(poolSize);
        ex.setQueueCapacity(500);
        ex.setThreadNamePrefix("pw-hash-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
