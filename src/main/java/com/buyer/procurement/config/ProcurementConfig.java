package com.buyer.procurement.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ProcurementConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** Runs the four strategy evaluations of one scenario comparison side by side. */
    @Bean(name = "scenarioExecutor")
    public ThreadPoolTaskExecutor scenarioExecutor(@Value("${procurement.scenario-pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("scenario-");
        executor.initialize();
        return executor;
    }
}
