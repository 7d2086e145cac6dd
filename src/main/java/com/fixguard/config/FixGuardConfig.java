package com.fixguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fixguard.core.fix.EscalationPolicy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Shared infrastructure beans: the JSON mapper used for store values, REST payloads
 * and audit artifacts, the clock, the escalation policy and the learning-store executor.
 */
@Configuration
public class FixGuardConfig {

    @Value("${fixguard.learning.async.core-pool-size:1}")
    private int corePoolSize;

    @Value("${fixguard.learning.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${fixguard.learning.async.queue-capacity:500}")
    private int queueCapacity;

    /**
     * snake_case everywhere so stored records, REST payloads and the audit report
     * share one wire format.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EscalationPolicy escalationPolicy(OperatingModeResolver operatingModeResolver) {
        return operatingModeResolver.toEscalationPolicy();
    }

    @Bean("learningStoreExecutor")
    public Executor learningStoreExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("learning-store-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
