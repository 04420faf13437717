package com.nectarstudio.realtime.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers guarding source queries, one per table.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${app.resilience.source.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.resilience.source.sliding-window-size:10}") int slidingWindowSize,
            @Value("${app.resilience.source.wait-in-open-state:30s}") Duration waitInOpenState) {
        log.info("🛡️ Source circuit breakers: failure rate {}%, window {}, open for {}",
                failureRateThreshold, slidingWindowSize, waitInOpenState);
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(Math.min(slidingWindowSize, 5))
                .waitDurationInOpenState(waitInOpenState)
                .permittedNumberOfCallsInHalfOpenState(2)
                .build();
        return CircuitBreakerRegistry.of(config);
    }
}
