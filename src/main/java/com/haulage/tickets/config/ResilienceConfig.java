package com.haulage.tickets.config;

import com.haulage.tickets.exception.MalformedSourceException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the Resilience4j circuit breaker around the extraction
 * layer ({@code extractionService}).
 * <p>
 * States:
 * - CLOSED: Normal operation, extractions pass through
 * - OPEN: Extraction engine is failing, calls fail fast as transient errors
 * - HALF_OPEN: Testing if the engine has recovered
 * <p>
 * A malformed source file says nothing about the engine's health and is not
 * recorded as a failure.
 */
@Configuration
public class ResilienceConfig {

    @Value("${tickets.extraction.circuit-breaker.sliding-window-size:10}")
    private int slidingWindowSize;

    @Value("${tickets.extraction.circuit-breaker.minimum-calls:10}")
    private int minimumNumberOfCalls;

    @Value("${tickets.extraction.circuit-breaker.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${tickets.extraction.circuit-breaker.wait-seconds:30}")
    private long waitSecondsInOpenState;

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumNumberOfCalls)
                .failureRateThreshold(failureRateThreshold)
                // Time to wait before transitioning from OPEN to HALF_OPEN
                .waitDurationInOpenState(Duration.ofSeconds(waitSecondsInOpenState))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .ignoreExceptions(MalformedSourceException.class)
                .build();

        return CircuitBreakerRegistry.of(config);
    }
}
