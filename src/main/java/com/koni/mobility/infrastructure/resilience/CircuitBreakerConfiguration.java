package com.koni.mobility.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker guarding event publication to Kafka.
 *
 * Configuration:
 * - Count-based sliding window of 10 calls, opening at a 50% failure rate
 * - 30 seconds in OPEN, then 2 trial calls in HALF_OPEN
 */
@Configuration
public class CircuitBreakerConfiguration {

    /**
     * Creates the CircuitBreakerConfig shared by every breaker in the registry.
     * At least 4 calls are recorded before the failure rate is evaluated, so a
     * single failed publish after startup does not open the circuit.
     *
     * @return CircuitBreakerConfig with the settings listed on the class
     */
    @Bean
    public CircuitBreakerConfig kafkaCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(4)
                .failureRateThreshold(50.0f)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(2)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();
    }

    /**
     * Creates the CircuitBreakerRegistry with the custom configuration.
     *
     * @param config the circuit breaker configuration
     * @return CircuitBreakerRegistry instance
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Creates the circuit breaker named "kafka", used by ResilientKafkaEventPublisher.
     *
     * @param registry the circuit breaker registry
     * @return CircuitBreaker instance for Kafka publishing
     */
    @Bean
    public CircuitBreaker kafkaCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("kafka");
    }
}
