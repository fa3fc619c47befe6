package com.myscrollr.delivery.store;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed subscriber sets using SADD / SREM / SMEMBERS.
 *
 * Calls go through a circuit breaker so a Redis outage fails fast instead of
 * stalling every webhook request on connection timeouts.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisSubscriberSetStore implements SubscriberSetStore {

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Counter failureCounter;

    public RedisSubscriberSetStore(StringRedisTemplate redisTemplate,
                                   CircuitBreakerRegistry cbRegistry,
                                   MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(20)
                .build();
        this.circuitBreaker = cbRegistry.circuitBreaker("subscriberStore", cbConfig);
        this.failureCounter = meterRegistry.counter("subscriber.store.failures");
    }

    @Override
    public void addMember(String namespace, String routingKey, String userId) {
        String key = SubscriberSetKeys.of(namespace, routingKey);
        execute("SADD " + key, () -> redisTemplate.opsForSet().add(key, userId));
    }

    @Override
    public void removeMember(String namespace, String routingKey, String userId) {
        String key = SubscriberSetKeys.of(namespace, routingKey);
        execute("SREM " + key, () -> redisTemplate.opsForSet().remove(key, userId));
    }

    @Override
    public Set<String> members(String namespace, String routingKey) {
        String key = SubscriberSetKeys.of(namespace, routingKey);
        Set<String> members = execute("SMEMBERS " + key, () -> redisTemplate.opsForSet().members(key));
        return members == null ? Set.of() : Set.copyOf(members);
    }

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (Exception ex) {
            failureCounter.increment();
            log.debug("[SUBSCRIBERS] Redis operation failed: {}", operation, ex);
            throw new SubscriberStoreException("Subscriber store operation failed: " + operation, ex);
        }
    }
}
