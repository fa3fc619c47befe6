package com.myscrollr.delivery.store;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisSubscriberSetStore Tests")
class RedisSubscriberSetStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private SetOperations<String, String> setOperations;

    private SimpleMeterRegistry meterRegistry;
    private RedisSubscriberSetStore store;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new RedisSubscriberSetStore(redisTemplate, CircuitBreakerRegistry.ofDefaults(), meterRegistry);
    }

    @Test
    @DisplayName("Should add and remove members under the namespaced key")
    void shouldUseNamespacedKeys() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);

        store.addMember("rss:subscribers", "https://example.com/feed.xml", "user-1");
        store.removeMember("stream:subscribers", "finance", "user-2");

        verify(setOperations).add("rss:subscribers:https://example.com/feed.xml", "user-1");
        verify(setOperations).remove("stream:subscribers:finance", "user-2");
    }

    @Test
    @DisplayName("Should return an empty set when the key does not exist")
    void shouldHandleMissingKey() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("stream:subscribers:sports")).thenReturn(null);

        assertThat(store.members("stream:subscribers", "sports")).isEmpty();
    }

    @Test
    @DisplayName("Should return the members of a set")
    void shouldReturnMembers() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("stream:subscribers:sports")).thenReturn(Set.of("a", "b"));

        assertThat(store.members("stream:subscribers", "sports")).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @DisplayName("Should wrap Redis failures and count them")
    void shouldWrapFailures() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.add("stream:subscribers:finance", "user-1"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.addMember("stream:subscribers", "finance", "user-1"))
                .isInstanceOf(SubscriberStoreException.class)
                .hasMessageContaining("SADD stream:subscribers:finance")
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
        assertThat(meterRegistry.counter("subscriber.store.failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail fast while the circuit is open")
    void shouldFailFastWhenOpen() {
        store.getCircuitBreaker().transitionToOpenState();

        assertThatThrownBy(() -> store.members("stream:subscribers", "finance"))
                .isInstanceOf(SubscriberStoreException.class);
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Should reject blank routing keys before touching Redis")
    void shouldRejectBlankKeys() {
        assertThatThrownBy(() -> store.addMember("rss:subscribers", " ", "user-1"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(redisTemplate);
    }
}
