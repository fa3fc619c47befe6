package com.myscrollr.delivery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param heartbeatInterval interval between comment frames on idle streams
 * @param retryIntervalMs   reconnect hint sent to clients when a stream opens
 * @param emitterTimeout    lifetime of a single stream before the client must reconnect; zero means no timeout
 */
@ConfigurationProperties(prefix = "app.delivery")
public record DeliveryProperties(Duration heartbeatInterval, long retryIntervalMs, Duration emitterTimeout) {

    public DeliveryProperties {
        heartbeatInterval = heartbeatInterval == null ? Duration.ofSeconds(15) : heartbeatInterval;
        retryIntervalMs = retryIntervalMs <= 0 ? 3000L : retryIntervalMs;
        emitterTimeout = emitterTimeout == null ? Duration.ZERO : emitterTimeout;
    }
}
