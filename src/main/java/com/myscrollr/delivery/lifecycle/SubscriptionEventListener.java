package com.myscrollr.delivery.lifecycle;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myscrollr.delivery.model.dto.SubscriptionChangeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Applies subscription lifecycle commands published by the channel CRUD side.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionEventListener {

    private final SubscriberSetLifecycleManager lifecycleManager;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${app.kafka.topics.subscription-changes}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "subscriptionListenerContainerFactory")
    public void consume(String payload) {
        SubscriptionChangeEvent event = parse(payload);
        log.info("[SUBSCRIBERS] Received {} for user '{}' in '{}'",
                event.getType(), event.getUserId(), event.getNamespace());
        apply(event);
    }

    LifecycleResult apply(SubscriptionChangeEvent event) {
        if (event.getType() == null || event.getUserId() == null || event.getNamespace() == null) {
            log.warn("[SUBSCRIBERS] Ignoring unknown or incomplete subscription event: {}", event);
            return LifecycleResult.NOTHING;
        }
        return switch (event.getType()) {
            case SUBSCRIBE -> lifecycleManager.onSubscribe(event.getUserId(), event.getNamespace(), event.getKeys());
            case UNSUBSCRIBE -> lifecycleManager.onUnsubscribe(event.getUserId(), event.getNamespace(), event.getKeys());
            case CONFIG_CHANGED -> lifecycleManager.onConfigChanged(event.getUserId(), event.getNamespace(),
                    event.getOldKeys(), event.getNewKeys());
            case RECONCILE -> lifecycleManager.reconcile(event.getUserId(), event.getNamespace(), event.getKeys());
        };
    }

    private SubscriptionChangeEvent parse(String payload) {
        try {
            return objectMapper.readerFor(SubscriptionChangeEvent.class)
                    .with(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
                    .readValue(payload);
        } catch (Exception e) {
            throw new IllegalArgumentException("Malformed subscription event: " + e.getMessage(), e);
        }
    }
}
