package com.myscrollr.delivery.lifecycle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myscrollr.delivery.model.domain.UserChannel;
import com.myscrollr.delivery.repository.UserChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates channel CRUD events into subscriber set lifecycle operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelLifecycleService {

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    private final SubscriberSetLifecycleManager lifecycleManager;
    private final UserChannelRepository userChannelRepository;
    private final ObjectMapper objectMapper;

    /**
     * A channel's subscription-relevant state at one point in time.
     */
    public record ChannelState(boolean enabled, Map<String, Object> config) {
    }

    public LifecycleResult onChannelCreated(String userId, String channelType, Map<String, Object> config) {
        Optional<ChannelSubscriptionKeys.Keys> keys = ChannelSubscriptionKeys.forChannel(channelType, config);
        if (keys.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        return lifecycleManager.onSubscribe(userId, keys.get().namespace(), keys.get().keys());
    }

    /**
     * A disabled channel contributes no keys, so disabling removes the user from its sets
     * and enabling adds them back. Config edits apply only the key delta.
     */
    public LifecycleResult onChannelUpdated(String userId, String channelType, ChannelState before, ChannelState after) {
        Optional<ChannelSubscriptionKeys.Keys> oldKeys = activeKeys(channelType, before);
        Optional<ChannelSubscriptionKeys.Keys> newKeys = activeKeys(channelType, after);
        if (oldKeys.isEmpty() && newKeys.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        String namespace = oldKeys.or(() -> newKeys).map(ChannelSubscriptionKeys.Keys::namespace).orElseThrow();
        return lifecycleManager.onConfigChanged(userId, namespace,
                oldKeys.map(ChannelSubscriptionKeys.Keys::keys).orElse(List.of()),
                newKeys.map(ChannelSubscriptionKeys.Keys::keys).orElse(List.of()));
    }

    public LifecycleResult onChannelDeleted(String userId, String channelType, Map<String, Object> config) {
        Optional<ChannelSubscriptionKeys.Keys> keys = ChannelSubscriptionKeys.forChannel(channelType, config);
        if (keys.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        return lifecycleManager.onUnsubscribe(userId, keys.get().namespace(), keys.get().keys());
    }

    public LifecycleResult onSyncSubscriptions(String userId, String channelType, Map<String, Object> config,
                                               boolean enabled) {
        if (!enabled) {
            return LifecycleResult.NOTHING;
        }
        Optional<ChannelSubscriptionKeys.Keys> keys = ChannelSubscriptionKeys.forChannel(channelType, config);
        if (keys.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        return lifecycleManager.reconcile(userId, keys.get().namespace(), keys.get().keys());
    }

    /**
     * Re-adds one user to the sets implied by all of their stored channels.
     */
    @Transactional(readOnly = true)
    public LifecycleResult reconcileUser(String userId) {
        LifecycleResult result = LifecycleResult.NOTHING;
        for (UserChannel channel : userChannelRepository.findByUserId(userId)) {
            result = result.merge(syncChannel(channel));
        }
        log.info("[SUBSCRIBERS] Reconciled user '{}': {} keys applied, {} failed",
                userId, result.applied(), result.failedKeys().size());
        return result;
    }

    LifecycleResult syncChannel(UserChannel channel) {
        return onSyncSubscriptions(channel.getUserId(), channel.getChannelType(),
                parseConfig(channel.getConfig()), channel.isEnabled());
    }

    Map<String, Object> parseConfig(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, CONFIG_TYPE);
        } catch (Exception e) {
            log.warn("[SUBSCRIBERS] Ignoring unreadable channel config: {}", e.getMessage());
            return Map.of();
        }
    }

    private static Optional<ChannelSubscriptionKeys.Keys> activeKeys(String channelType, ChannelState state) {
        if (state == null || !state.enabled()) {
            return ChannelSubscriptionKeys.forChannel(channelType, Map.of())
                    .map(keys -> new ChannelSubscriptionKeys.Keys(keys.namespace(), List.of()));
        }
        return ChannelSubscriptionKeys.forChannel(channelType, state.config());
    }
}
