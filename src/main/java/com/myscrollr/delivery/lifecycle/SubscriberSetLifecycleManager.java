package com.myscrollr.delivery.lifecycle;

import com.myscrollr.delivery.store.SubscriberSetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the subscriber sets consistent with users' subscription actions.
 *
 * Every operation is a sequence of single-key set-add / set-remove calls, so repeating
 * an operation is harmless. A failure on one key is logged and skipped; the other keys
 * are still applied. The authoritative subscriptions live in the channel configuration,
 * so a skipped key is a missed real-time update, not lost data, and the next reconcile
 * repairs it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriberSetLifecycleManager {

    private final SubscriberSetStore store;

    public LifecycleResult onSubscribe(String userId, String namespace, Collection<String> keys) {
        Set<String> toAdd = normalize(keys);
        if (toAdd.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        LifecycleResult result = addAll(userId, namespace, toAdd);
        log.info("[SUBSCRIBERS] Subscribed user '{}' to {} keys in '{}' ({} failed)",
                userId, result.applied(), namespace, result.failedKeys().size());
        return result;
    }

    public LifecycleResult onUnsubscribe(String userId, String namespace, Collection<String> keys) {
        Set<String> toRemove = normalize(keys);
        if (toRemove.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        LifecycleResult result = removeAll(userId, namespace, toRemove);
        log.info("[SUBSCRIBERS] Unsubscribed user '{}' from {} keys in '{}' ({} failed)",
                userId, result.applied(), namespace, result.failedKeys().size());
        return result;
    }

    /**
     * Applies only the difference between the old and new key sets. Keys present in both
     * are never touched, so the user stays subscribed to them throughout. Additions go
     * first so a change never passes through a state with fewer subscriptions than needed.
     */
    public LifecycleResult onConfigChanged(String userId, String namespace,
                                           Collection<String> oldKeys, Collection<String> newKeys) {
        Set<String> oldSet = normalize(oldKeys);
        Set<String> newSet = normalize(newKeys);

        Set<String> toAdd = new LinkedHashSet<>(newSet);
        toAdd.removeAll(oldSet);
        Set<String> toRemove = new LinkedHashSet<>(oldSet);
        toRemove.removeAll(newSet);

        if (toAdd.isEmpty() && toRemove.isEmpty()) {
            log.debug("[SUBSCRIBERS] Config change for user '{}' in '{}' has no key delta", userId, namespace);
            return LifecycleResult.NOTHING;
        }

        LifecycleResult result = addAll(userId, namespace, toAdd).merge(removeAll(userId, namespace, toRemove));
        log.info("[SUBSCRIBERS] Config change for user '{}' in '{}': +{} -{} ({} failed)",
                userId, namespace, toAdd.size(), toRemove.size(), result.failedKeys().size());
        return result;
    }

    /**
     * Adds the user to every authoritative key. Keys outside the given set are left alone.
     */
    public LifecycleResult reconcile(String userId, String namespace, Collection<String> authoritativeKeys) {
        Set<String> keys = normalize(authoritativeKeys);
        if (keys.isEmpty()) {
            return LifecycleResult.NOTHING;
        }
        LifecycleResult result = addAll(userId, namespace, keys);
        log.debug("[SUBSCRIBERS] Reconciled user '{}' into {} keys in '{}'", userId, keys.size(), namespace);
        return result;
    }

    private LifecycleResult addAll(String userId, String namespace, Set<String> keys) {
        int applied = 0;
        List<String> failed = new ArrayList<>();
        for (String key : keys) {
            try {
                store.addMember(namespace, key, userId);
                applied++;
            } catch (RuntimeException e) {
                log.warn("[SUBSCRIBERS] Failed to add user '{}' to '{}:{}', skipping: {}",
                        userId, namespace, key, e.getMessage());
                failed.add(key);
            }
        }
        return new LifecycleResult(applied, failed);
    }

    private LifecycleResult removeAll(String userId, String namespace, Set<String> keys) {
        int applied = 0;
        List<String> failed = new ArrayList<>();
        for (String key : keys) {
            try {
                store.removeMember(namespace, key, userId);
                applied++;
            } catch (RuntimeException e) {
                log.warn("[SUBSCRIBERS] Failed to remove user '{}' from '{}:{}', skipping: {}",
                        userId, namespace, key, e.getMessage());
                failed.add(key);
            }
        }
        return new LifecycleResult(applied, failed);
    }

    private static Set<String> normalize(Collection<String> keys) {
        Set<String> result = new LinkedHashSet<>();
        if (keys == null) {
            return result;
        }
        for (String key : keys) {
            if (key != null && !key.isBlank()) {
                result.add(key.trim());
            }
        }
        return result;
    }
}
