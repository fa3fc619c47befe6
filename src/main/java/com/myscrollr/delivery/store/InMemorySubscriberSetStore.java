package com.myscrollr.delivery.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local subscriber sets, for single-instance runs and tests.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemorySubscriberSetStore implements SubscriberSetStore {

    private final ConcurrentMap<String, Set<String>> sets = new ConcurrentHashMap<>();

    @Override
    public void addMember(String namespace, String routingKey, String userId) {
        sets.computeIfAbsent(SubscriberSetKeys.of(namespace, routingKey), k -> ConcurrentHashMap.newKeySet())
                .add(userId);
    }

    @Override
    public void removeMember(String namespace, String routingKey, String userId) {
        Set<String> members = sets.get(SubscriberSetKeys.of(namespace, routingKey));
        if (members != null) {
            members.remove(userId);
        }
    }

    @Override
    public Set<String> members(String namespace, String routingKey) {
        Set<String> members = sets.get(SubscriberSetKeys.of(namespace, routingKey));
        return members == null ? Set.of() : Set.copyOf(members);
    }
}
