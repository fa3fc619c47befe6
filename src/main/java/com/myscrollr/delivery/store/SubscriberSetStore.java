package com.myscrollr.delivery.store;

import java.util.Set;

/**
 * Shared key-value store of subscriber sets, one set of user identities per
 * {@code {namespace}:{routingKey}} key.
 *
 * Each operation touches exactly one key and is atomic. Adding a present member
 * and removing an absent one are no-ops. Implementations signal an unreachable
 * store with {@link SubscriberStoreException}.
 */
public interface SubscriberSetStore {

    void addMember(String namespace, String routingKey, String userId);

    void removeMember(String namespace, String routingKey, String userId);

    /**
     * @return a snapshot of the set's members, empty when the set does not exist
     */
    Set<String> members(String namespace, String routingKey);
}
