package com.myscrollr.delivery.routing;

import com.myscrollr.delivery.model.dto.ChangeRecord;
import com.myscrollr.delivery.store.SubscriberSetStore;

import java.util.Set;
import java.util.function.Function;

/**
 * Reads the subscriber set for the record's natural key. No joins at delivery time:
 * the lifecycle manager keeps the sets current.
 */
public class PrecomputedSetStrategy implements RoutingStrategy {

    private final SubscriberSetStore store;
    private final String namespace;
    private final Function<ChangeRecord, String> keyExtractor;
    private final String description;

    private PrecomputedSetStrategy(SubscriberSetStore store, String namespace,
                                   Function<ChangeRecord, String> keyExtractor, String description) {
        this.store = store;
        this.namespace = namespace;
        this.keyExtractor = keyExtractor;
        this.description = description;
    }

    /**
     * Every record of the table goes to the same set, e.g. all trades to the finance subscribers.
     */
    public static PrecomputedSetStrategy fixedKey(SubscriberSetStore store, String namespace, String routingKey) {
        return new PrecomputedSetStrategy(store, namespace, record -> routingKey,
                "set(" + namespace + ":" + routingKey + ")");
    }

    /**
     * The set is chosen by a field of the record, e.g. an RSS item's feed URL.
     */
    public static PrecomputedSetStrategy fromField(SubscriberSetStore store, String namespace, String field) {
        return new PrecomputedSetStrategy(store, namespace, record -> record.stringField(field),
                "set(" + namespace + ":{" + field + "})");
    }

    @Override
    public Set<String> resolve(ChangeRecord record) {
        String key = keyExtractor.apply(record);
        if (key == null) {
            throw new RecordResolutionException("missing routing key for " + description);
        }
        return store.members(namespace, key);
    }

    @Override
    public String toString() {
        return description;
    }
}
