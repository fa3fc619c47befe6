package com.myscrollr.delivery.routing;

import com.myscrollr.delivery.model.dto.ChangeRecord;

import java.util.Set;

/**
 * The record carries the routing key verbatim; one owner lookup resolves the recipient.
 */
public class DirectKeyStrategy implements RoutingStrategy {

    private final String keyField;
    private final OwnerLookup ownerLookup;

    public DirectKeyStrategy(String keyField, OwnerLookup ownerLookup) {
        this.keyField = keyField;
        this.ownerLookup = ownerLookup;
    }

    @Override
    public Set<String> resolve(ChangeRecord record) {
        String key = record.stringField(keyField);
        if (key == null) {
            throw new RecordResolutionException("missing key field '" + keyField + "'");
        }
        return ownerLookup.findOwner(key)
                .map(Set::of)
                .orElseThrow(() -> new RecordResolutionException("no owner for " + keyField + "=" + key));
    }

    @Override
    public String toString() {
        return "direct(" + keyField + ")";
    }
}
