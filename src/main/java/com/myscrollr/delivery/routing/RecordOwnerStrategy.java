package com.myscrollr.delivery.routing;

import com.myscrollr.delivery.model.dto.ChangeRecord;

import java.util.Set;

/**
 * The record names its owner directly; no lookup needed.
 */
public class RecordOwnerStrategy implements RoutingStrategy {

    private final String ownerField;

    public RecordOwnerStrategy(String ownerField) {
        this.ownerField = ownerField;
    }

    @Override
    public Set<String> resolve(ChangeRecord record) {
        String owner = record.stringField(ownerField);
        if (owner == null) {
            throw new RecordResolutionException("missing owner field '" + ownerField + "'");
        }
        return Set.of(owner);
    }

    @Override
    public String toString() {
        return "owner(" + ownerField + ")";
    }
}
