package com.myscrollr.delivery.routing;

import com.myscrollr.delivery.model.dto.ChangeRecord;

import java.util.Set;

/**
 * The routing key is computed from a composite field before the owner lookup.
 */
public class DerivedKeyStrategy implements RoutingStrategy {

    private final String sourceField;
    private final KeyDeriver keyDeriver;
    private final OwnerLookup ownerLookup;

    public DerivedKeyStrategy(String sourceField, KeyDeriver keyDeriver, OwnerLookup ownerLookup) {
        this.sourceField = sourceField;
        this.keyDeriver = keyDeriver;
        this.ownerLookup = ownerLookup;
    }

    @Override
    public Set<String> resolve(ChangeRecord record) {
        String raw = record.stringField(sourceField);
        if (raw == null) {
            throw new RecordResolutionException("missing key field '" + sourceField + "'");
        }
        String key = keyDeriver.derive(raw)
                .orElseThrow(() -> new RecordResolutionException("malformed " + sourceField + "=" + raw));
        return ownerLookup.findOwner(key)
                .map(Set::of)
                .orElseThrow(() -> new RecordResolutionException("no owner for derived key " + key));
    }

    @Override
    public String toString() {
        return "derived(" + sourceField + ")";
    }
}
