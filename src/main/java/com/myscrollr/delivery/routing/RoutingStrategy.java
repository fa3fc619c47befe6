package com.myscrollr.delivery.routing;

import com.myscrollr.delivery.model.dto.ChangeRecord;

import java.util.Set;

/**
 * Resolves one change record to the user identities that should receive it.
 *
 * Implementations are read-only: they may query the owner index or the
 * subscriber set store but never write to either.
 */
public interface RoutingStrategy {

    /**
     * @return the recipients, possibly empty
     * @throws RecordResolutionException when the routing key is missing, malformed or unknown
     */
    Set<String> resolve(ChangeRecord record);
}
