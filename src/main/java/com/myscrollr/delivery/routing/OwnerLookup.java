package com.myscrollr.delivery.routing;

import java.util.Optional;

/**
 * Single index lookup from a routing key to the user that owns it.
 */
@FunctionalInterface
public interface OwnerLookup {

    Optional<String> findOwner(String routingKey);
}
