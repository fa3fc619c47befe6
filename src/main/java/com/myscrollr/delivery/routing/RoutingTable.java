package com.myscrollr.delivery.routing;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable mapping from table name to the strategy that routes its records.
 */
public final class RoutingTable {

    private final Map<String, RoutingStrategy> strategies;

    private RoutingTable(Map<String, RoutingStrategy> strategies) {
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RoutingStrategy> strategyFor(String tableName) {
        return Optional.ofNullable(strategies.get(tableName));
    }

    public Set<String> tables() {
        return strategies.keySet();
    }

    /**
     * Checks the registered tables against the expected list.
     *
     * @throws IllegalStateException naming every table that is missing a strategy or is not expected
     */
    public void validateAgainst(Collection<String> knownTables) {
        Set<String> missing = new TreeSet<>(knownTables);
        missing.removeAll(strategies.keySet());
        Set<String> unexpected = new TreeSet<>(strategies.keySet());
        unexpected.removeAll(knownTables);
        if (!missing.isEmpty() || !unexpected.isEmpty()) {
            throw new IllegalStateException("Routing table does not match known tables: missing strategy for "
                    + missing + ", unexpected strategy for " + unexpected);
        }
    }

    public static final class Builder {
        private final Map<String, RoutingStrategy> strategies = new LinkedHashMap<>();

        public Builder route(String tableName, RoutingStrategy strategy) {
            if (strategies.putIfAbsent(tableName, strategy) != null) {
                throw new IllegalStateException("Duplicate routing strategy for table " + tableName);
            }
            return this;
        }

        public RoutingTable build() {
            return new RoutingTable(strategies);
        }
    }
}
