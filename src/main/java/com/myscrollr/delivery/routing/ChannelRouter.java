package com.myscrollr.delivery.routing;

import com.myscrollr.delivery.model.dto.ChangeRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves change records to the users that should receive them.
 *
 * Read-only: it never mutates the subscriber sets. A record that cannot be
 * resolved is logged and contributes nobody; its siblings are unaffected.
 * Records of tables without a strategy are ignored.
 */
@Slf4j
@Service
public class ChannelRouter {

    private final RoutingTable routingTable;
    private final Counter routedCounter;
    private final Counter skippedCounter;

    public ChannelRouter(RoutingTable routingTable, MeterRegistry meterRegistry) {
        this.routingTable = routingTable;
        this.routedCounter = meterRegistry.counter("cdc.records.routed");
        this.skippedCounter = meterRegistry.counter("cdc.records.skipped");
    }

    /**
     * @return the union of recipients over all records, each user once
     */
    public Set<String> route(List<ChangeRecord> records) {
        Set<String> users = new HashSet<>();
        if (records == null) {
            return users;
        }
        for (ChangeRecord record : records) {
            users.addAll(resolve(record));
        }
        return users;
    }

    /**
     * Resolves a single record. Never throws.
     */
    public Set<String> resolve(ChangeRecord record) {
        if (record == null) {
            return Set.of();
        }
        String table = record.resolveTableName();
        if (table == null) {
            log.warn("[CDC-ROUTER] Record without table name skipped (action={})", record.getAction());
            skippedCounter.increment();
            return Set.of();
        }

        Optional<RoutingStrategy> strategy = routingTable.strategyFor(table);
        if (strategy.isEmpty()) {
            log.debug("[CDC-ROUTER] No strategy for table '{}', ignoring record", table);
            return Set.of();
        }

        try {
            Set<String> users = strategy.get().resolve(record);
            routedCounter.increment();
            log.debug("[CDC-ROUTER] {} record on '{}' resolved to {} users via {}",
                    record.getAction(), table, users.size(), strategy.get());
            return users;
        } catch (RecordResolutionException e) {
            skippedCounter.increment();
            log.warn("[CDC-ROUTER] Skipping record on '{}': {}", table, e.getMessage());
            return Set.of();
        } catch (RuntimeException e) {
            // store or index failure: this record is a missed delivery, the batch carries on
            skippedCounter.increment();
            log.warn("[CDC-ROUTER] Failed to resolve record on '{}' via {}: {}",
                    table, strategy.get(), e.getMessage(), e);
            return Set.of();
        }
    }
}
