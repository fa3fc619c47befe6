package com.myscrollr.delivery.client;

import com.myscrollr.delivery.model.dto.ChangeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-table item collections kept by the background process, capped at a fixed size.
 *
 * Inserts and updates upsert by the table's natural key; deletes remove by it. Items are kept in
 * arrival order and the oldest are evicted once a batch pushes a table over the cap.
 * Not thread-safe; owned by the client event loop.
 */
@Slf4j
public class BoundedItemStore {

    public static final String DEFAULT_KEY_FIELD = "id";

    private final int cap;
    private final Map<String, String> keyFields;
    private final Map<String, List<Map<String, Object>>> items = new LinkedHashMap<>();

    public BoundedItemStore(int cap, Map<String, String> keyFields) {
        if (cap <= 0) {
            throw new IllegalArgumentException("cap must be positive");
        }
        this.cap = cap;
        this.keyFields = Map.copyOf(keyFields);
    }

    public static BoundedItemStore withDefaults(int cap) {
        return new BoundedItemStore(cap, Map.of(
                "trades", "symbol",
                "games", "id",
                "rss_items", "id"));
    }

    public void apply(String table, List<ChangeRecord> records) {
        List<Map<String, Object>> collection = items.computeIfAbsent(table, t -> new ArrayList<>());
        String keyField = keyFields.getOrDefault(table, DEFAULT_KEY_FIELD);

        for (ChangeRecord record : records) {
            Map<String, Object> row = record.getRecord();
            Object key = row == null ? null : row.get(keyField);
            if (key == null || record.getAction() == null) {
                log.warn("[CLIENT] Skipping {} record without '{}' or action", table, keyField);
                continue;
            }
            int index = indexOf(collection, keyField, key);
            if (record.getAction().isUpsert()) {
                if (index >= 0) {
                    collection.set(index, row);
                } else {
                    collection.add(row);
                }
            } else if (index >= 0) {
                collection.remove(index);
            }
        }

        int overflow = collection.size() - cap;
        if (overflow > 0) {
            collection.subList(0, overflow).clear();
        }
    }

    public List<Map<String, Object>> items(String table) {
        return List.copyOf(items.getOrDefault(table, List.of()));
    }

    public Map<String, List<Map<String, Object>>> snapshot() {
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        items.forEach((table, rows) -> copy.put(table, List.copyOf(rows)));
        return copy;
    }

    public int cap() {
        return cap;
    }

    // numeric ids may arrive as Integer in one frame and Long in the next
    private static int indexOf(List<Map<String, Object>> collection, String keyField, Object key) {
        String wanted = String.valueOf(key);
        for (int i = 0; i < collection.size(); i++) {
            if (Objects.equals(String.valueOf(collection.get(i).get(keyField)), wanted)) {
                return i;
            }
        }
        return -1;
    }
}
