package com.myscrollr.delivery.client;

import com.myscrollr.delivery.model.dto.ChangeAction;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BoundedItemStore Tests")
class BoundedItemStoreTest {

    private final BoundedItemStore store = BoundedItemStore.withDefaults(3);

    private static ChangeRecord trade(ChangeAction action, String symbol, double price) {
        return ChangeRecord.of(action, "trades", Map.of("symbol", symbol, "price", price));
    }

    private static ChangeRecord game(ChangeAction action, Object id) {
        return ChangeRecord.of(action, "games", Map.of("id", id));
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("Should replace an existing item in place")
        void shouldReplaceInPlace() {
            store.apply("trades", List.of(trade(ChangeAction.INSERT, "AAPL", 1.0), trade(ChangeAction.INSERT, "MSFT", 2.0)));

            store.apply("trades", List.of(trade(ChangeAction.UPDATE, "AAPL", 1.5)));

            assertThat(store.items("trades")).extracting(item -> item.get("symbol")).containsExactly("AAPL", "MSFT");
            assertThat(store.items("trades").get(0)).containsEntry("price", 1.5);
        }

        @Test
        @DisplayName("Should not grow on a duplicate upsert")
        void shouldNotGrowOnDuplicate() {
            store.apply("games", List.of(game(ChangeAction.INSERT, 1)));
            store.apply("games", List.of(game(ChangeAction.INSERT, 1)));
            store.apply("games", List.of(game(ChangeAction.UPDATE, 1L)));

            assertThat(store.items("games")).hasSize(1);
        }

        @Test
        @DisplayName("Should keep exactly the newest cap items when N exceeds the cap")
        void shouldEvictOldestFirst() {
            List<ChangeRecord> batch = new ArrayList<>();
            for (int i = 1; i <= 5; i++) {
                batch.add(game(ChangeAction.INSERT, i));
            }

            store.apply("games", batch);

            assertThat(store.items("games")).extracting(item -> item.get("id")).containsExactly(3, 4, 5);
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("Should remove by natural key")
        void shouldRemove() {
            store.apply("games", List.of(game(ChangeAction.INSERT, 1), game(ChangeAction.INSERT, 2)));

            store.apply("games", List.of(game(ChangeAction.DELETE, 1)));

            assertThat(store.items("games")).extracting(item -> item.get("id")).containsExactly(2);
        }

        @Test
        @DisplayName("Should treat deleting an absent key as a no-op")
        void shouldIgnoreAbsentKey() {
            store.apply("games", List.of(game(ChangeAction.INSERT, 1)));

            store.apply("games", List.of(game(ChangeAction.DELETE, 99)));

            assertThat(store.items("games")).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should skip records without a natural key or action")
    void shouldSkipUnkeyedRecords() {
        store.apply("rss_items", List.of(
                ChangeRecord.of(ChangeAction.INSERT, "rss_items", Map.of("title", "no id")),
                ChangeRecord.of(null, "rss_items", Map.of("id", 5)),
                ChangeRecord.of(ChangeAction.INSERT, "rss_items", null)));

        assertThat(store.items("rss_items")).isEmpty();
    }

    @Test
    @DisplayName("Should snapshot every table independently of later changes")
    void shouldSnapshot() {
        store.apply("games", List.of(game(ChangeAction.INSERT, 1)));
        Map<String, List<Map<String, Object>>> snapshot = store.snapshot();

        store.apply("games", List.of(game(ChangeAction.INSERT, 2)));

        assertThat(snapshot.get("games")).hasSize(1);
        assertThat(store.snapshot().get("games")).hasSize(2);
    }
}
