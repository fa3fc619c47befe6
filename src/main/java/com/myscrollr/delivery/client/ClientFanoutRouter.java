package com.myscrollr.delivery.client;

import com.myscrollr.delivery.model.dto.ChangeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redistributes stream batches inside one client installation to the surfaces that asked for
 * their table, and broadcasts connection status to every surface.
 *
 * Single-threaded: every method must be called on the client event loop. Surfaces that attach
 * after a batch was forwarded do not get it replayed; they ask for a {@code GET_STATE} snapshot.
 */
@Slf4j
public class ClientFanoutRouter implements StreamConnection.Events {

    private final Set<String> frameworkTables;
    private final FramePayloadParser parser;
    private final BoundedItemStore itemStore;
    private final FrameworkRecordListener frameworkListener;

    private final Map<String, Surface> surfaces = new LinkedHashMap<>();
    private final Map<String, Set<String>> subscriptions = new HashMap<>();
    private ConnectionStatus connectionStatus = ConnectionStatus.DISCONNECTED;

    public ClientFanoutRouter(Set<String> frameworkTables, FramePayloadParser parser,
                              BoundedItemStore itemStore, FrameworkRecordListener frameworkListener) {
        this.frameworkTables = Set.copyOf(frameworkTables);
        this.parser = parser;
        this.itemStore = itemStore;
        this.frameworkListener = frameworkListener;
    }

    /**
     * Attaches a surface. The returned lease detaches it; the caller decides which thread runs the release.
     */
    public SubscriptionLease attach(Surface surface) {
        surfaces.put(surface.id(), surface);
        log.debug("[CLIENT] Surface '{}' attached ({} attached)", surface.id(), surfaces.size());
        return new SubscriptionLease(surface.id(), () -> disconnect(surface.id()));
    }

    public void onMessage(String surfaceId, ClientMessage message) {
        if (message instanceof ClientMessage.SubscribeCdc subscribe) {
            subscribe(surfaceId, subscribe.tables());
        } else if (message instanceof ClientMessage.UnsubscribeCdc unsubscribe) {
            unsubscribe(surfaceId, unsubscribe.tables());
        } else if (message instanceof ClientMessage.GetState) {
            sendSnapshot(surfaceId);
        } else {
            log.warn("[CLIENT] Ignoring unsupported message from '{}': {}", surfaceId, message);
        }
    }

    public void subscribe(String surfaceId, List<String> tables) {
        if (tables == null) {
            tables = List.of();
        }
        if (!surfaces.containsKey(surfaceId)) {
            log.warn("[CLIENT] Subscribe from unknown surface '{}' ignored", surfaceId);
            return;
        }
        Set<String> interest = subscriptions.computeIfAbsent(surfaceId, id -> new LinkedHashSet<>());
        for (String table : tables) {
            if (table != null && !table.isBlank()) {
                interest.add(table);
            }
        }
        if (interest.isEmpty()) {
            subscriptions.remove(surfaceId);
        }
    }

    public void unsubscribe(String surfaceId, List<String> tables) {
        Set<String> interest = subscriptions.get(surfaceId);
        if (interest == null || tables == null) {
            return;
        }
        tables.forEach(interest::remove);
        if (interest.isEmpty()) {
            subscriptions.remove(surfaceId);
        }
    }

    public void disconnect(String surfaceId) {
        surfaces.remove(surfaceId);
        subscriptions.remove(surfaceId);
        log.debug("[CLIENT] Surface '{}' detached ({} attached)", surfaceId, surfaces.size());
    }

    @Override
    public void onFrame(String data) {
        parser.parse(data).ifPresent(this::onStreamEvent);
    }

    /**
     * Groups the records by table in first-seen order and handles each group as one batch.
     */
    public void onStreamEvent(List<ChangeRecord> records) {
        Map<String, List<ChangeRecord>> byTable = new LinkedHashMap<>();
        for (ChangeRecord record : records) {
            byTable.computeIfAbsent(record.resolveTableName(), t -> new ArrayList<>()).add(record);
        }
        byTable.forEach((table, tableRecords) -> {
            if (frameworkTables.contains(table)) {
                notifyFramework(table, tableRecords);
            } else {
                itemStore.apply(table, tableRecords);
                forward(new BackgroundMessage.CdcBatch(table, tableRecords));
            }
        });
    }

    /**
     * @return how many surfaces received the batch
     */
    public int forward(BackgroundMessage.CdcBatch batch) {
        int delivered = 0;
        for (Map.Entry<String, Set<String>> entry : List.copyOf(subscriptions.entrySet())) {
            if (entry.getValue().contains(batch.table()) && send(entry.getKey(), batch)) {
                delivered++;
            }
        }
        log.debug("[CLIENT] {} {} records forwarded to {} surfaces", batch.records().size(), batch.table(), delivered);
        return delivered;
    }

    public void onStreamDisconnect() {
        onStatusChanged(ConnectionStatus.DISCONNECTED);
    }

    public void onStreamReconnect() {
        onStatusChanged(ConnectionStatus.CONNECTED);
    }

    @Override
    public void onStatusChanged(ConnectionStatus status) {
        connectionStatus = status;
        BackgroundMessage update = new BackgroundMessage.ConnectionStatusUpdate(status);
        for (String surfaceId : List.copyOf(surfaces.keySet())) {
            send(surfaceId, update);
        }
    }

    public ConnectionStatus connectionStatus() {
        return connectionStatus;
    }

    public Set<String> subscriptionsOf(String surfaceId) {
        return Set.copyOf(subscriptions.getOrDefault(surfaceId, Set.of()));
    }

    public boolean isAttached(String surfaceId) {
        return surfaces.containsKey(surfaceId);
    }

    private void sendSnapshot(String surfaceId) {
        send(surfaceId, new BackgroundMessage.StateSnapshot(itemStore.snapshot(), connectionStatus));
    }

    private void notifyFramework(String table, List<ChangeRecord> records) {
        try {
            frameworkListener.onFrameworkRecords(table, records);
        } catch (RuntimeException e) {
            log.warn("[CLIENT] Framework listener failed for '{}': {}", table, e.getMessage(), e);
        }
    }

    private boolean send(String surfaceId, BackgroundMessage message) {
        Surface surface = surfaces.get(surfaceId);
        if (surface == null) {
            return false;
        }
        try {
            surface.send(message);
            return true;
        } catch (RuntimeException e) {
            // a surface that cannot be posted to is gone
            log.warn("[CLIENT] Surface '{}' unreachable, detaching: {}", surfaceId, e.getMessage());
            disconnect(surfaceId);
            return false;
        }
    }
}
