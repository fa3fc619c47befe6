package com.myscrollr.delivery.client;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.myscrollr.delivery.model.dto.ChangeRecord;

import java.util.List;
import java.util.Map;

/**
 * Messages the background process sends to surfaces.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BackgroundMessage.CdcBatch.class, name = "CDC_BATCH"),
        @JsonSubTypes.Type(value = BackgroundMessage.ConnectionStatusUpdate.class, name = "CONNECTION_STATUS"),
        @JsonSubTypes.Type(value = BackgroundMessage.StateSnapshot.class, name = "STATE_SNAPSHOT")
})
public interface BackgroundMessage {

    record CdcBatch(String table, List<ChangeRecord> records) implements BackgroundMessage {
        public CdcBatch {
            records = List.copyOf(records);
        }
    }

    record ConnectionStatusUpdate(ConnectionStatus status) implements BackgroundMessage {}

    record StateSnapshot(Map<String, List<Map<String, Object>>> items,
                         ConnectionStatus connectionStatus) implements BackgroundMessage {}
}
