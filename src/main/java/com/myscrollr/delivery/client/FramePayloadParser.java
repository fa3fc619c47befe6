package com.myscrollr.delivery.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses stream frames of the form {@code {"data": [record, ...]}}.
 * A frame that cannot be read is rejected as a whole; single unreadable records are skipped.
 */
@Slf4j
public class FramePayloadParser {

    private final ObjectMapper objectMapper;

    public FramePayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<List<ChangeRecord>> parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[CLIENT] Dropping unparseable frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isArray()) {
            log.warn("[CLIENT] Dropping frame without a data array");
            return Optional.empty();
        }

        List<ChangeRecord> records = new ArrayList<>(data.size());
        for (JsonNode node : data) {
            try {
                ChangeRecord record = objectMapper.treeToValue(node, ChangeRecord.class);
                if (record == null || record.resolveTableName() == null) {
                    log.warn("[CLIENT] Skipping record without table name");
                    continue;
                }
                records.add(record);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[CLIENT] Skipping unreadable record: {}", e.getMessage());
            }
        }
        return Optional.of(records);
    }
}
