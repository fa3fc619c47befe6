package com.myscrollr.delivery.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the CDC webhook body. Accepted shapes, in order:
 * {@code {"records": [...]}}, {@code {"data": [...]}}, or one bare record.
 * An unreadable element of a records array is skipped; the body is rejected only when
 * nothing in it can be read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CdcEnvelopeParser {

    private final ObjectMapper objectMapper;

    public List<ChangeRecord> parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedEnvelopeException("Empty request body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Body must be a JSON object");
        }

        List<ChangeRecord> records;
        if (root.has("records")) {
            records = readArray(root.get("records"), "records");
        } else if (root.has("data")) {
            records = readArray(root.get("data"), "data");
        } else if (root.has("table_name") || root.has("metadata")) {
            records = List.of(readRecord(root));
        } else {
            records = List.of();
        }

        if (records.isEmpty()) {
            throw new MalformedEnvelopeException("No records in request");
        }
        return records;
    }

    private List<ChangeRecord> readArray(JsonNode node, String field) {
        if (node == null || !node.isArray()) {
            throw new MalformedEnvelopeException("'" + field + "' must be an array");
        }
        List<ChangeRecord> records = new ArrayList<>(node.size());
        int index = 0;
        for (JsonNode element : node) {
            try {
                records.add(readRecord(element));
            } catch (MalformedEnvelopeException e) {
                log.warn("[CDC-ROUTER] Skipping {}[{}]: {}", field, index, e.getMessage());
            }
            index++;
        }
        return records;
    }

    private ChangeRecord readRecord(JsonNode node) {
        if (!node.isObject()) {
            throw new MalformedEnvelopeException("Each record must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(node, ChangeRecord.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Unreadable record: " + e.getOriginalMessage(), e);
        }
    }
}
