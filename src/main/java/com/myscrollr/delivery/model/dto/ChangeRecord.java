package com.myscrollr.delivery.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A single row-level change as published by the change emitter.
 *
 * The table name may arrive either at the top level or inside {@code metadata};
 * {@link #resolveTableName()} hides the difference from callers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeRecord {

    private ChangeAction action;

    @JsonProperty("table_name")
    private String tableName;

    private Map<String, Object> changes;

    private Map<String, Object> record;

    private Metadata metadata;

    public static ChangeRecord of(ChangeAction action, String tableName, Map<String, Object> record) {
        return new ChangeRecord(action, tableName, null, record, null);
    }

    @JsonIgnore
    public String resolveTableName() {
        if (tableName != null && !tableName.isBlank()) {
            return tableName;
        }
        return metadata != null ? metadata.getTableName() : null;
    }

    /**
     * Reads a string field from the record body.
     * @return the trimmed value, or null when the field is absent, blank or not a string
     */
    @JsonIgnore
    public String stringField(String field) {
        if (record == null) {
            return null;
        }
        Object value = record.get(field);
        if (!(value instanceof String str) || str.isBlank()) {
            return null;
        }
        return str.trim();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @JsonProperty("table_schema")
        private String tableSchema;

        @JsonProperty("table_name")
        private String tableName;
    }
}
