package com.myscrollr.delivery.model.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeAction {
    INSERT,
    UPDATE,
    DELETE;

    @JsonCreator
    public static ChangeAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ChangeAction.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    public boolean isUpsert() {
        return this == INSERT || this == UPDATE;
    }
}
