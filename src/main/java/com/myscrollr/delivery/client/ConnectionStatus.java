package com.myscrollr.delivery.client;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConnectionStatus {
    CONNECTED,
    DISCONNECTED,
    RECONNECTING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
