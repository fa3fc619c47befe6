package com.myscrollr.delivery.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Subscription lifecycle command consumed from Kafka.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubscriptionChangeEvent {

    public enum Type { SUBSCRIBE, UNSUBSCRIBE, CONFIG_CHANGED, RECONCILE }

    private Type type;
    private String userId;
    private String namespace;
    private List<String> keys;
    private List<String> oldKeys;
    private List<String> newKeys;
}
