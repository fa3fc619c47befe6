package com.myscrollr.delivery.client;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Messages a surface sends to the background process.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientMessage.SubscribeCdc.class, name = "SUBSCRIBE_CDC"),
        @JsonSubTypes.Type(value = ClientMessage.UnsubscribeCdc.class, name = "UNSUBSCRIBE_CDC"),
        @JsonSubTypes.Type(value = ClientMessage.GetState.class, name = "GET_STATE")
})
public interface ClientMessage {

    record SubscribeCdc(List<String> tables) implements ClientMessage {
        public SubscribeCdc {
            tables = tables == null ? List.of() : List.copyOf(tables);
        }
    }

    record UnsubscribeCdc(List<String> tables) implements ClientMessage {
        public UnsubscribeCdc {
            tables = tables == null ? List.of() : List.copyOf(tables);
        }
    }

    record GetState() implements ClientMessage {}
}
