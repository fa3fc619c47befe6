package com.myscrollr.delivery.model.dto;

import java.util.List;

/**
 * The payload of one stream frame. Clients inspect {@code table_name} per record;
 * frames carry no event type of their own.
 */
public record DeliveryFrame(List<ChangeRecord> data) {

    public static DeliveryFrame of(ChangeRecord record) {
        return new DeliveryFrame(List.of(record));
    }
}
