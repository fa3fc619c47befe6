package com.myscrollr.delivery.delivery;

import com.myscrollr.delivery.model.dto.DeliveryFrame;

import java.util.Set;

/**
 * Pushes frames to connected users. Users without an open stream are skipped silently.
 */
public interface DeliveryStream {

    /**
     * @return how many open streams the frame was written to
     */
    int deliver(Set<String> users, DeliveryFrame frame);
}
