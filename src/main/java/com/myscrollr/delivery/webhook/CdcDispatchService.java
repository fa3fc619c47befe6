package com.myscrollr.delivery.webhook;

import com.myscrollr.delivery.delivery.DeliveryStream;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import com.myscrollr.delivery.model.dto.DeliveryFrame;
import com.myscrollr.delivery.routing.ChannelRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Routes a CDC batch and hands each record to the delivery stream, addressed to its own recipients.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CdcDispatchService {

    private final ChannelRouter channelRouter;
    private final DeliveryStream deliveryStream;

    /**
     * @return every user at least one record was addressed to
     */
    public Set<String> dispatch(List<ChangeRecord> records) {
        Set<String> allUsers = new LinkedHashSet<>();
        int frames = 0;
        for (ChangeRecord record : records) {
            Set<String> users = channelRouter.resolve(record);
            if (users.isEmpty()) {
                continue;
            }
            allUsers.addAll(users);
            frames += deliveryStream.deliver(users, DeliveryFrame.of(record));
        }
        log.info("[CDC-ROUTER] Batch of {} records routed to {} users, {} frames written",
                records.size(), allUsers.size(), frames);
        return allUsers;
    }
}
