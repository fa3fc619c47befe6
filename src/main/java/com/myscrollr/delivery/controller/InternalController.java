package com.myscrollr.delivery.controller;

import com.myscrollr.delivery.delivery.SseDeliveryStream;
import com.myscrollr.delivery.lifecycle.ChannelLifecycleService;
import com.myscrollr.delivery.lifecycle.LifecycleResult;
import com.myscrollr.delivery.store.SubscriberSetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for inspecting and repairing subscriber sets.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
public class InternalController {

    private final SubscriberSetStore subscriberSetStore;
    private final ChannelLifecycleService channelLifecycleService;
    private final SseDeliveryStream deliveryStream;

    @GetMapping("/subscribers/{namespace}/{key}")
    public ResponseEntity<List<String>> members(@PathVariable String namespace, @PathVariable String key) {
        return ResponseEntity.ok(sorted(namespace, key));
    }

    /**
     * Same as {@link #members} for keys that cannot travel in a path segment, such as feed URLs.
     */
    @GetMapping("/subscribers/{namespace}")
    public ResponseEntity<List<String>> membersByParam(@PathVariable String namespace, @RequestParam String key) {
        return ResponseEntity.ok(sorted(namespace, key));
    }

    @PostMapping("/subscriptions/{userId}/reconcile")
    public ResponseEntity<LifecycleResult> reconcile(@PathVariable String userId) {
        log.info("[SUBSCRIBERS] Manual reconcile requested for user '{}'", userId);
        return ResponseEntity.ok(channelLifecycleService.reconcileUser(userId));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "viewers", deliveryStream.viewerCount()));
    }

    private List<String> sorted(String namespace, String key) {
        return subscriberSetStore.members(namespace, key).stream().sorted().toList();
    }
}
