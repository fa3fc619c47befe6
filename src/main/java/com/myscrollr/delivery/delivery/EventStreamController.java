package com.myscrollr.delivery.delivery;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * Streams routed change frames to an authenticated user. The user id is set by the gateway.
 */
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
public class EventStreamController {

    private final SseDeliveryStream deliveryStream;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader("X-User-Id") String userId) {
        if (userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "X-User-Id must not be blank");
        }
        return deliveryStream.open(userId.trim());
    }

    @GetMapping("/viewers")
    public Map<String, Integer> viewers() {
        return Map.of("count", deliveryStream.viewerCount());
    }
}
