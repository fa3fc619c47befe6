package com.myscrollr.delivery.delivery;

import com.myscrollr.delivery.config.DeliveryProperties;
import com.myscrollr.delivery.model.dto.DeliveryFrame;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server-sent-events implementation of {@link DeliveryStream}.
 *
 * A user may hold several streams (one per browser or device); each frame goes to all of them.
 * A stream that fails on write is completed and dropped.
 */
@Slf4j
@Component
public class SseDeliveryStream implements DeliveryStream {

    private final DeliveryProperties properties;
    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();
    private final Counter framesSent;
    private final Counter writeFailures;

    public SseDeliveryStream(DeliveryProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.framesSent = meterRegistry.counter("delivery.frames.sent");
        this.writeFailures = meterRegistry.counter("delivery.frames.failed");
        meterRegistry.gauge("delivery.viewers", emitters, map -> viewerCount());
    }

    public SseEmitter open(String userId) {
        SseEmitter emitter = new SseEmitter(properties.emitterTimeout().toMillis());
        emitters.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> remove(userId, emitter));
        emitter.onTimeout(() -> {
            emitter.complete();
            remove(userId, emitter);
        });
        emitter.onError(error -> remove(userId, emitter));

        try {
            emitter.send(SseEmitter.event().reconnectTime(properties.retryIntervalMs()).comment("connected"));
        } catch (IOException e) {
            log.warn("[SSE] Could not open stream for user '{}': {}", userId, e.getMessage());
            remove(userId, emitter);
            emitter.completeWithError(e);
            return emitter;
        }
        log.info("[SSE] Stream opened for user '{}' ({} viewers)", userId, viewerCount());
        return emitter;
    }

    @Override
    public int deliver(Set<String> users, DeliveryFrame frame) {
        int written = 0;
        for (String user : users) {
            List<SseEmitter> userEmitters = emitters.get(user);
            if (userEmitters == null) {
                continue;
            }
            for (SseEmitter emitter : userEmitters) {
                if (write(user, emitter, SseEmitter.event().data(frame, MediaType.APPLICATION_JSON))) {
                    written++;
                }
            }
        }
        framesSent.increment(written);
        return written;
    }

    @Scheduled(fixedRateString = "${app.delivery.heartbeat-interval:PT15S}")
    public void heartbeat() {
        emitters.forEach((user, userEmitters) ->
                userEmitters.forEach(emitter -> write(user, emitter, SseEmitter.event().comment("ping"))));
    }

    public int viewerCount() {
        return emitters.values().stream().mapToInt(List::size).sum();
    }

    private boolean write(String user, SseEmitter emitter, SseEmitter.SseEventBuilder event) {
        try {
            emitter.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            writeFailures.increment();
            log.debug("[SSE] Dropping stream of user '{}': {}", user, e.getMessage());
            remove(user, emitter);
            emitter.completeWithError(e);
            return false;
        }
    }

    private void remove(String userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (id, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
