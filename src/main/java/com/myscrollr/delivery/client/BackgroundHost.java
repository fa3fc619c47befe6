package com.myscrollr.delivery.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * The background process of one client installation: one stream connection, one fan-out router
 * and the item store, all driven by a single event loop.
 */
@Slf4j
public class BackgroundHost implements AutoCloseable {

    private final ClientSettings settings;
    private final EventLoop loop;
    private final ClientFanoutRouter router;
    private final StreamConnection connection;
    private final FrameworkStateCache frameworkState;
    private final ObjectMapper objectMapper;

    public BackgroundHost(ClientSettings settings, StreamTransport transport, EventLoop loop, ObjectMapper objectMapper) {
        this.settings = settings;
        this.loop = loop;
        this.objectMapper = objectMapper;
        this.frameworkState = new FrameworkStateCache();
        this.router = new ClientFanoutRouter(settings.frameworkTables(), new FramePayloadParser(objectMapper),
                BoundedItemStore.withDefaults(settings.itemCap()), frameworkState);
        this.connection = new StreamConnection(transport,
                new ReconnectPolicy(settings.reconnectBase(), settings.reconnectMax()), loop, router);
    }

    public static BackgroundHost create(ClientSettings settings, Supplier<String> tokenSupplier) {
        StreamTransport transport = new SseStreamTransport(settings.streamUri(), settings.connectTimeout(), tokenSupplier);
        return new BackgroundHost(settings, transport, new ExecutorEventLoop("scrollr-background"), new ObjectMapper());
    }

    public void start() {
        connection.start();
        connection.startWakeTimer(settings.wakeInterval());
        log.info("[CLIENT] Background started against {}", settings.streamUri());
    }

    /**
     * Signs the user out of the stream. Surfaces stay attached and see the status change.
     */
    public void stop() {
        connection.stop();
    }

    /**
     * Attaches a surface. Closing the lease detaches it and drops its subscriptions.
     */
    public SubscriptionLease attach(Surface surface) {
        loop.execute(() -> router.attach(surface));
        return new SubscriptionLease(surface.id(), () -> loop.execute(() -> router.disconnect(surface.id())));
    }

    public void post(String surfaceId, ClientMessage message) {
        loop.execute(() -> router.onMessage(surfaceId, message));
    }

    /**
     * Accepts a raw JSON message from a surface. Malformed messages are dropped.
     */
    public void post(String surfaceId, String json) {
        ClientMessage message;
        try {
            message = objectMapper.readValue(json, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("[CLIENT] Dropping malformed message from '{}': {}", surfaceId, e.getOriginalMessage());
            return;
        }
        post(surfaceId, message);
    }

    public void wake() {
        connection.wake();
    }

    FrameworkStateCache frameworkState() {
        return frameworkState;
    }

    ClientFanoutRouter router() {
        return router;
    }

    @Override
    public void close() {
        connection.stopWakeTimer();
        connection.stop();
        if (loop instanceof ExecutorEventLoop executorLoop) {
            executorLoop.close();
        }
        log.info("[CLIENT] Background closed");
    }
}
