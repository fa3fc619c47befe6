package com.myscrollr.delivery.client;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Held for as long as a surface is attached. Closing it drops every subscription of the surface;
 * closing twice is harmless.
 */
public final class SubscriptionLease implements AutoCloseable {

    private final String surfaceId;
    private final Runnable release;
    private final AtomicBoolean released = new AtomicBoolean();

    SubscriptionLease(String surfaceId, Runnable release) {
        this.surfaceId = surfaceId;
        this.release = release;
    }

    public String surfaceId() {
        return surfaceId;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            release.run();
        }
    }
}
