package com.myscrollr.delivery.client;

import java.time.Duration;

/**
 * The single logical thread that owns all client state. Everything posted here runs serially.
 */
public interface EventLoop {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    Cancellable scheduleAtFixedRate(Runnable task, Duration interval);

    interface Cancellable {
        void cancel();
    }
}
