package com.myscrollr.delivery.client;

/**
 * Opens the per-user event stream. Implementations report everything through the listener,
 * from whatever thread they read on.
 */
public interface StreamTransport {

    StreamSession open(Listener listener);

    interface Listener {

        void onOpen();

        /**
         * One complete {@code data} payload of an event.
         */
        void onData(String data);

        /**
         * The stream ended. {@code cause} is null for a clean end of stream.
         */
        void onClosed(Throwable cause);
    }

    interface StreamSession extends AutoCloseable {
        @Override
        void close();
    }
}
