package com.myscrollr.delivery.client;

/**
 * One UI context attached to the background process.
 */
public interface Surface {

    String id();

    /**
     * Posts a message to the surface. Throws if the surface is gone.
     */
    void send(BackgroundMessage message);
}
