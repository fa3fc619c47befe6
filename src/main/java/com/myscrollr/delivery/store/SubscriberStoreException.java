package com.myscrollr.delivery.store;

/**
 * The subscriber set store could not complete a single-key operation.
 */
public class SubscriberStoreException extends RuntimeException {

    public SubscriberStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
