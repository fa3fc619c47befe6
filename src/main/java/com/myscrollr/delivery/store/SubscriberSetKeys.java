package com.myscrollr.delivery.store;

/**
 * Namespaces and key layout of the subscriber sets.
 */
public final class SubscriberSetKeys {

    /** Sets keyed by channel type, e.g. {@code stream:subscribers:finance}. */
    public static final String STREAM_NAMESPACE = "stream:subscribers";

    /** Sets keyed by feed URL, e.g. {@code rss:subscribers:https://example.com/feed}. */
    public static final String RSS_NAMESPACE = "rss:subscribers";

    private SubscriberSetKeys() {
    }

    public static String of(String namespace, String routingKey) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (routingKey == null || routingKey.isBlank()) {
            throw new IllegalArgumentException("routing key must not be blank");
        }
        return namespace + ":" + routingKey;
    }
}
