package com.myscrollr.delivery.client;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * @param streamUri        the per-user event stream endpoint
 * @param connectTimeout   limit on establishing the stream; expiry counts as a failed attempt
 * @param reconnectBase    first reconnect delay
 * @param reconnectMax     upper bound for the reconnect delay
 * @param wakeInterval     period of the reconnect check that survives a lost backoff counter
 * @param itemCap          items retained per table
 * @param frameworkTables  tables consumed by the background itself and never forwarded
 */
public record ClientSettings(URI streamUri,
                             Duration connectTimeout,
                             Duration reconnectBase,
                             Duration reconnectMax,
                             Duration wakeInterval,
                             int itemCap,
                             Set<String> frameworkTables) {

    public static final Duration DEFAULT_RECONNECT_BASE = Duration.ofMillis(1000);
    public static final Duration DEFAULT_RECONNECT_MAX = Duration.ofMillis(30000);
    public static final Duration DEFAULT_WAKE_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_ITEM_CAP = 50;

    public static ClientSettings defaults(URI streamUri) {
        return new ClientSettings(streamUri, Duration.ofSeconds(10), DEFAULT_RECONNECT_BASE, DEFAULT_RECONNECT_MAX,
                DEFAULT_WAKE_INTERVAL, DEFAULT_ITEM_CAP,
                Set.of(FrameworkStateCache.PREFERENCES_TABLE, FrameworkStateCache.CHANNELS_TABLE));
    }
}
