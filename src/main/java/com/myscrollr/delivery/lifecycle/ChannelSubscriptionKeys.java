package com.myscrollr.delivery.lifecycle;

import com.myscrollr.delivery.store.SubscriberSetKeys;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a channel type and its config to the subscriber set keys it implies.
 */
public final class ChannelSubscriptionKeys {

    public static final String FINANCE = "finance";
    public static final String SPORTS = "sports";
    public static final String RSS = "rss";
    public static final String FANTASY = "fantasy";

    private ChannelSubscriptionKeys() {
    }

    /**
     * @return the namespace and keys, or empty for channel types that are routed by owner
     *         and keep no subscriber sets
     */
    public static Optional<Keys> forChannel(String channelType, Map<String, Object> config) {
        if (channelType == null) {
            return Optional.empty();
        }
        return switch (channelType) {
            case FINANCE, SPORTS -> Optional.of(new Keys(SubscriberSetKeys.STREAM_NAMESPACE, List.of(channelType)));
            case RSS -> Optional.of(new Keys(SubscriberSetKeys.RSS_NAMESPACE, feedUrls(config)));
            default -> Optional.empty();
        };
    }

    /**
     * Extracts {@code feeds[].url} from an RSS channel config, ignoring malformed entries.
     */
    static List<String> feedUrls(Map<String, Object> config) {
        List<String> urls = new ArrayList<>();
        if (config == null || !(config.get("feeds") instanceof Collection<?> feeds)) {
            return urls;
        }
        for (Object feed : feeds) {
            if (feed instanceof Map<?, ?> map && map.get("url") instanceof String url && !url.isBlank()) {
                urls.add(url);
            }
        }
        return urls;
    }

    public record Keys(String namespace, List<String> keys) {
    }
}
