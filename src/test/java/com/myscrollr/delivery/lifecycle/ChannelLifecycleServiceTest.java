package com.myscrollr.delivery.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myscrollr.delivery.model.domain.UserChannel;
import com.myscrollr.delivery.repository.UserChannelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChannelLifecycleService Tests")
class ChannelLifecycleServiceTest {

    private static final String RSS_NS = "rss:subscribers";
    private static final String STREAM_NS = "stream:subscribers";

    @Mock
    private SubscriberSetLifecycleManager lifecycleManager;

    @Mock
    private UserChannelRepository userChannelRepository;

    private ChannelLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new ChannelLifecycleService(lifecycleManager, userChannelRepository, new ObjectMapper());
    }

    private static Map<String, Object> rssConfig(String... urls) {
        return Map.of("feeds", Arrays.stream(urls).map(url -> Map.of("url", url)).toList());
    }

    @Nested
    @DisplayName("Channel events")
    class ChannelEvents {

        @Test
        @DisplayName("Should subscribe to the fixed stream key for a finance channel")
        void shouldSubscribeFinance() {
            service.onChannelCreated("u", "finance", Map.of());

            verify(lifecycleManager).onSubscribe("u", STREAM_NS, List.of("finance"));
        }

        @Test
        @DisplayName("Should subscribe to every feed URL of an RSS channel")
        void shouldSubscribeFeeds() {
            service.onChannelCreated("u", "rss", rssConfig("https://a.example/rss", "https://b.example/rss"));

            verify(lifecycleManager).onSubscribe("u", RSS_NS, List.of("https://a.example/rss", "https://b.example/rss"));
        }

        @Test
        @DisplayName("Should keep no sets for fantasy channels")
        void shouldIgnoreOwnerRoutedChannels() {
            assertThat(service.onChannelCreated("u", "fantasy", Map.of())).isEqualTo(LifecycleResult.NOTHING);
            verifyNoInteractions(lifecycleManager);
        }

        @Test
        @DisplayName("Should pass the old and new feed lists on update")
        void shouldPassFeedDelta() {
            service.onChannelUpdated("u", "rss",
                    new ChannelLifecycleService.ChannelState(true, rssConfig("A", "B")),
                    new ChannelLifecycleService.ChannelState(true, rssConfig("B", "C")));

            verify(lifecycleManager).onConfigChanged("u", RSS_NS, List.of("A", "B"), List.of("B", "C"));
        }

        @Test
        @DisplayName("Should remove all keys when a channel is disabled")
        void shouldRemoveKeysOnDisable() {
            service.onChannelUpdated("u", "sports",
                    new ChannelLifecycleService.ChannelState(true, Map.of()),
                    new ChannelLifecycleService.ChannelState(false, Map.of()));

            verify(lifecycleManager).onConfigChanged("u", STREAM_NS, List.of("sports"), List.of());
        }

        @Test
        @DisplayName("Should unsubscribe from all feeds when a channel is deleted")
        void shouldUnsubscribeOnDelete() {
            service.onChannelDeleted("u", "rss", rssConfig("A"));

            verify(lifecycleManager).onUnsubscribe("u", RSS_NS, List.of("A"));
        }

        @Test
        @DisplayName("Should not reconcile a disabled channel")
        void shouldSkipDisabledSync() {
            service.onSyncSubscriptions("u", "finance", Map.of(), false);

            verify(lifecycleManager, never()).reconcile(anyString(), anyString(), any());
        }
    }

    @Test
    @DisplayName("Should reconcile every stored channel of a user and tolerate bad config")
    void shouldReconcileStoredChannels() {
        when(userChannelRepository.findByUserId("u")).thenReturn(List.of(
                new UserChannel("u", "rss", true, "{\"feeds\":[{\"url\":\"A\"}]}"),
                new UserChannel("u", "finance", true, null),
                new UserChannel("u", "sports", true, "{not json")));
        when(lifecycleManager.reconcile("u", RSS_NS, List.of("A"))).thenReturn(new LifecycleResult(1, List.of()));
        when(lifecycleManager.reconcile("u", STREAM_NS, List.of("finance"))).thenReturn(new LifecycleResult(1, List.of()));
        when(lifecycleManager.reconcile("u", STREAM_NS, List.of("sports"))).thenReturn(new LifecycleResult(0, List.of("sports")));

        LifecycleResult result = service.reconcileUser("u");

        assertThat(result.applied()).isEqualTo(2);
        assertThat(result.failedKeys()).containsExactly("sports");
    }
}
