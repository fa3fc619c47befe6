package com.myscrollr.delivery.lifecycle;

import com.myscrollr.delivery.config.AsyncConfig;
import com.myscrollr.delivery.model.domain.UserChannel;
import com.myscrollr.delivery.repository.UserChannelRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Rebuilds the subscriber sets from stored channel configuration once the application is up.
 *
 * Runs off the startup thread as an explicit task; its outcome is always logged.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.warmup.enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionWarmupService {

    private final UserChannelRepository userChannelRepository;
    private final ChannelLifecycleService channelLifecycleService;
    private final Executor executor;
    private final Counter failureCounter;

    public SubscriptionWarmupService(UserChannelRepository userChannelRepository,
                                     ChannelLifecycleService channelLifecycleService,
                                     @Qualifier(AsyncConfig.SUBSCRIPTION_EXECUTOR) Executor executor,
                                     MeterRegistry meterRegistry) {
        this.userChannelRepository = userChannelRepository;
        this.channelLifecycleService = channelLifecycleService;
        this.executor = executor;
        this.failureCounter = meterRegistry.counter("subscriber.warmup.failures");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        runWarmup();
    }

    public CompletableFuture<LifecycleResult> runWarmup() {
        return CompletableFuture.supplyAsync(this::syncAllChannels, executor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        failureCounter.increment();
                        log.error("[SUBSCRIBERS] Subscription warm-up failed", error);
                    } else {
                        log.info("[SUBSCRIBERS] Subscription warm-up complete: {} keys applied, {} failed",
                                result.applied(), result.failedKeys().size());
                    }
                });
    }

    private LifecycleResult syncAllChannels() {
        List<UserChannel> channels = userChannelRepository.findByEnabledTrue();
        log.info("[SUBSCRIBERS] Warming subscriber sets from {} enabled channels", channels.size());
        LifecycleResult result = LifecycleResult.NOTHING;
        for (UserChannel channel : channels) {
            result = result.merge(channelLifecycleService.syncChannel(channel));
        }
        return result;
    }
}
