package com.journeynsw.backend.service;

import com.journeynsw.backend.client.JourneyPlannerApi;
import com.journeynsw.backend.config.TransportNswProperties;
import com.journeynsw.backend.exception.MalformedResponseException;
import com.journeynsw.backend.exception.UpstreamException;
import com.journeynsw.backend.model.RealtimeFeed;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Realtime feeds keyed by mode and one-minute bucket. At most one fetch per key is in flight;
 * concurrent callers for the same key share it, callers for other modes never wait on it.
 * Failures are handed to every waiter and are not cached.
 */
@Service
@Slf4j
public class RealtimeFeedCache {

    static final long BUCKET_MILLIS = 60_000L;
    private static final Duration WAIT_MARGIN = Duration.ofSeconds(5);

    private final JourneyPlannerApi journeyPlannerApi;
    private final Clock clock;
    private final Duration maxWait;
    private final ConcurrentHashMap<FeedKey, CompletableFuture<RealtimeFeed>> feeds = new ConcurrentHashMap<>();

    public RealtimeFeedCache(JourneyPlannerApi journeyPlannerApi, Clock clock, TransportNswProperties properties) {
        this.journeyPlannerApi = journeyPlannerApi;
        this.clock = clock;
        this.maxWait = properties.getApi().getTimeout().plus(WAIT_MARGIN);
    }

    /**
     * Blocks until the feed for the current bucket is available.
     *
     * @param modeKey Realtime mode key (buses, ferries, lightrail, sydneytrains)
     * @return The shared feed snapshot
     */
    public RealtimeFeed getFeed(String modeKey) {
        CompletableFuture<RealtimeFeed> shared = sharedFeed(modeKey);
        try {
            return shared.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw rethrowable(e.getCause(), modeKey);
        } catch (TimeoutException e) {
            throw new UpstreamException("Timed out waiting for realtime feed " + modeKey, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted while waiting for realtime feed " + modeKey, e);
        }
    }

    /**
     * Cancelling the returned future only abandons this caller's wait, the shared fetch carries on.
     */
    public CompletableFuture<RealtimeFeed> getFeedAsync(String modeKey) {
        return sharedFeed(modeKey).copy();
    }

    int size() {
        return feeds.size();
    }

    private CompletableFuture<RealtimeFeed> sharedFeed(String modeKey) {
        long bucket = Math.floorDiv(clock.millis(), BUCKET_MILLIS);
        FeedKey key = new FeedKey(modeKey, bucket);

        CompletableFuture<RealtimeFeed> created = new CompletableFuture<>();
        CompletableFuture<RealtimeFeed> shared = feeds.computeIfAbsent(key, k -> created);
        if (shared != created) {
            log.debug("Realtime feed {} for bucket {} already fetched or in flight", modeKey, bucket);
            return shared;
        }

        feeds.keySet().removeIf(k -> k.getBucket() < bucket - 1);
        startFetch(key, created);
        return created;
    }

    private void startFetch(FeedKey key, CompletableFuture<RealtimeFeed> pending) {
        log.info("📡 Fetching realtime feed {} for bucket {}", key.getModeKey(), key.getBucket());
        try {
            journeyPlannerApi.fetchRealtimeFeedAsync(key.getModeKey()).subscribe(
                    pending::complete,
                    error -> fail(key, pending, error),
                    () -> {
                        if (!pending.isDone()) {
                            fail(key, pending, new MalformedResponseException(
                                    "Realtime feed " + key.getModeKey() + " completed without a value", null));
                        }
                    });
        } catch (RuntimeException e) {
            fail(key, pending, e);
        }
    }

    private void fail(FeedKey key, CompletableFuture<RealtimeFeed> pending, Throwable error) {
        // Remove first so the next caller starts a fresh fetch
        feeds.remove(key, pending);
        log.warn("⚠️ Realtime feed {} fetch failed: {}", key.getModeKey(), error.getMessage());
        pending.completeExceptionally(error);
    }

    private RuntimeException rethrowable(Throwable cause, String modeKey) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new UpstreamException("Realtime feed " + modeKey + " failed", cause);
    }

    @Value
    private static class FeedKey {
        String modeKey;
        long bucket;
    }
}
