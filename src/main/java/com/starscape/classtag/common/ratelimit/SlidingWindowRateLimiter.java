package com.starscape.classtag.common.ratelimit;

import com.starscape.classtag.common.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory sliding-log rate limiter.
 *
 * Each (policy, key) pair owns a deque of request timestamps. A request is
 * admitted when fewer than {@code maxRequests} timestamps remain inside the
 * window after evicting older ones. When the policy has a block duration, the
 * first rejected request also blocks the key until that duration has passed.
 * All mutation of a window happens inside {@link ConcurrentHashMap#compute},
 * which serialises callers per key without a global lock. State is per instance
 * and lost on restart.
 */
@Component
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final RateLimitProperties properties;
    private final Clock clock;

    public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Record an attempt for the given actor key and decide whether it may proceed.
     * Rejected attempts are not recorded.
     */
    public RateLimitResult allow(String key, RateLimitPolicy policy) {
        RateLimitProperties.Limit limit = properties.limitFor(policy);
        int maxRequests = limit.getMaxRequests();
        if (!properties.isEnabled()) {
            return RateLimitResult.allowed(maxRequests, maxRequests);
        }

        long now = clock.millis();
        long windowMs = limit.getWindow().toMillis();
        long blockMs = limit.getBlock().toMillis();
        RateLimitResult[] outcome = new RateLimitResult[1];

        windows.compute(windowKey(policy, key), (k, existing) -> {
            Window window = existing != null ? existing : new Window();
            if (window.blockedUntil > now) {
                outcome[0] = RateLimitResult.rejected(maxRequests, toSeconds(window.blockedUntil - now));
                return window;
            }
            evictOlderThan(window.timestamps, now - windowMs);

            if (window.timestamps.size() < maxRequests) {
                window.timestamps.addLast(now);
                outcome[0] = RateLimitResult.allowed(maxRequests, maxRequests - window.timestamps.size());
            } else if (blockMs > 0) {
                window.blockedUntil = now + blockMs;
                log.info("Blocking rate-limit key {} for {} ms", k, blockMs);
                outcome[0] = RateLimitResult.rejected(maxRequests, toSeconds(blockMs));
            } else {
                long oldest = window.timestamps.peekFirst();
                outcome[0] = RateLimitResult.rejected(maxRequests, toSeconds(oldest + windowMs - now));
            }
            return window.isIdle(now) ? null : window;
        });

        return outcome[0];
    }

    /**
     * Drop keys whose every timestamp has aged out of the longest window and
     * whose block, if any, has ended.
     */
    @Scheduled(fixedDelayString = "${app.rate-limit.sweep-interval-ms:60000}")
    public void evictIdleKeys() {
        long now = clock.millis();
        long horizon = now - longestWindow().toMillis();
        int before = windows.size();

        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                evictOlderThan(window.timestamps, horizon);
                return window.isIdle(now) ? null : window;
            });
        }

        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit keys", evicted);
        }
    }

    int trackedKeys() {
        return windows.size();
    }

    private Duration longestWindow() {
        return Arrays.stream(RateLimitPolicy.values())
                .map(policy -> properties.limitFor(policy).getWindow())
                .max(Duration::compareTo)
                .orElse(Duration.ofMinutes(15));
    }

    private static long toSeconds(long millis) {
        return Math.max(1, (millis + 999) / 1000);
    }

    private static void evictOlderThan(Deque<Long> timestamps, long cutoff) {
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }

    private static String windowKey(RateLimitPolicy policy, String key) {
        return policy.name() + ":" + key;
    }

    private static final class Window {

        private final Deque<Long> timestamps = new ArrayDeque<>();
        private long blockedUntil;

        boolean isIdle(long now) {
            return timestamps.isEmpty() && blockedUntil <= now;
        }
    }
}
