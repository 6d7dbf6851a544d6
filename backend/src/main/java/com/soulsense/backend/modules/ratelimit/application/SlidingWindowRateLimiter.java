package com.soulsense.backend.modules.ratelimit.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Counts requests per key inside a trailing time window.
 *
 * <p>A key is limited once the number of requests recorded inside the window reaches
 * {@code maxRequests}. Only allowed requests are recorded, so a caller hammering a limited key
 * does not extend its own lockout. Timestamps that fell out of the window are dropped on the next
 * check for the key; keys without a recorded request for a whole window expire from the cache.
 *
 * <p>Checks for the same key are serialized through {@link ConcurrentMap#compute}; different keys
 * proceed in parallel. State is process-local and does not survive a restart.
 */
public class SlidingWindowRateLimiter {

    static final long DEFAULT_MAX_KEYS = 10_000;

    private final String name;
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Cache<String, Deque<Instant>> windows;

    public SlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock) {
        this(name, maxRequests, window, clock, DEFAULT_MAX_KEYS);
    }

    public SlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock, long maxKeys) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.windows = Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .expireAfterWrite(window)
                .build();
    }

    public RateLimitDecision check(String key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        Instant windowStart = now.minus(window);
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.asMap().compute(key, (k, timestamps) -> {
            Deque<Instant> current = timestamps != null ? timestamps : new ArrayDeque<>();
            while (!current.isEmpty() && !current.peekFirst().isAfter(windowStart)) {
                current.pollFirst();
            }
            if (current.size() >= maxRequests) {
                decision[0] = RateLimitDecision.limited(retryAfterSeconds(current.peekFirst(), now));
            } else {
                current.addLast(now);
                decision[0] = RateLimitDecision.allowed();
            }
            return current;
        });
        return decision[0];
    }

    /**
     * Forgets every request recorded for {@code key}.
     */
    public void reset(String key) {
        windows.invalidate(key);
    }

    public String getName() {
        return name;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    private int retryAfterSeconds(Instant oldest, Instant now) {
        Duration remaining = Duration.between(now, oldest.plus(window));
        long millis = Math.max(0L, remaining.toMillis());
        long seconds = (millis + 999L) / 1000L;
        return (int) Math.max(1L, seconds);
    }
}
