package com.soulsense.backend.modules.ratelimit.application;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

import com.soulsense.backend.modules.ratelimit.config.RateLimitProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds one limiter per {@link RateLimitFamily} so load on one flow never drains another's budget.
 */
@Component
public class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final Map<RateLimitFamily, SlidingWindowRateLimiter> limiters = new EnumMap<>(RateLimitFamily.class);

    public RateLimiterRegistry(RateLimitProperties properties, Clock clock) {
        properties.resolve().forEach((family, limit) -> limiters.put(family,
                new SlidingWindowRateLimiter(family.getPropertyKey(), limit.getMaxRequests(), limit.getWindow(),
                        clock, properties.getMaxKeys())));
    }

    public SlidingWindowRateLimiter limiter(RateLimitFamily family) {
        return limiters.get(family);
    }

    public RateLimitDecision check(RateLimitFamily family, String key) {
        return limiter(family).check(key);
    }

    /**
     * Records a request for {@code key} or fails with {@link RateLimitedException}.
     */
    public void consume(RateLimitFamily family, String key) {
        RateLimitDecision decision = check(family, key);
        if (decision.limited()) {
            log.warn("Rate limit hit family={} retryAfter={}s", family.getPropertyKey(), decision.retryAfterSeconds());
            throw new RateLimitedException(family, decision.retryAfterSeconds());
        }
    }
}
