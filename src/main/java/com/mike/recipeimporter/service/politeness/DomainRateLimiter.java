package com.mike.recipeimporter.service.politeness;

import com.mike.recipeimporter.config.ImporterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-domain pacing: at least baseDelay * multiplier between two requests to the same domain.
 * The multiplier doubles on 429/503 (max 32) and decays by 10% per success (min 1).
 */
@Component
@Slf4j
public class DomainRateLimiter {

    static final double MIN_MULTIPLIER = 1.0;
    static final double MAX_MULTIPLIER = 32.0;
    private static final double SUCCESS_DECAY = 0.9;
    private static final double RATE_LIMIT_GROWTH = 2.0;

    private final long baseDelayNanos;
    private final Map<String, PacingState> states = new ConcurrentHashMap<>();

    public DomainRateLimiter(ImporterProperties props) {
        double seconds = Math.max(0.0, props.getCrawling().getThrottleSeconds());
        this.baseDelayNanos = (long) (seconds * TimeUnit.SECONDS.toNanos(1));
    }

    public void waitBeforeRequest(String domain) {
        PacingState state = state(domain);
        synchronized (state) {
            long required = (long) (baseDelayNanos * state.multiplier);
            if (state.lastRequestNanos != 0L) {
                long elapsed = System.nanoTime() - state.lastRequestNanos;
                long remaining = required - elapsed;
                if (remaining > 0) {
                    sleep(domain, remaining);
                }
            }
            state.lastRequestNanos = System.nanoTime();
        }
    }

    public void onSuccess(String domain) {
        PacingState state = state(domain);
        synchronized (state) {
            state.multiplier = Math.max(MIN_MULTIPLIER, state.multiplier * SUCCESS_DECAY);
        }
    }

    public void onRateLimited(String domain) {
        PacingState state = state(domain);
        synchronized (state) {
            state.multiplier = Math.min(MAX_MULTIPLIER, state.multiplier * RATE_LIMIT_GROWTH);
            log.warn("DomainRateLimiter: rate limited by domain={}, backoff multiplier now {}",
                    domain, state.multiplier);
        }
    }

    public double multiplier(String domain) {
        PacingState state = states.get(key(domain));
        return state == null ? MIN_MULTIPLIER : state.multiplier;
    }

    private PacingState state(String domain) {
        return states.computeIfAbsent(key(domain), d -> new PacingState());
    }

    private static String key(String domain) {
        return domain == null ? "" : domain.toLowerCase();
    }

    private static void sleep(String domain, long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("DomainRateLimiter: wait for domain={} interrupted", domain);
        }
    }

    private static final class PacingState {
        private long lastRequestNanos;
        private double multiplier = MIN_MULTIPLIER;
    }
}
