package com.intteq.fluent.broker.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry with (optionally exponential) backoff, used by producers when sending.
 *
 * <p>Non-transient failures ({@link IllegalArgumentException}, Jackson
 * {@link JsonProcessingException}) are rethrown without retrying.
 */
@Slf4j
@Getter
@ToString
public final class RetryPolicy {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(200), 1.0);

    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0);

    private final int maxAttempts;
    private final Duration backoff;
    private final double multiplier;

    public RetryPolicy(int maxAttempts, Duration backoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.multiplier = multiplier;
    }

    public static RetryPolicy fixed(int maxAttempts, Duration backoff) {
        return new RetryPolicy(maxAttempts, backoff, 1.0);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, 2.0);
    }

    /**
     * Runs {@code action}, retrying transient failures until {@link #getMaxAttempts()} is reached.
     * The last failure is rethrown unchanged.
     */
    public void execute(String label, Runnable action) {
        Duration delay = backoff;
        int attempt = 1;

        while (true) {
            try {
                action.run();
                return;

            } catch (RuntimeException ex) {
                if (isNonTransient(ex) || attempt >= maxAttempts) {
                    throw ex;
                }

                log.warn("{} attempt {}/{} failed: {} → retrying in {}ms",
                        label, attempt, maxAttempts, ex.getMessage(), delay.toMillis());

                sleep(delay);
                delay = Duration.ofMillis((long) (delay.toMillis() * multiplier));
                attempt++;
            }
        }
    }

    private void sleep(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", e);
        }
    }

    private boolean isNonTransient(RuntimeException ex) {
        return ex instanceof IllegalArgumentException
                || ex.getCause() instanceof JsonProcessingException;
    }
}
