package com.intteq.fluent.broker.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class RetryPolicyTest {

    @Test
    void retriesTransientFailureUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        RetryPolicy.fixed(3, Duration.ZERO).execute("send", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("broker unavailable");
            }
        });

        assertEquals(3, attempts.get());
    }

    @Test
    void rethrowsLastFailureWhenAttemptsRunOut() {
        AtomicInteger attempts = new AtomicInteger();

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> RetryPolicy.fixed(2, Duration.ZERO).execute("send", () -> {
                    throw new IllegalStateException("attempt " + attempts.incrementAndGet());
                }));

        assertEquals("attempt 2", ex.getMessage());
    }

    @Test
    void doesNotRetryIllegalArgument() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.fixed(5, Duration.ZERO).execute("send", () -> {
                    attempts.incrementAndGet();
                    throw new IllegalArgumentException("bad payload");
                }));

        assertEquals(1, attempts.get());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, 0.5));
    }

    @Test
    void registryFallsBackToDefault() {
        RetryPolicy slow = RetryPolicy.exponential(5, Duration.ofSeconds(1));
        PolicyRegistry registry = PolicyRegistry.builder().add("slow", slow).build();

        assertSame(slow, registry.getOrDefault("slow"));
        assertSame(RetryPolicy.DEFAULT, registry.getOrDefault("missing"));
        assertSame(RetryPolicy.DEFAULT, registry.getOrDefault(null));
        assertTrue(registry.contains(PolicyRegistry.DEFAULT_POLICY));
    }
}
