package com.intteq.fluent.broker.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Ordered list of deferred configuration actions against a target, applied exactly once.
 *
 * @param <T> the target the steps mutate
 */
public final class ConfigurationSteps<T> {

    private final List<Consumer<T>> steps = new ArrayList<>();
    private boolean applied;

    public void add(Consumer<T> step) {
        if (applied) {
            throw new IllegalStateException("Configuration steps were already applied");
        }
        steps.add(Objects.requireNonNull(step, "step must not be null"));
    }

    /**
     * Runs every step in declaration order.
     *
     * @throws IllegalStateException when called a second time
     */
    public void applyTo(T target) {
        Objects.requireNonNull(target, "target must not be null");
        if (applied) {
            throw new IllegalStateException("Configuration steps were already applied");
        }
        applied = true;
        for (Consumer<T> step : steps) {
            step.accept(target);
        }
    }

    public int size() {
        return steps.size();
    }

    public boolean isApplied() {
        return applied;
    }
}
