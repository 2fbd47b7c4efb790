package com.intteq.fluent.broker.producer;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the background job that re-dispatches outbox messages left undelivered.
 */
@Getter
@ToString
public final class TimedOutboxSweeperOptions {

    private final Duration timerInterval;
    private final Duration minimumMessageAge;
    private final int batchSize;
    private final boolean useBulk;
    private final Map<String, Object> args;

    private TimedOutboxSweeperOptions(Builder builder) {
        this.timerInterval = builder.timerInterval;
        this.minimumMessageAge = builder.minimumMessageAge;
        this.batchSize = builder.batchSize;
        this.useBulk = builder.useBulk;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(builder.args));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Duration timerInterval = Duration.ofSeconds(5);
        private Duration minimumMessageAge = Duration.ofSeconds(5);
        private int batchSize = 100;
        private boolean useBulk;
        private final Map<String, Object> args = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder setTimerInterval(Duration timerInterval) {
            this.timerInterval = timerInterval;
            return this;
        }

        public Builder setMinimumMessageAge(Duration minimumMessageAge) {
            this.minimumMessageAge = minimumMessageAge;
            return this;
        }

        public Builder setBatchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder setUseBulk(boolean useBulk) {
            this.useBulk = useBulk;
            return this;
        }

        public Builder addArg(String key, Object value) {
            this.args.put(key, value);
            return this;
        }

        public TimedOutboxSweeperOptions build() {
            if (timerInterval == null || timerInterval.isNegative() || timerInterval.isZero()) {
                throw new IllegalArgumentException("timerInterval must be positive");
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            return new TimedOutboxSweeperOptions(this);
        }
    }
}
