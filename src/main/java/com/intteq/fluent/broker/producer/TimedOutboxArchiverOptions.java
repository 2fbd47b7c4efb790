package com.intteq.fluent.broker.producer;

import com.intteq.fluent.broker.capability.ArchiveProvider;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the background job that moves dispatched outbox messages to an
 * {@link ArchiveProvider}.
 */
@Getter
@ToString
public final class TimedOutboxArchiverOptions {

    private final ArchiveProvider archiveProvider;
    private final Duration timerInterval;
    private final Duration minimumAge;
    private final int batchSize;

    private TimedOutboxArchiverOptions(Builder builder) {
        this.archiveProvider = builder.archiveProvider;
        this.timerInterval = builder.timerInterval;
        this.minimumAge = builder.minimumAge;
        this.batchSize = builder.batchSize;
    }

    public static Builder builder(ArchiveProvider archiveProvider) {
        return new Builder(archiveProvider);
    }

    public static final class Builder {

        private final ArchiveProvider archiveProvider;
        private Duration timerInterval = Duration.ofSeconds(15);
        private Duration minimumAge = Duration.ofHours(24);
        private int batchSize = 100;

        private Builder(ArchiveProvider archiveProvider) {
            this.archiveProvider = Objects.requireNonNull(archiveProvider, "archiveProvider must not be null");
        }

        public Builder setTimerInterval(Duration timerInterval) {
            this.timerInterval = timerInterval;
            return this;
        }

        public Builder setMinimumAge(Duration minimumAge) {
            this.minimumAge = minimumAge;
            return this;
        }

        public Builder setBatchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public TimedOutboxArchiverOptions build() {
            if (timerInterval == null || timerInterval.isNegative() || timerInterval.isZero()) {
                throw new IllegalArgumentException("timerInterval must be positive");
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            return new TimedOutboxArchiverOptions(this);
        }
    }
}
