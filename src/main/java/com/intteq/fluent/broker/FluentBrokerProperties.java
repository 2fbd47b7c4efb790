package com.intteq.fluent.broker;

import com.intteq.fluent.broker.core.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the fluent message broker.
 *
 * <p>Prefix: {@code fluent.broker.*}
 *
 * <p>Examples:
 * <pre>
 * fluent.broker.enabled=true
 * fluent.broker.duplicate-route-policy=fail
 * fluent.broker.retry.max-attempts=5
 * fluent.broker.retry.backoff=500ms
 * fluent.broker.retry.multiplier=2.0
 * </pre>
 *
 * <p>These properties are validated at startup. Invalid configurations will cause
 * the application to fail fast.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "fluent.broker")
public class FluentBrokerProperties {

    /** Whether the auto-configuration runs at all. */
    private boolean enabled = true;

    /**
     * What happens when two registrations claim the same subscription identity or destination.
     */
    @NotNull(message = "fluent.broker.duplicate-route-policy must not be null")
    private DuplicateRoutePolicy duplicateRoutePolicy = DuplicateRoutePolicy.WARN;

    /**
     * Default retry policy used by producers whose publication names no policy.
     */
    @Valid
    private final Retry retry = new Retry();

    @Getter
    @Setter
    @ToString
    public static class Retry {

        @Min(value = 1, message = "fluent.broker.retry.max-attempts must be >= 1")
        private int maxAttempts = 3;

        @NotNull(message = "fluent.broker.retry.backoff must not be null")
        private Duration backoff = Duration.ofMillis(200);

        @DecimalMin(value = "1.0", message = "fluent.broker.retry.multiplier must be >= 1.0")
        private double multiplier = 1.0;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxAttempts, backoff, multiplier);
        }
    }
}
