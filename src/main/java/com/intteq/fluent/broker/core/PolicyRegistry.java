package com.intteq.fluent.broker.core;

import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of named retry policies shared by consumers and producers.
 *
 * <p>The entry named {@link #DEFAULT_POLICY} is always present.
 */
@ToString
public final class PolicyRegistry {

    public static final String DEFAULT_POLICY = "fluent.default";

    private final Map<String, RetryPolicy> policies;

    private PolicyRegistry(Map<String, RetryPolicy> policies) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    public static PolicyRegistry defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the named policy, or the default policy when {@code name} is null or unknown
     */
    public RetryPolicy getOrDefault(String name) {
        if (name == null) {
            return getDefault();
        }
        return policies.getOrDefault(name, getDefault());
    }

    public RetryPolicy getDefault() {
        return policies.get(DEFAULT_POLICY);
    }

    public boolean contains(String name) {
        return policies.containsKey(name);
    }

    public Set<String> names() {
        return policies.keySet();
    }

    public static final class Builder {

        private final Map<String, RetryPolicy> policies = new LinkedHashMap<>();

        private Builder() {
            policies.put(DEFAULT_POLICY, RetryPolicy.DEFAULT);
        }

        public Builder add(String name, RetryPolicy policy) {
            policies.put(Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(policy, "policy must not be null"));
            return this;
        }

        public Builder setDefault(RetryPolicy policy) {
            return add(DEFAULT_POLICY, policy);
        }

        public PolicyRegistry build() {
            return new PolicyRegistry(policies);
        }
    }
}
