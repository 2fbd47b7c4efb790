package com.intteq.fluent.broker.internal;

import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.exception.DuplicateRouteException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable lookup table from a route identity to its handler. Filled through a {@link Builder}
 * which applies the {@link DuplicateRoutePolicy}, then frozen; reads need no locking.
 *
 * @param <K> identity type
 * @param <V> bound value type
 */
public final class RouteTable<K, V> {

    private final Map<K, V> routes;
    private final List<V> boundValues;

    private RouteTable(Map<K, V> routes, List<V> boundValues) {
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        this.boundValues = List.copyOf(boundValues);
    }

    public static <K, V> Builder<K, V> builder(String kind, DuplicateRoutePolicy policy) {
        return new Builder<>(kind, policy);
    }

    /** @return the bound value, or {@code null} when the identity is not routed */
    public V get(K key) {
        return routes.get(key);
    }

    public Set<K> keys() {
        return routes.keySet();
    }

    public Map<K, V> asMap() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    /**
     * Every distinct value ever bound, in first-binding order, including values a later binding
     * replaced. Used to release resources that no longer appear in {@link #asMap()}.
     */
    public List<V> boundValues() {
        return boundValues;
    }

    @Slf4j
    public static final class Builder<K, V> {

        private final String kind;
        private final DuplicateRoutePolicy policy;
        private final Map<K, V> routes = new LinkedHashMap<>();
        private final Map<V, Boolean> seen = new IdentityHashMap<>();
        private final List<V> boundValues = new ArrayList<>();

        private Builder(String kind, DuplicateRoutePolicy policy) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
        }

        /**
         * Binds {@code key} to {@code value}. An existing binding is handled per the policy;
         * when it is replaced the key keeps its original position.
         *
         * @return {@code true} when the key was not bound before
         */
        public boolean put(K key, V value) {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");

            V existing = routes.get(key);
            if (existing != null) {
                switch (policy) {
                    case FAIL -> throw new DuplicateRouteException(kind, key);
                    case WARN -> log.warn("Duplicate {} route for {}: replacing {} with {}",
                            kind, key, existing, value);
                    case OVERWRITE -> log.debug("Overwriting {} route for {}", kind, key);
                }
            }
            routes.put(key, value);
            if (seen.put(value, Boolean.TRUE) == null) {
                boundValues.add(value);
            }
            return existing == null;
        }

        public Builder<K, V> putAll(Map<K, V> entries) {
            entries.forEach(this::put);
            return this;
        }

        public boolean contains(K key) {
            return routes.containsKey(key);
        }

        public RouteTable<K, V> build() {
            return new RouteTable<>(routes, boundValues);
        }
    }
}
