package com.intteq.fluent.broker;

/**
 * Callback for beans contributing to the application's {@link FluentBrokerBuilder}. Customizers
 * run in {@link org.springframework.core.annotation.Order} order before the configuration is
 * built.
 */
@FunctionalInterface
public interface FluentBrokerCustomizer {

    void customize(FluentBrokerBuilder builder);
}
