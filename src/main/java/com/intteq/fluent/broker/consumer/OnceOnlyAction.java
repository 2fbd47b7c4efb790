package com.intteq.fluent.broker.consumer;

/** Reaction when the inbox detects a message that was already handled. */
public enum OnceOnlyAction {
    THROW,
    WARN
}
