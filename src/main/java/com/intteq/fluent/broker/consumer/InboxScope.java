package com.intteq.fluent.broker.consumer;

/** Which inbound message kinds the inbox records. */
public enum InboxScope {
    ALL,
    COMMANDS,
    EVENTS
}
