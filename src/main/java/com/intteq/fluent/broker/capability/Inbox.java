package com.intteq.fluent.broker.capability;

/**
 * Records handled messages so that a redelivered message can be detected. Persistence is owned
 * by the implementation; the composition layer only wires it.
 */
public interface Inbox {

    boolean exists(String messageId, String contextKey);

    void add(String messageId, String contextKey);
}
