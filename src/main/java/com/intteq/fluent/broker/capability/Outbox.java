package com.intteq.fluent.broker.capability;

import com.intteq.fluent.broker.core.Message;

import java.time.Duration;
import java.util.List;

/**
 * Durable store of outgoing messages, written in the sender's transaction and swept later.
 */
public interface Outbox {

    void add(Message message);

    List<Message> outstanding(Duration olderThan, int limit);

    void markDispatched(String messageId);
}
