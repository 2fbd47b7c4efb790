package com.intteq.fluent.broker.capability;

import com.intteq.fluent.broker.core.Message;

import java.time.Duration;

/** Delivers a message after a delay. Returns an id usable for cancellation. */
public interface MessageScheduler {

    String schedule(Message message, Duration delay);

    boolean cancel(String scheduleId);
}
