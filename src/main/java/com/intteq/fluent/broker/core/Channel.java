package com.intteq.fluent.broker.core;

import java.time.Duration;
import java.util.Optional;

/**
 * An open inbound channel for one subscription. A channel is owned by a single message pump
 * and is not required to be thread-safe.
 */
public interface Channel extends AutoCloseable {

    /**
     * @return the subscription this channel was opened for
     */
    Subscription subscription();

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the message, or empty when none arrived in time
     */
    Optional<Message> receive(Duration timeout);

    /** Confirms successful processing; the message will not be delivered again. */
    void acknowledge(Message message);

    /** Gives up on the message; transports dead-letter it where they can. */
    void reject(Message message);

    /** Returns the message to the channel for another delivery attempt. */
    void requeue(Message message);

    @Override
    void close();
}
