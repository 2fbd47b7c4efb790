package com.intteq.fluent.broker.core;

/**
 * Sends messages for one publication. Implementations are thread-safe.
 */
public interface MessageProducer extends AutoCloseable {

    Publication publication();

    /**
     * @throws com.intteq.fluent.broker.exception.MessagingPublishException when the message could not be sent
     */
    void send(Message message);

    @Override
    void close();
}
