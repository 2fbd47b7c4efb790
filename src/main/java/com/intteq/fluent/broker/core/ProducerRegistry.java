package com.intteq.fluent.broker.core;

import java.util.Collection;
import java.util.Set;

/**
 * Finalized, read-only mapping from destinations to the producer able to send to them.
 */
public interface ProducerRegistry extends AutoCloseable {

    /**
     * @throws com.intteq.fluent.broker.exception.UnknownRouteException if no producer serves the destination
     */
    MessageProducer resolve(DestinationIdentity destination);

    default MessageProducer resolve(String routingKey) {
        return resolve(DestinationIdentity.of(routingKey));
    }

    Set<DestinationIdentity> destinations();

    Collection<MessageProducer> producers();

    /** Closes every producer. */
    @Override
    void close();
}
