package com.intteq.fluent.broker.core;

import java.util.Map;

/**
 * Creates the producers of one transport, keyed by the destination each one serves.
 *
 * <p>Creating producers must not perform I/O; connections are opened on first send.
 */
@FunctionalInterface
public interface MessageProducerFactory {

    Map<DestinationIdentity, MessageProducer> create(PolicyRegistry policies);
}
