package com.intteq.fluent.broker.capability;

import com.intteq.fluent.broker.core.ProducerRegistry;

/**
 * Creates the scheduler once producers exist, so scheduled messages can be sent through them.
 */
@FunctionalInterface
public interface MessageSchedulerFactory {

    MessageScheduler create(ProducerRegistry producers);
}
