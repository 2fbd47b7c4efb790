package com.intteq.fluent.broker.consumer;

import com.intteq.fluent.broker.capability.MessageSchedulerFactory;
import com.intteq.fluent.broker.core.ChannelResolver;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.Subscription;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Finalized consumer side: every subscription, the channel resolver routing them, and the
 * shared consumer settings.
 */
@Getter
@ToString
public final class ConsumersOptions {

    private final List<Subscription> subscriptions;
    private final ChannelResolver channelResolver;
    private final InboxConfiguration inboxConfiguration;
    private final PolicyRegistry policies;
    private final MessageSchedulerFactory schedulerFactory;

    public ConsumersOptions(List<Subscription> subscriptions,
                            ChannelResolver channelResolver,
                            InboxConfiguration inboxConfiguration,
                            PolicyRegistry policies,
                            MessageSchedulerFactory schedulerFactory) {
        this.subscriptions = List.copyOf(subscriptions);
        this.channelResolver = channelResolver;
        this.inboxConfiguration = inboxConfiguration;
        this.policies = policies;
        this.schedulerFactory = schedulerFactory;
    }

    public Optional<MessageSchedulerFactory> schedulerFactory() {
        return Optional.ofNullable(schedulerFactory);
    }
}
