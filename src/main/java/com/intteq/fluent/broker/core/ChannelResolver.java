package com.intteq.fluent.broker.core;

import java.util.Set;

/**
 * Finalized, read-only mapping from subscription identities to the channel factory able to
 * receive messages for them.
 */
public interface ChannelResolver extends AutoCloseable {

    /**
     * @throws com.intteq.fluent.broker.exception.UnknownRouteException if the identity was never registered
     */
    ChannelFactory resolve(SubscriptionIdentity identity);

    Set<SubscriptionIdentity> identities();

    /** Closes every bound factory that holds resources. */
    @Override
    void close();
}
