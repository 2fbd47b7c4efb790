package com.intteq.fluent.broker.capability;

import java.time.Duration;
import java.util.Optional;

/**
 * Cross-process mutual exclusion, used so only one node sweeps or archives the outbox at a time.
 */
public interface DistributedLock {

    /**
     * @return a lock token when the lock was obtained, empty otherwise
     */
    Optional<String> tryAcquire(String resource, Duration leaseTime);

    void release(String resource, String token);
}
