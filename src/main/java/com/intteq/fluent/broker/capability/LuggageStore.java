package com.intteq.fluent.broker.capability;

import java.util.Optional;

/**
 * Claim-check store for payloads too large to travel on the bus.
 */
public interface LuggageStore {

    String store(byte[] payload);

    Optional<byte[]> retrieve(String claimId);

    void delete(String claimId);
}
