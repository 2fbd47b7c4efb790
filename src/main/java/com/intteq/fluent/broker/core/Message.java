package com.intteq.fluent.broker.core;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A transport-neutral message as seen by channels and producers.
 *
 * <p>The body is opaque to this library; mapping domain objects to and from bytes is the
 * host's concern.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "body")
public final class Message {

    @NonNull
    @Builder.Default
    private final String id = UUID.randomUUID().toString();

    @NonNull
    private final String routingKey;

    @Builder.Default
    private final String contentType = "application/json";

    private final String correlationId;

    @NonNull
    @Builder.Default
    private final Instant timestamp = Instant.now();

    @Singular
    private final Map<String, String> headers;

    @NonNull
    @Builder.Default
    private final byte[] body = new byte[0];
}
