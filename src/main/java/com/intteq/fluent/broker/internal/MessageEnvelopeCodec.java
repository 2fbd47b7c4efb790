package com.intteq.fluent.broker.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * JSON envelope used by transports that store a whole {@link Message} as one value (Redis lists,
 * PostgreSQL rows). The body travels base64-encoded.
 */
public final class MessageEnvelopeCodec {

    private final ObjectMapper objectMapper;

    public MessageEnvelopeCodec() {
        this(new ObjectMapper());
    }

    public MessageEnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Message message) {
        try {
            return objectMapper.writeValueAsString(Envelope.of(message));
        } catch (JsonProcessingException e) {
            throw new MessagingOperationException("Failed to encode message " + message.getId(), e);
        }
    }

    public byte[] encodeToBytes(Message message) {
        return encode(message).getBytes(StandardCharsets.UTF_8);
    }

    public Message decode(String json) {
        try {
            return objectMapper.readValue(json, Envelope.class).toMessage();
        } catch (JsonProcessingException e) {
            throw new MessagingOperationException("Failed to decode message envelope", e);
        }
    }

    public Message decode(byte[] json) {
        try {
            return objectMapper.readValue(json, Envelope.class).toMessage();
        } catch (IOException e) {
            throw new MessagingOperationException("Failed to decode message envelope", e);
        }
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class Envelope {
        private String id;
        private String routingKey;
        private String contentType;
        private String correlationId;
        private long timestamp;
        private Map<String, String> headers;
        private byte[] body;

        static Envelope of(Message message) {
            return new Envelope(
                    message.getId(),
                    message.getRoutingKey(),
                    message.getContentType(),
                    message.getCorrelationId(),
                    message.getTimestamp().toEpochMilli(),
                    message.getHeaders(),
                    message.getBody());
        }

        Message toMessage() {
            Message.MessageBuilder builder = Message.builder()
                    .routingKey(routingKey)
                    .correlationId(correlationId)
                    .timestamp(Instant.ofEpochMilli(timestamp));
            if (id != null) {
                builder.id(id);
            }
            if (contentType != null) {
                builder.contentType(contentType);
            }
            if (headers != null) {
                builder.headers(headers);
            }
            if (body != null) {
                builder.body(body);
            }
            return builder.build();
        }
    }
}
