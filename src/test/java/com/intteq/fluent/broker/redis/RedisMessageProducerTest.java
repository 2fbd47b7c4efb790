package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.sync.RedisCommands;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class RedisMessageProducerTest {

    private RedisCommands<String, String> commands;
    private RedisMessageProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        commands = mock(RedisCommands.class);
        RedisConnection connection = RedisConnection.builder().setKeyPrefix("app:").build();
        producer = new RedisMessageProducer(
                RedisPublication.builder().setTopic("greet").build(),
                () -> commands,
                new MessageEnvelopeCodec(),
                connection.topicKey("greet"),
                RetryPolicy.fixed(2, Duration.ZERO),
                () -> { });
    }

    @Test
    void fansOutToEverySubscribedQueue() {
        when(commands.smembers("app:topic:greet")).thenReturn(new LinkedHashSet<>(List.of("app:a", "app:b")));

        producer.send(Message.builder().routingKey("greet").build());

        verify(commands).lpush(eq("app:a"), anyString());
        verify(commands).lpush(eq("app:b"), anyString());
    }

    @Test
    void retryPushesOnlyToQueuesStillPending() {
        when(commands.smembers("app:topic:greet")).thenReturn(new LinkedHashSet<>(List.of("app:a", "app:b")));
        when(commands.lpush(eq("app:b"), anyString()))
                .thenThrow(new RedisException("busy"))
                .thenReturn(1L);

        producer.send(Message.builder().routingKey("greet").build());

        verify(commands, times(1)).lpush(eq("app:a"), anyString());
        verify(commands, times(2)).lpush(eq("app:b"), anyString());
    }

    @Test
    void noSubscriberDropsMessage() {
        when(commands.smembers("app:topic:greet")).thenReturn(Set.of());

        producer.send(Message.builder().routingKey("greet").build());

        verify(commands, never()).lpush(anyString(), anyString());
    }

    @Test
    void retriesThenReportsPublishFailure() {
        when(commands.smembers("app:topic:greet")).thenThrow(new RedisException("down"));

        assertThrows(MessagingPublishException.class, () -> producer.send(Message.builder().routingKey("greet").build()));
        verify(commands, times(2)).smembers("app:topic:greet");
    }
}
