package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class RedisMessageProducerFactoryTest {

    @Test
    void failedConnectShutsDownTheClient() {
        RedisClient client = mock(RedisClient.class);
        when(client.connect()).thenThrow(new RedisConnectionException("refused"));
        RedisConnection connection = spy(RedisConnection.builder().setKeyPrefix("app:").build());
        doReturn(client).when(connection).createClient();
        PolicyRegistry policies = PolicyRegistry.builder().setDefault(RetryPolicy.fixed(2, Duration.ZERO)).build();

        MessageProducer producer = new RedisMessageProducerFactory(connection,
                List.of(RedisPublication.builder().setTopic("greet").build()))
                .create(policies)
                .get(DestinationIdentity.of("greet"));

        assertThrows(MessagingPublishException.class, () -> producer.send(Message.builder().routingKey("greet").build()));
        verify(connection, times(2)).createClient();
        verify(client, times(2)).shutdown();
    }

    @Test
    void noPublicationsCreatesNoProducers() {
        RedisConnection connection = spy(RedisConnection.builder().build());

        assertTrue(new RedisMessageProducerFactory(connection, List.of()).create(PolicyRegistry.defaults()).isEmpty());
        verify(connection, never()).createClient();
    }
}
