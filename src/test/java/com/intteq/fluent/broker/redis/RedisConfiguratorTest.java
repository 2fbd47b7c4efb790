package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.BrokerConfiguration;
import com.intteq.fluent.broker.FluentBrokerBuilder;
import com.intteq.fluent.broker.capability.LuggageStore;
import com.intteq.fluent.broker.exception.MissingConnectionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class RedisConfiguratorTest {

    @Test
    void luggageStoreIsCreatedFromConnection() {
        LuggageStore store = mock(LuggageStore.class);

        BrokerConfiguration configuration = new FluentBrokerBuilder()
                .using(new RedisConfigurator()
                        .useLuggageStore(connection -> {
                            assertEquals("cache", connection.getHost());
                            return store;
                        })
                        .setConnection(c -> c.setHost("cache")))
                .build();

        assertSame(store, configuration.luggageStore().orElseThrow());
    }

    @Test
    void missingConnectionIsReportedForRedis() {
        FluentBrokerBuilder builder = new FluentBrokerBuilder()
                .using(new RedisConfigurator().useLuggageStore(connection -> mock(LuggageStore.class)));

        MissingConnectionException ex = assertThrows(MissingConnectionException.class, builder::build);
        assertEquals("Redis", ex.getTransport());
    }

    @Test
    void keysUsePrefix() {
        RedisConnection connection = RedisConnection.builder().setKeyPrefix("app:").build();

        assertEquals("app:topic:greet", connection.topicKey("greet"));
        assertEquals("app:greet-ch", connection.queueKey("greet-ch"));
    }
}
