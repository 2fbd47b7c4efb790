package com.intteq.fluent.broker.producer;

import com.intteq.fluent.broker.capability.ArchiveProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class TimedOutboxOptionsTest {

    @Test
    void sweeperDefaults() {
        TimedOutboxSweeperOptions options = TimedOutboxSweeperOptions.builder().build();

        assertEquals(Duration.ofSeconds(5), options.getTimerInterval());
        assertEquals(100, options.getBatchSize());
        assertFalse(options.isUseBulk());
    }

    @Test
    void sweeperRejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> TimedOutboxSweeperOptions.builder().setTimerInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> TimedOutboxSweeperOptions.builder().setBatchSize(0).build());
    }

    @Test
    void archiverKeepsItsProvider() {
        ArchiveProvider provider = mock(ArchiveProvider.class);

        TimedOutboxArchiverOptions options = TimedOutboxArchiverOptions.builder(provider).build();

        assertSame(provider, options.getArchiveProvider());
        assertEquals(Duration.ofHours(24), options.getMinimumAge());
    }
}
