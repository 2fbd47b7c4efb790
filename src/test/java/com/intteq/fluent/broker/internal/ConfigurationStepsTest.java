package com.intteq.fluent.broker.internal;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigurationStepsTest {

    @Test
    void appliesStepsInDeclarationOrder() {
        ConfigurationSteps<List<String>> steps = new ConfigurationSteps<>();
        steps.add(target -> target.add("connection"));
        steps.add(target -> target.add("publications"));
        steps.add(target -> target.add("subscriptions"));

        List<String> target = new ArrayList<>();
        steps.applyTo(target);

        assertEquals(List.of("connection", "publications", "subscriptions"), target);
        assertTrue(steps.isApplied());
    }

    @Test
    void nothingRunsBeforeApply() {
        List<String> target = new ArrayList<>();
        ConfigurationSteps<List<String>> steps = new ConfigurationSteps<>();
        steps.add(t -> t.add("step"));

        assertTrue(target.isEmpty());
        assertEquals(1, steps.size());
    }

    @Test
    void secondApplyFails() {
        ConfigurationSteps<List<String>> steps = new ConfigurationSteps<>();
        List<String> target = new ArrayList<>();
        steps.add(t -> t.add("once"));
        steps.applyTo(target);

        assertThrows(IllegalStateException.class, () -> steps.applyTo(target));
        assertEquals(List.of("once"), target);
    }

    @Test
    void addingAfterApplyFails() {
        ConfigurationSteps<List<String>> steps = new ConfigurationSteps<>();
        steps.applyTo(new ArrayList<>());

        assertThrows(IllegalStateException.class, () -> steps.add(t -> t.add("late")));
    }
}
