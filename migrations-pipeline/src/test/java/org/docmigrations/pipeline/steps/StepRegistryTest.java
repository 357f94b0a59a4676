package org.docmigrations.pipeline.steps;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StepRegistryTest {

    @Test
    void sortsStepsAndExposesHighestVersion() {
        var registry = StepRegistry.of(List.of(
            MigrationStep.stampOnly(3, "c"),
            MigrationStep.stampOnly(1, "a"),
            MigrationStep.stampOnly(7, "g"),
            MigrationStep.stampOnly(2, "b")));

        assertEquals(List.of(1, 2, 3, 7), registry.steps().stream().map(MigrationStep::version).toList());
        assertEquals(7, registry.last().getAsInt());
        assertEquals(4, registry.size());
    }

    @Test
    void eachStepAppliesFromThePreviousVersion() {
        var registry = StepRegistry.of(List.of(
            MigrationStep.stampOnly(2, "b"),
            MigrationStep.stampOnly(5, "e")));

        assertEquals(2, registry.stepFrom(0).orElseThrow().version());
        assertEquals(5, registry.stepFrom(2).orElseThrow().version());
        assertTrue(registry.stepFrom(1).isEmpty());
        assertTrue(registry.stepFrom(5).isEmpty());
    }

    @Test
    void emptyRegistryHasNoLastVersion() {
        var registry = StepRegistry.of(List.of());

        assertTrue(registry.isEmpty());
        assertTrue(registry.last().isEmpty());
        assertTrue(registry.stepFrom(0).isEmpty());
        assertTrue(StepRegistry.empty().last().isEmpty());
    }

    @Test
    void rejectsDuplicateVersions() {
        var steps = List.of(MigrationStep.stampOnly(1, "a"), MigrationStep.stampOnly(1, "again"));

        var e = assertThrows(IllegalArgumentException.class, () -> StepRegistry.of(steps));
        assertTrue(e.getMessage().contains("Duplicate step version 1"));
    }

    @Test
    void rejectsNonPositiveVersions() {
        var steps = List.of(MigrationStep.stampOnly(0, "zero"));

        assertThrows(IllegalArgumentException.class, () -> StepRegistry.of(steps));
    }

    @Test
    void stepsListIsReadOnly() {
        var registry = StepRegistry.of(List.of(MigrationStep.stampOnly(1, "a")));

        assertThrows(UnsupportedOperationException.class,
            () -> registry.steps().add(MigrationStep.stampOnly(2, "b")));
    }
}
