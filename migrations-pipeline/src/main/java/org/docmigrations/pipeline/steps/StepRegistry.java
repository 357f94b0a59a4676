package org.docmigrations.pipeline.steps;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import lombok.extern.slf4j.Slf4j;

/**
 * Ordered set of migration steps. Steps are sorted by version; each step applies to documents
 * stamped with the version of the step before it, and the first step applies to version 0.
 * Because versions are unique and increasing, every applied step moves a document strictly forward.
 */
@Slf4j
public final class StepRegistry {
    private static final StepRegistry EMPTY = new StepRegistry(List.of());

    private final List<MigrationStep> steps;
    private final Map<Integer, MigrationStep> stepsByStartVersion;

    private StepRegistry(List<MigrationStep> sortedSteps) {
        this.steps = Collections.unmodifiableList(sortedSteps);
        this.stepsByStartVersion = new HashMap<>();
        int previous = 0;
        for (var step : sortedSteps) {
            stepsByStartVersion.put(previous, step);
            previous = step.version();
        }
    }

    public static StepRegistry empty() {
        return EMPTY;
    }

    /**
     * Builds a registry from steps in any order.
     *
     * @throws IllegalArgumentException if a version is not positive or appears twice
     */
    public static StepRegistry of(Collection<MigrationStep> unorderedSteps) {
        var sorted = new ArrayList<>(unorderedSteps);
        sorted.sort(Comparator.comparingInt(MigrationStep::version));
        MigrationStep previous = null;
        for (var step : sorted) {
            if (step.version() <= 0) {
                throw new IllegalArgumentException("Step versions must be positive, got " + step);
            }
            if (previous != null && previous.version() == step.version()) {
                throw new IllegalArgumentException("Duplicate step version " + step.version()
                    + ": " + previous + " and " + step);
            }
            previous = step;
        }
        log.atDebug().setMessage("Registered {} migration steps: {}").addArgument(sorted::size)
            .addArgument(sorted).log();
        return new StepRegistry(sorted);
    }

    /** The step that applies to a document currently stamped with {@code version}, if any. */
    public Optional<MigrationStep> stepFrom(int version) {
        return Optional.ofNullable(stepsByStartVersion.get(version));
    }

    /** The highest known version, unset when no steps are registered. */
    public OptionalInt last() {
        return steps.isEmpty() ? OptionalInt.empty() : OptionalInt.of(steps.get(steps.size() - 1).version());
    }

    public List<MigrationStep> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
