package org.docmigrations.pipeline.source;

import java.util.Arrays;
import java.util.List;

import org.docmigrations.pipeline.steps.MigrationStep;

import reactor.core.publisher.Mono;

/**
 * Step source backed by a fixed list, for embedding the engine and for tests.
 */
public class StaticStepSource implements StepSource {
    private final List<MigrationStep> steps;

    public StaticStepSource(List<MigrationStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public static StaticStepSource of(MigrationStep... steps) {
        return new StaticStepSource(Arrays.asList(steps));
    }

    @Override
    public Mono<List<MigrationStep>> loadSteps() {
        return Mono.just(steps);
    }
}
