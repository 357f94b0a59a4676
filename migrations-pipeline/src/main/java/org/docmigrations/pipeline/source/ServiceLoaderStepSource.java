package org.docmigrations.pipeline.source;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import org.docmigrations.pipeline.steps.MigrationStep;
import org.docmigrations.pipeline.steps.MigrationStepProvider;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Collects the steps of every {@link MigrationStepProvider} visible to a class loader.
 */
@Slf4j
public class ServiceLoaderStepSource implements StepSource {
    private final ClassLoader classLoader;

    public ServiceLoaderStepSource() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderStepSource(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Mono<List<MigrationStep>> loadSteps() {
        return Mono.fromCallable(this::discover);
    }

    private List<MigrationStep> discover() {
        var steps = new ArrayList<MigrationStep>();
        for (var provider : ServiceLoader.load(MigrationStepProvider.class, classLoader)) {
            var provided = provider.steps();
            log.info("Loaded {} migration steps from {}", provided.size(), provider.getClass().getName());
            steps.addAll(provided);
        }
        if (steps.isEmpty()) {
            log.warn("No migration step providers found");
        }
        return steps;
    }
}
