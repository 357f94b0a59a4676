package org.docmigrations.pipeline.source;

import java.util.List;

import org.docmigrations.pipeline.steps.MigrationStep;

import reactor.core.publisher.Mono;

/**
 * Port for discovering migration steps (classpath, a directory of jars, a fixed list in tests).
 * The steps may come back in any order. Closing a source may unload the step classes it found, so
 * close it only once no migration uses them anymore.
 */
public interface StepSource extends AutoCloseable {

    /**
     * Returns a cold Mono; subscription triggers the discovery.
     */
    Mono<List<MigrationStep>> loadSteps();

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources
    }
}
