package org.docmigrations.pipeline;

import org.docmigrations.pipeline.ir.MigrationResult;
import org.docmigrations.pipeline.ir.VersionMarker;
import org.docmigrations.pipeline.steps.MigrationStep;
import org.docmigrations.pipeline.steps.StepRegistry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Runs the step chain over a single document.
 *
 * Starting from the document's version marker, the applicable step is applied and the document is
 * stamped with that step's version, until the target is reached or no step applies to the current
 * version. A document left below the target is returned as is; callers tell the two outcomes apart
 * with {@link MigrationResult#reachedTarget(int)}. Transform failures are not caught here.
 */
@RequiredArgsConstructor
public class DocumentMigrator {
    private final StepRegistry registry;
    private final VersionMarker versionMarker;

    public Mono<MigrationResult> migrate(ObjectNode document, int targetVersion) {
        return Mono.defer(() -> {
            int startVersion = versionMarker.read(document);
            return Mono.just(new ChainState(document, startVersion, false))
                .expand(state -> advance(state, targetVersion))
                .last()
                .map(end -> new MigrationResult(end.document(), end.modified(), startVersion, end.version()));
        });
    }

    private Mono<ChainState> advance(ChainState state, int targetVersion) {
        if (state.version() >= targetVersion) {
            return Mono.empty();
        }
        return Mono.justOrEmpty(registry.stepFrom(state.version()))
            .flatMap(step -> apply(step, state));
    }

    private Mono<ChainState> apply(MigrationStep step, ChainState state) {
        return step.applyTo(state.document())
            .map(replacement -> stamp(replacement, step, true))
            .switchIfEmpty(Mono.fromSupplier(() -> stamp(state.document(), step, state.modified())));
    }

    private ChainState stamp(ObjectNode working, MigrationStep step, boolean modified) {
        versionMarker.stamp(working, step.version());
        return new ChainState(working, step.version(), modified);
    }

    private record ChainState(ObjectNode document, int version, boolean modified) {}
}
