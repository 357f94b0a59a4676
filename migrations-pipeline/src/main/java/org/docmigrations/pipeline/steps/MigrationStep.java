package org.docmigrations.pipeline.steps;

import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * A versioned migration unit. {@code version} is the marker a document is stamped with once the
 * step has been applied; a null transform makes the step stamp-only.
 */
public record MigrationStep(
    int version,
    String name,
    StepTransform transform
) {
    public static MigrationStep stampOnly(int version, String name) {
        return new MigrationStep(version, name, null);
    }

    /** Wraps a synchronous rewrite. A null return from {@code rewrite} means no content change. */
    public static MigrationStep of(int version, String name, UnaryOperator<ObjectNode> rewrite) {
        return new MigrationStep(version, name, doc -> Mono.fromSupplier(() -> rewrite.apply(doc)));
    }

    public boolean isStampOnly() {
        return transform == null;
    }

    public Mono<ObjectNode> applyTo(ObjectNode document) {
        if (transform == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> transform.apply(document));
    }

    @Override
    public String toString() {
        return "MigrationStep[v" + version + (name != null ? " " + name : "") + "]";
    }
}
