package org.docmigrations.pipeline.steps;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Content rewrite performed by a migration step.
 *
 * An empty Mono means the content is left as is and only the version marker advances.
 * A returned document replaces the working document, which marks the chain as modified.
 * Edits made in place on the argument are not detected unless the document is returned.
 */
@FunctionalInterface
public interface StepTransform {
    Mono<ObjectNode> apply(ObjectNode document);
}
