package org.docmigrations.pipeline.store;

import java.util.List;

import org.docmigrations.pipeline.ir.DocumentRow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Port for the versioned document store the migrations run against.
 *
 * Queries return documents whose version marker is below a bound, in the store's own key order.
 * That order has to be stable across repeated queries, and a document written back with a
 * version at or above the bound must stop matching.
 */
public interface DocumentStore extends AutoCloseable {

    /**
     * Fetch documents whose version marker is strictly below {@code endVersionExclusive}.
     *
     * @param limit maximum number of rows, or null for every matching row
     * @param includeDocs whether rows carry the document body
     */
    Mono<List<DocumentRow>> queryByVersion(int endVersionExclusive, Integer limit, boolean includeDocs);

    /** Count documents whose version marker is strictly below {@code endVersionExclusive}. */
    default Mono<Long> countByVersion(int endVersionExclusive) {
        return queryByVersion(endVersionExclusive, null, false).map(rows -> (long) rows.size());
    }

    /** Create or overwrite the given document. */
    Mono<Void> upsert(ObjectNode document);

    @Override
    default void close() throws Exception {
        // Default no-op for stores that don't hold resources
    }
}
