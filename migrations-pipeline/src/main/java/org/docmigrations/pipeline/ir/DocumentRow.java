package org.docmigrations.pipeline.ir;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One row returned by a version query. The store owns the identity; the document body is
 * absent for count-only queries and may be something other than a JSON object for rows the
 * store could not parse.
 */
public record DocumentRow(
    String id,
    JsonNode document
) {
    public DocumentRow {
        Objects.requireNonNull(id, "Document rows must carry an id");
    }

    /** True when the row carries a JSON object that can be migrated. */
    public boolean isWellFormed() {
        return document instanceof ObjectNode;
    }

    public ObjectNode objectDocument() {
        if (!isWellFormed()) {
            throw new IllegalStateException("Row " + id + " does not hold a JSON object");
        }
        return (ObjectNode) document;
    }
}
