package org.docmigrations.pipeline.ir;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of running the step chain over one document.
 *
 * @param document the working document after the last applied step
 * @param modified true once any step returned replacement content, even if later steps did not
 * @param startVersion version marker before the first step
 * @param endVersion version marker after the last applied step
 */
public record MigrationResult(
    ObjectNode document,
    boolean modified,
    int startVersion,
    int endVersion
) {
    /** True when at least one step stamped the document. */
    public boolean advanced() {
        return endVersion != startVersion;
    }

    /** True when the document differs from what the store holds and needs to be written back. */
    public boolean changed() {
        return modified || advanced();
    }

    public boolean reachedTarget(int targetVersion) {
        return endVersion >= targetVersion;
    }
}
