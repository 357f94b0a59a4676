package org.docmigrations.pipeline.errors;

import lombok.Getter;

/**
 * Writing a migrated document back to the store failed. Counted against the run, never fatal to it.
 */
@Getter
public class PersistenceException extends MigrationException {
    private final String documentId;

    public PersistenceException(String documentId, Throwable cause) {
        super("Unable to store document " + documentId + ": " + cause.getMessage(), cause);
        this.documentId = documentId;
    }
}
