package org.docmigrations.pipeline.errors;

/**
 * Base type for failures surfaced by a migration run.
 */
public class MigrationException extends RuntimeException {
    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
