package org.docmigrations.pipeline.errors;

public class NoStepsFoundException extends MigrationException {
    public NoStepsFoundException() {
        super("No migrations found");
    }
}
