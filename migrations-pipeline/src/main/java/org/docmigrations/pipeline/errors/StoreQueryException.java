package org.docmigrations.pipeline.errors;

/**
 * A paging or count query against the document store failed. The run is aborted without retry.
 */
public class StoreQueryException extends MigrationException {
    public StoreQueryException(Throwable cause) {
        super("Unable to retrieve data: " + cause.getMessage(), cause);
    }

    public static Throwable wrap(Throwable t) {
        return t instanceof StoreQueryException ? t : new StoreQueryException(t);
    }
}
