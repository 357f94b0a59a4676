package org.docmigrations.couchdb;

import lombok.Getter;

/**
 * CouchDB answered with a status the store does not accept.
 */
@Getter
public class CouchDbException extends RuntimeException {
    private final int statusCode;
    private final String responseBody;

    public CouchDbException(String operation, int statusCode, String responseBody) {
        super(operation + " failed with status " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
}
