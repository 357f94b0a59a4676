package org.docmigrations.couchdb;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import com.beust.jcommander.Parameter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Connection settings for a CouchDB database and the view that indexes documents by version.
 */
@Getter
@EqualsAndHashCode(exclude = {"password"})
@ToString(exclude = {"password"})
public class CouchDbConnection {
    public static final String DEFAULT_DESIGN_DOCUMENT = "migrations";
    public static final String DEFAULT_VIEW = "list";

    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final String database;
    private final String designDocument;
    private final String view;
    private final String username;
    private final String password;
    private final boolean insecure;

    private CouchDbConnection(IParams params) {
        if (params.getUrl() == null) {
            throw new IllegalArgumentException("No CouchDB url was found");
        }
        if (params.getDatabase() == null || params.getDatabase().isBlank()) {
            throw new IllegalArgumentException("No database name was found");
        }

        try {
            var raw = params.getUrl().endsWith("/")
                ? params.getUrl().substring(0, params.getUrl().length() - 1)
                : params.getUrl();
            uri = new URI(raw); // e.g. http://localhost:5984
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol: " + uri.getScheme());
        }

        if (params.getUsername() != null ^ params.getPassword() != null) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }

        this.database = params.getDatabase();
        this.designDocument = Optional.ofNullable(params.getDesignDocument()).orElse(DEFAULT_DESIGN_DOCUMENT);
        this.view = Optional.ofNullable(params.getView()).orElse(DEFAULT_VIEW);
        this.username = params.getUsername();
        this.password = params.getPassword();
        this.insecure = params.isInsecure();
    }

    /** Value of the Authorization header when basic auth is configured. */
    public Optional<String> basicAuthHeader() {
        if (username == null) {
            return Optional.empty();
        }
        var credentials = username + ":" + password;
        return Optional.of("Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
    }

    public interface IParams {
        String getUrl();

        String getDatabase();

        String getDesignDocument();

        String getView();

        String getUsername();

        String getPassword();

        boolean isInsecure();

        default CouchDbConnection toConnection() {
            return new CouchDbConnection(this);
        }
    }

    @Getter
    public static class ConnectionArgs implements IParams {
        @Parameter(
            names = {"--couchdb-url", "--couchdbUrl"},
            description = "The CouchDB server url (e.g. http://localhost:5984)",
            required = true)
        public String url;

        @Parameter(
            names = {"--database"},
            description = "The database whose documents will be migrated",
            required = true)
        public String database;

        @Parameter(
            names = {"--design-doc", "--designDoc"},
            description = "Optional. The design document holding the version view. Default: " + DEFAULT_DESIGN_DOCUMENT)
        public String designDocument = DEFAULT_DESIGN_DOCUMENT;

        @Parameter(
            names = {"--view"},
            description = "Optional. The view emitting each document's version as key. Default: " + DEFAULT_VIEW)
        public String view = DEFAULT_VIEW;

        @Parameter(
            names = {"--username"},
            description = "Optional. The username for basic auth")
        public String username = null;

        @Parameter(
            names = {"--password"},
            description = "Optional. The password for basic auth")
        public String password = null;

        @Parameter(
            names = {"--insecure"},
            description = "Optional. Allow untrusted TLS certificates. Default: false")
        public boolean insecure = false;
    }
}
