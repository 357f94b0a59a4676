package org.docmigrations.couchdb;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.docmigrations.couchdb.http.HttpResponse;
import org.docmigrations.couchdb.http.RestClient;
import org.docmigrations.pipeline.ir.DocumentRow;
import org.docmigrations.pipeline.store.DocumentStore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * DocumentStore backed by a CouchDB database.
 *
 * Candidates come from a view keyed by version marker; {@code endkey} is inclusive, so a bound of
 * {@code v} queries up to {@code v - 1}. Documents are written back with {@code POST /{db}}, which
 * updates in place when the body carries {@code _id} and {@code _rev}.
 */
@Slf4j
public class CouchDbDocumentStore implements DocumentStore {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final CouchDbConnection connection;
    private final RestClient client;

    public CouchDbDocumentStore(CouchDbConnection connection) {
        this(connection, new RestClient(connection));
    }

    public CouchDbDocumentStore(CouchDbConnection connection, RestClient client) {
        this.connection = connection;
        this.client = client;
    }

    @Override
    public Mono<List<DocumentRow>> queryByVersion(int endVersionExclusive, Integer limit, boolean includeDocs) {
        var query = new StringBuilder(viewPath())
            .append("?include_docs=").append(includeDocs)
            .append("&endkey=").append(endVersionExclusive - 1);
        if (limit != null) {
            query.append("&limit=").append(limit);
        }
        return client.getAsync(query.toString())
            .flatMap(response -> requireSuccess("View query", response))
            .flatMap(response -> Mono.fromCallable(() -> parseRows(response.body, includeDocs)));
    }

    @Override
    public Mono<Void> upsert(ObjectNode document) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(document))
            .flatMap(body -> client.postAsync(encode(connection.getDatabase()), body))
            .flatMap(response -> requireSuccess("Document write", response))
            .doOnNext(response -> updateRevision(document, response))
            .then();
    }

    /**
     * Create the design document holding the version view unless it already exists.
     *
     * @return true when the view was created, false when a design document was already there
     */
    public Mono<Boolean> installVersionView(String versionField) {
        if (!FIELD_NAME.matcher(versionField).matches()) {
            return Mono.error(new IllegalArgumentException("Unsupported version field name: " + versionField));
        }
        var designDocument = objectMapper.createObjectNode();
        designDocument.putObject("views")
            .putObject(connection.getView())
            .put("map", "function (doc) { emit(doc." + versionField + " || 0, null); }");
        var path = encode(connection.getDatabase()) + "/_design/" + encode(connection.getDesignDocument());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(designDocument))
            .flatMap(body -> client.putAsync(path, body))
            .flatMap(response -> {
                if (response.statusCode == 409) {
                    log.info("Design document {} already exists", connection.getDesignDocument());
                    return Mono.just(false);
                }
                return requireSuccess("View creation", response).thenReturn(true);
            })
            .doOnNext(created -> {
                if (created) {
                    log.info("Created view {}/{} keyed on {}", connection.getDesignDocument(),
                        connection.getView(), versionField);
                }
            });
    }

    private String viewPath() {
        return encode(connection.getDatabase())
            + "/_design/" + encode(connection.getDesignDocument())
            + "/_view/" + encode(connection.getView());
    }

    private static Mono<HttpResponse> requireSuccess(String operation, HttpResponse response) {
        if (response.isSuccess()) {
            return Mono.just(response);
        }
        return Mono.error(new CouchDbException(operation, response.statusCode, response.body));
    }

    static List<DocumentRow> parseRows(String body, boolean includeDocs) throws IOException {
        if (body == null) {
            throw new IOException("View query returned no body");
        }
        var rows = objectMapper.readTree(body).path("rows");
        var result = new ArrayList<DocumentRow>(rows.size());
        for (JsonNode row : rows) {
            var id = row.path("id").asText(null);
            if (id == null) {
                log.warn("Ignoring view row without id: {}", row);
                continue;
            }
            result.add(new DocumentRow(id, includeDocs ? row.get("doc") : null));
        }
        return result;
    }

    private static void updateRevision(ObjectNode document, HttpResponse response) {
        if (response.body == null) {
            return;
        }
        try {
            var rev = objectMapper.readTree(response.body).path("rev");
            if (rev.isTextual()) {
                document.put("_rev", rev.asText());
            }
        } catch (IOException e) {
            log.atWarn().setMessage("Unable to read revision from write response {}")
                .addArgument(response.body).setCause(e).log();
        }
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8);
    }
}
