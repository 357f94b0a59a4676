package org.docmigrations.pipeline.store;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.docmigrations.pipeline.ir.DocumentRow;
import org.docmigrations.pipeline.ir.VersionMarker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * A DocumentStore held in memory, for tests and dry runs.
 *
 * Rows are ordered by version marker and then by id, the way a version-keyed view would sort
 * them. Callers always receive copies, so in-flight edits never leak into the stored state.
 */
public class InMemoryDocumentStore implements DocumentStore {
    public static final String ID_FIELD = "_id";

    private final VersionMarker versionMarker;
    private final Map<String, JsonNode> documents = new ConcurrentHashMap<>();
    private final List<ObjectNode> writes = new CopyOnWriteArrayList<>();

    public InMemoryDocumentStore() {
        this(VersionMarker.defaultMarker());
    }

    public InMemoryDocumentStore(VersionMarker versionMarker) {
        this.versionMarker = versionMarker;
    }

    /**
     * Store a document under {@code id}, bypassing the write log. Object bodies get {@code _id} set to
     * {@code id} so a later upsert of the same body replaces this entry. Non-object bodies are kept as
     * is for malformed-row cases.
     */
    public InMemoryDocumentStore put(String id, JsonNode document) {
        var copy = document.deepCopy();
        if (copy.isObject()) {
            ((ObjectNode) copy).put(ID_FIELD, id);
        }
        documents.put(id, copy);
        return this;
    }

    @Override
    public Mono<List<DocumentRow>> queryByVersion(int endVersionExclusive, Integer limit, boolean includeDocs) {
        return Mono.fromCallable(() -> documents.entrySet().stream()
            .filter(e -> versionMarker.read(e.getValue()) < endVersionExclusive)
            .sorted(Comparator.<Map.Entry<String, JsonNode>>comparingInt(e -> versionMarker.read(e.getValue()))
                .thenComparing(Map.Entry::getKey))
            .limit(limit == null ? Long.MAX_VALUE : limit)
            .map(e -> new DocumentRow(e.getKey(), includeDocs ? e.getValue().deepCopy() : null))
            .collect(Collectors.toList()));
    }

    @Override
    public Mono<Void> upsert(ObjectNode document) {
        return Mono.fromRunnable(() -> {
            var id = Optional.ofNullable(document.get(ID_FIELD))
                .map(JsonNode::asText)
                .orElseGet(() -> {
                    var generated = UUID.randomUUID().toString();
                    document.put(ID_FIELD, generated);
                    return generated;
                });
            var copy = document.deepCopy();
            documents.put(id, copy);
            writes.add(copy);
        });
    }

    public Optional<JsonNode> get(String id) {
        return Optional.ofNullable(documents.get(id)).map(JsonNode::deepCopy);
    }

    public int size() {
        return documents.size();
    }

    /** Every document written through {@link #upsert}, in completion order. */
    public List<ObjectNode> getWrites() {
        return Collections.unmodifiableList(writes);
    }
}
