package org.docmigrations.pipeline;

import java.util.concurrent.atomic.AtomicInteger;

import org.docmigrations.pipeline.ir.VersionMarker;
import org.docmigrations.pipeline.steps.MigrationStep;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Document and step fixtures shared by the pipeline tests.
 */
public final class TestDocuments {
    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final VersionMarker MARKER = VersionMarker.defaultMarker();

    private TestDocuments() {}

    public static ObjectNode doc(String id, int version) {
        var doc = MAPPER.createObjectNode();
        doc.put("_id", id);
        MARKER.stamp(doc, version);
        return doc;
    }

    public static ObjectNode unversioned(String id) {
        var doc = MAPPER.createObjectNode();
        doc.put("_id", id);
        return doc;
    }

    /** A step that sets {@code field} to the step version and returns the document as a replacement. */
    public static MigrationStep settingField(int version, String field) {
        return new MigrationStep(version, "set-" + field, doc -> {
            doc.put(field, version);
            return Mono.just(doc);
        });
    }

    /** A stamp-only step that counts how often it ran. */
    public static MigrationStep counting(int version, AtomicInteger counter) {
        return new MigrationStep(version, "count-" + version, doc -> {
            counter.incrementAndGet();
            return Mono.empty();
        });
    }
}
