package org.docmigrations.pipeline.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Reads and rewrites the field that records which migration step was last applied to a document.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class VersionMarker {
    public static final String DEFAULT_FIELD_NAME = "migration_version";

    private final String fieldName;

    public VersionMarker(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("The version field name must not be blank");
        }
        this.fieldName = fieldName;
    }

    public static VersionMarker defaultMarker() {
        return new VersionMarker(DEFAULT_FIELD_NAME);
    }

    /** Returns the version recorded on the document, 0 when it is missing or not an integer. */
    public int read(JsonNode document) {
        if (document == null) {
            return 0;
        }
        var value = document.get(fieldName);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            return 0;
        }
        return value.intValue();
    }

    public void stamp(ObjectNode document, int version) {
        document.put(fieldName, version);
    }
}
