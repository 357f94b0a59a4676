package org.docmigrations.pipeline;

import java.time.Duration;

import org.docmigrations.pipeline.ir.VersionMarker;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for a migration run.
 */
@Value
public class MigrationSettings {
    public static final int DEFAULT_PAGE_SIZE = 512;
    public static final Duration DEFAULT_PROGRESS_INTERVAL = Duration.ofSeconds(5);

    String versionField;
    int pageSize;
    Duration progressInterval;

    @Builder
    private MigrationSettings(String versionField, Integer pageSize, Duration progressInterval) {
        this.versionField = versionField != null ? versionField : VersionMarker.DEFAULT_FIELD_NAME;
        this.pageSize = pageSize != null ? pageSize : DEFAULT_PAGE_SIZE;
        this.progressInterval = progressInterval != null ? progressInterval : DEFAULT_PROGRESS_INTERVAL;
        if (this.pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + this.pageSize);
        }
        if (this.progressInterval.isNegative() || this.progressInterval.isZero()) {
            throw new IllegalArgumentException("Progress interval must be positive, got " + this.progressInterval);
        }
    }

    public static MigrationSettings defaults() {
        return builder().build();
    }

    public VersionMarker versionMarker() {
        return new VersionMarker(versionField);
    }
}
