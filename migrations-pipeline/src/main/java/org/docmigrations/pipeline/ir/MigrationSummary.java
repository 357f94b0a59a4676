package org.docmigrations.pipeline.ir;

import java.time.Duration;

/**
 * Emitted once a migration run has drained every page.
 *
 * @param targetVersion the version documents were migrated to
 * @param processed documents taken through the migrator, including failures and stalls
 * @param modified documents whose content was rewritten by at least one step
 * @param failed documents whose transform or write failed
 * @param unresolved documents left below the target version at the end of the run
 * @param total candidate estimate taken at run start
 * @param elapsed wall-clock duration of the run
 */
public record MigrationSummary(
    int targetVersion,
    long processed,
    long modified,
    long failed,
    long unresolved,
    long total,
    Duration elapsed
) {}
