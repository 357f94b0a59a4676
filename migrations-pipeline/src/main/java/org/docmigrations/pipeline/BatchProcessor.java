package org.docmigrations.pipeline;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.docmigrations.pipeline.errors.PersistenceException;
import org.docmigrations.pipeline.errors.StoreQueryException;
import org.docmigrations.pipeline.ir.DocumentRow;
import org.docmigrations.pipeline.ir.MigrationResult;
import org.docmigrations.pipeline.store.DocumentStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Pages through every document below the target version and migrates it.
 *
 * Each page is queried with the same version bound, so documents written back at the target fall
 * out of the next query. Pages run strictly one after another; within a page at most
 * {@link #MAX_IN_FLIGHT_DOCUMENTS} documents are being migrated or written at once.
 *
 * Documents that cannot reach the target (no applicable step, malformed body, failed transform or
 * write) are remembered for the rest of the run and skipped when they come back. Each query asks
 * for {@code pageSize} rows beyond the remembered ones, so rows sorting after them are still
 * reached. The run ends once a query returns nothing but remembered rows. One instance serves one
 * run.
 */
@Slf4j
public class BatchProcessor {
    public static final int MAX_IN_FLIGHT_DOCUMENTS = 32;

    private final DocumentStore store;
    private final DocumentMigrator migrator;
    private final ProgressTracker progress;
    private final Set<String> unresolved = ConcurrentHashMap.newKeySet();

    public BatchProcessor(DocumentStore store, DocumentMigrator migrator, ProgressTracker progress) {
        this.store = store;
        this.migrator = migrator;
        this.progress = progress;
    }

    /**
     * Migrate every candidate document to {@code targetVersion}.
     * Signals {@link StoreQueryException} as soon as a page query fails.
     */
    public Mono<Void> run(int targetVersion, int pageSize) {
        return Mono.defer(() -> processNextPage(targetVersion, pageSize))
            .repeat()
            .takeUntil(outcome -> outcome != PageOutcome.CONTINUE)
            .last(PageOutcome.EXHAUSTED)
            .doOnNext(outcome -> {
                if (outcome == PageOutcome.STALLED) {
                    log.warn("Stopping with {} documents left below version {}", unresolved.size(), targetVersion);
                }
            })
            .then();
    }

    /** Documents seen during this run that are still below the target version. */
    public int unresolvedCount() {
        return unresolved.size();
    }

    private Mono<PageOutcome> processNextPage(int targetVersion, int pageSize) {
        return store.queryByVersion(targetVersion, queryLimit(pageSize), true)
            .onErrorMap(StoreQueryException::wrap)
            .flatMap(rows -> {
                if (rows.isEmpty()) {
                    return Mono.just(PageOutcome.EXHAUSTED);
                }
                var fresh = withoutUnresolved(rows, pageSize);
                if (fresh.isEmpty()) {
                    return Mono.just(PageOutcome.STALLED);
                }
                log.debug("{} documents in current page.", fresh.size());
                return Flux.fromIterable(fresh)
                    .flatMap(row -> processRow(row, targetVersion), MAX_IN_FLIGHT_DOCUMENTS)
                    .then(Mono.just(PageOutcome.CONTINUE));
            });
    }

    // At most unresolved.size() rows can be remembered ones, so a result made only of them is the
    // whole candidate set.
    private int queryLimit(int pageSize) {
        return (int) Math.min(Integer.MAX_VALUE, (long) pageSize + unresolved.size());
    }

    private List<DocumentRow> withoutUnresolved(List<DocumentRow> rows, int pageSize) {
        return rows.stream()
            .filter(row -> !unresolved.contains(row.id()))
            .limit(pageSize)
            .collect(Collectors.toList());
    }

    private Mono<Void> processRow(DocumentRow row, int targetVersion) {
        if (!row.isWellFormed()) {
            log.warn("Skipping document {}: body is not a JSON object", row.id());
            unresolved.add(row.id());
            progress.tick(false);
            return Mono.empty();
        }
        return migrator.migrate(row.objectDocument(), targetVersion)
            .flatMap(result -> persist(row.id(), result, targetVersion))
            .doOnError(error -> log.error("Migration of document {} failed", row.id(), error))
            // One bad document must not stall the rest of the run
            .onErrorResume(error -> {
                unresolved.add(row.id());
                progress.tickFailed();
                return Mono.empty();
            });
    }

    private Mono<Void> persist(String id, MigrationResult result, int targetVersion) {
        if (!result.reachedTarget(targetVersion)) {
            log.warn("Document {} stopped at version {} below target {}: no step registered from version {}",
                id, result.endVersion(), targetVersion, result.endVersion());
            unresolved.add(id);
        }
        if (!result.changed()) {
            progress.tick(false);
            return Mono.empty();
        }
        return store.upsert(result.document())
            .onErrorMap(error -> new PersistenceException(id, error))
            .doOnSuccess(unused -> progress.tick(result.modified()));
    }

    private enum PageOutcome {
        CONTINUE,
        EXHAUSTED,
        STALLED
    }
}
