package org.docmigrations.pipeline;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.docmigrations.pipeline.errors.NoStepsFoundException;
import org.docmigrations.pipeline.errors.StoreQueryException;
import org.docmigrations.pipeline.ir.MigrationSummary;
import org.docmigrations.pipeline.ir.ProgressSnapshot;
import org.docmigrations.pipeline.source.StepSource;
import org.docmigrations.pipeline.steps.StepRegistry;
import org.docmigrations.pipeline.store.DocumentStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for migrating a document store to a schema version.
 *
 * Steps are loaded once per orchestrator; concurrent callers share the same load, and a failed
 * load is retried by the next caller. Every call to {@link #runMigrations(Integer)} gets its own
 * progress counters and batch state.
 */
@Slf4j
public class MigrationOrchestrator {
    private static final Duration FOREVER = Duration.ofMillis(Long.MAX_VALUE);

    public enum LoadState {
        UNLOADED,
        LOADING,
        LOADED
    }

    private final DocumentStore store;
    private final MigrationSettings settings;
    private final Scheduler progressScheduler;
    private final Consumer<ProgressSnapshot> progressReporter;

    private final AtomicReference<LoadState> loadState = new AtomicReference<>(LoadState.UNLOADED);
    private final AtomicReference<ProgressTracker> lastRunProgress = new AtomicReference<>();
    private final Mono<StepRegistry> registry;

    public MigrationOrchestrator(StepSource stepSource, DocumentStore store, MigrationSettings settings) {
        this(stepSource, store, settings, Schedulers.parallel(), null);
    }

    /**
     * @param progressReporter receives each periodic progress snapshot; null logs them
     */
    public MigrationOrchestrator(StepSource stepSource,
                                 DocumentStore store,
                                 MigrationSettings settings,
                                 Scheduler progressScheduler,
                                 Consumer<ProgressSnapshot> progressReporter) {
        this.store = store;
        this.settings = settings;
        this.progressScheduler = progressScheduler;
        this.progressReporter = progressReporter != null ? progressReporter : ProgressTracker.LOGGING_REPORTER;
        this.registry = Mono.defer(stepSource::loadSteps)
            .doOnSubscribe(s -> loadState.set(LoadState.LOADING))
            .map(StepRegistry::of)
            .doOnNext(loaded -> {
                log.info("Loaded {} migration steps, latest version {}", loaded.size(),
                    loaded.last().isPresent() ? loaded.last().getAsInt() : "none");
                loadState.set(LoadState.LOADED);
            })
            .doOnError(e -> {
                log.error("Unable to load migration steps", e);
                loadState.set(LoadState.UNLOADED);
            })
            .cache(loaded -> FOREVER, e -> Duration.ZERO, () -> Duration.ZERO);
    }

    /** Load the migration steps if that has not happened yet. */
    public Mono<StepRegistry> loadSteps() {
        return registry;
    }

    public LoadState getLoadState() {
        return loadState.get();
    }

    /** Counters of the most recent run, whether it completed or not. */
    public Optional<ProgressSnapshot> lastRunProgress() {
        return Optional.ofNullable(lastRunProgress.get()).map(ProgressTracker::snapshot);
    }

    /**
     * Migrate every document below {@code targetVersion}.
     *
     * @param targetVersion version to migrate to, or null for the highest known step version
     * @return the run summary; signals {@link NoStepsFoundException} when no step is registered and
     *         {@link StoreQueryException} when a store query fails
     */
    public Mono<MigrationSummary> runMigrations(Integer targetVersion) {
        return loadSteps().flatMap(loaded -> {
            var last = loaded.last();
            if (last.isEmpty()) {
                return Mono.error(new NoStepsFoundException());
            }
            int target = targetVersion != null ? targetVersion : last.getAsInt();
            return execute(loaded, target);
        });
    }

    private Mono<MigrationSummary> execute(StepRegistry loaded, int targetVersion) {
        return Mono.defer(() -> {
            log.info("Running migrations up to version {}", targetVersion);
            long startedAt = System.nanoTime();
            var tracker = newTracker();
            lastRunProgress.set(tracker);
            var processor = new BatchProcessor(store,
                new DocumentMigrator(loaded, settings.versionMarker()),
                tracker);

            return store.countByVersion(targetVersion)
                .onErrorMap(StoreQueryException::wrap)
                .flatMap(total -> Mono.using(
                    () -> tracker.start(total),
                    started -> processor.run(targetVersion, settings.getPageSize())
                        .then(Mono.fromSupplier(() -> summarize(targetVersion, tracker, processor, startedAt))),
                    ProgressTracker::stop))
                .doOnNext(summary -> log.info(
                    "Migrations finished, {} documents processed, {} documents modified, {} failed, {} left below version {}.",
                    summary.processed(), summary.modified(), summary.failed(), summary.unresolved(),
                    summary.targetVersion()));
        });
    }

    private ProgressTracker newTracker() {
        return new ProgressTracker(settings.getProgressInterval(), progressScheduler, progressReporter);
    }

    private static MigrationSummary summarize(int targetVersion,
                                              ProgressTracker tracker,
                                              BatchProcessor processor,
                                              long startedAt) {
        var counters = tracker.snapshot();
        return new MigrationSummary(
            targetVersion,
            counters.done(),
            counters.written(),
            counters.failed(),
            processor.unresolvedCount(),
            counters.total(),
            Duration.ofNanos(System.nanoTime() - startedAt));
    }
}
