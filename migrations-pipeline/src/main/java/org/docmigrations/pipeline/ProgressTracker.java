package org.docmigrations.pipeline;

import java.time.Duration;
import java.util.function.Consumer;

import org.docmigrations.pipeline.ir.ProgressSnapshot;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Counters for one migration run plus the timer that reports them.
 *
 * The timer only reports; it never gates the batch loop. Counter updates and snapshots share one
 * lock so that {@code written <= done} holds in every snapshot.
 */
@Slf4j
public class ProgressTracker {
    public static final Consumer<ProgressSnapshot> LOGGING_REPORTER = ProgressTracker::logProgress;

    private final Duration interval;
    private final Scheduler scheduler;
    private final Consumer<ProgressSnapshot> reporter;

    private long done;
    private long written;
    private long failed;
    private long total;
    private Disposable timer;

    public ProgressTracker(Duration interval) {
        this(interval, Schedulers.parallel(), LOGGING_REPORTER);
    }

    public ProgressTracker(Duration interval, Scheduler scheduler, Consumer<ProgressSnapshot> reporter) {
        this.interval = interval;
        this.scheduler = scheduler;
        this.reporter = reporter;
    }

    /**
     * Record the candidate estimate and start periodic reporting.
     *
     * @throws IllegalStateException if the tracker is already running
     */
    public synchronized ProgressTracker start(long totalEstimate) {
        if (timer != null) {
            throw new IllegalStateException("Progress tracker already started");
        }
        this.total = totalEstimate;
        this.timer = Flux.interval(interval, interval, scheduler)
            .subscribe(tick -> reporter.accept(snapshot()));
        return this;
    }

    /** Count one processed document, and one written document when {@code modified}. */
    public synchronized void tick(boolean modified) {
        done++;
        if (modified) {
            written++;
        }
    }

    /** Count one document whose migration or write failed. */
    public synchronized void tickFailed() {
        done++;
        failed++;
    }

    public synchronized ProgressSnapshot snapshot() {
        return new ProgressSnapshot(done, written, failed, total);
    }

    public synchronized boolean isRunning() {
        return timer != null && !timer.isDisposed();
    }

    /** Cancel periodic reporting. Safe to call more than once. */
    public synchronized void stop() {
        if (timer != null) {
            timer.dispose();
        }
    }

    private static void logProgress(ProgressSnapshot snapshot) {
        log.info("Migration: {}/{}", snapshot.done(), snapshot.total());
    }
}
