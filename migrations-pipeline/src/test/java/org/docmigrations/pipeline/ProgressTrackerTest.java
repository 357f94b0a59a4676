package org.docmigrations.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.docmigrations.pipeline.ir.ProgressSnapshot;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private VirtualTimeScheduler scheduler;
    private List<ProgressSnapshot> reports;
    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        reports = new CopyOnWriteArrayList<>();
        tracker = new ProgressTracker(Duration.ofSeconds(5), scheduler, reports::add);
    }

    @AfterEach
    void tearDown() {
        tracker.stop();
        scheduler.dispose();
    }

    @Test
    void reportsEveryInterval() {
        tracker.start(10);
        tracker.tick(true);
        tracker.tick(false);

        scheduler.advanceTimeBy(Duration.ofSeconds(4));
        assertTrue(reports.isEmpty());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(List.of(new ProgressSnapshot(2, 1, 0, 10)), reports);

        tracker.tick(false);
        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertEquals(2, reports.size());
        assertEquals(3, reports.get(1).done());
        assertEquals("3/10", reports.get(1).toString());
    }

    @Test
    void stopCancelsReporting() {
        tracker.start(1);
        assertTrue(tracker.isRunning());

        tracker.stop();
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertFalse(tracker.isRunning());
        assertTrue(reports.isEmpty());
    }

    @Test
    void stopBeforeStartIsHarmless() {
        tracker.stop();
        assertFalse(tracker.isRunning());
    }

    @Test
    void cannotStartTwice() {
        tracker.start(1);
        assertThrows(IllegalStateException.class, () -> tracker.start(1));
    }

    @Test
    void failuresCountAsDoneButNotWritten() {
        tracker.start(3);
        tracker.tick(true);
        tracker.tickFailed();

        var snapshot = tracker.snapshot();
        assertEquals(2, snapshot.done());
        assertEquals(1, snapshot.written());
        assertEquals(1, snapshot.failed());
        assertEquals(3, snapshot.total());
    }

    @Test
    void concurrentTicksAreAllCounted() throws InterruptedException {
        tracker.start(8_000);
        var threads = new Thread[8];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 1_000; i++) {
                    tracker.tick(i % 2 == 0);
                }
            });
            threads[t].start();
        }
        for (var thread : threads) {
            thread.join();
        }

        var snapshot = tracker.snapshot();
        assertEquals(8_000, snapshot.done());
        assertEquals(4_000, snapshot.written());
    }
}
