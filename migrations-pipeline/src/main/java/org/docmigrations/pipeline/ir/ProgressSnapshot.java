package org.docmigrations.pipeline.ir;

/**
 * Point-in-time copy of the progress counters of one migration run.
 * {@code total} is the estimate taken at run start and may be stale.
 */
public record ProgressSnapshot(
    long done,
    long written,
    long failed,
    long total
) {
    public static final ProgressSnapshot EMPTY = new ProgressSnapshot(0, 0, 0, 0);

    @Override
    public String toString() {
        return done + "/" + total;
    }
}
