package com.ivamare.ordersession.snapshot;

/**
 * When to take a snapshot: every time a stream crosses a multiple of {@code interval}.
 *
 * @param interval Events between snapshots; 0 disables snapshotting
 * @param keepLatest Snapshots kept per stream after pruning
 */
public record SnapshotPolicy(int interval, int keepLatest) {

    public SnapshotPolicy {
        if (interval < 0) {
            throw new IllegalArgumentException("interval cannot be negative");
        }
        keepLatest = Math.max(1, keepLatest);
    }

    public static SnapshotPolicy every(int interval) {
        return new SnapshotPolicy(interval, 2);
    }

    public static SnapshotPolicy never() {
        return new SnapshotPolicy(0, 1);
    }

    public boolean isEnabled() {
        return interval > 0;
    }

    /**
     * Whether an append that moved the stream from {@code previousVersion} to
     * {@code newVersion} crossed a snapshot boundary.
     */
    public boolean shouldSnapshot(long previousVersion, long newVersion) {
        if (!isEnabled() || newVersion <= previousVersion) {
            return false;
        }
        return newVersion / interval > previousVersion / interval;
    }
}
