package org.learningjava.benchtrend.domain.service.perf;

import org.learningjava.benchtrend.application.port.PerformanceStorePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures how long labelled operations take and hands the durations to storage.
 * Recording is best effort: a failing store is logged, never propagated.
 */
public class PerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

    private final PerformanceStorePort store;

    public PerformanceTracker(PerformanceStorePort store) {
        this.store = store;
    }

    /** Start marker; pass it back to {@link #completeRequest}. */
    public long startRequest() {
        return System.nanoTime();
    }

    public void completeRequest(long start, String label) {
        double durationMs = (System.nanoTime() - start) / 1_000_000.0;
        log.debug("{} took {} ms", label, String.format("%.2f", durationMs));
        try {
            store.recordRequestDuration(label, durationMs);
        } catch (RuntimeException e) {
            log.warn("Failed to record duration of {}: {}", label, e.toString());
        }
    }
}
