package org.learningjava.benchtrend.application.port;

public interface PerformanceStorePort {
    void recordRequestDuration(String label, double durationMs);
}
