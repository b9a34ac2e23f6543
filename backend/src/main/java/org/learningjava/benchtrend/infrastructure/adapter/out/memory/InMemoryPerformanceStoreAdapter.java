package org.learningjava.benchtrend.infrastructure.adapter.out.memory;

import org.learningjava.benchtrend.application.port.PerformanceStorePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryPerformanceStoreAdapter implements PerformanceStorePort {

    private final Map<String, List<Double>> durations = new ConcurrentHashMap<>();

    @Override
    public void recordRequestDuration(String label, double durationMs) {
        durations.computeIfAbsent(label, l -> new CopyOnWriteArrayList<>()).add(durationMs);
    }

    public List<Double> durations(String label) {
        return List.copyOf(durations.getOrDefault(label, List.of()));
    }
}
