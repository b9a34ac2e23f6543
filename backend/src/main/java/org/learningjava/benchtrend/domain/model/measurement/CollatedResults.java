package org.learningjava.benchtrend.domain.model.measurement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collated measurements: execution unit, then suite, then {@link ResultsByBenchmark}.
 * Also remembers the revisions (commit ids) in the order they first appeared.
 */
public final class CollatedResults {

    private Map<String, Map<String, ResultsByBenchmark>> byExecutionUnit;
    private final List<String> revisions;

    public CollatedResults(Map<String, Map<String, ResultsByBenchmark>> byExecutionUnit, List<String> revisions) {
        this.byExecutionUnit = byExecutionUnit;
        this.revisions = List.copyOf(revisions);
    }

    public Map<String, Map<String, ResultsByBenchmark>> byExecutionUnit() {
        return byExecutionUnit;
    }

    public List<String> revisions() {
        return revisions;
    }

    public ResultsByBenchmark get(String executionUnit, String suite) {
        Map<String, ResultsByBenchmark> bySuite = byExecutionUnit.get(executionUnit);
        return bySuite == null ? null : bySuite.get(suite);
    }

    public List<ProcessedResult> allResults() {
        List<ProcessedResult> all = new ArrayList<>();
        for (Map<String, ResultsByBenchmark> bySuite : byExecutionUnit.values()) {
            for (ResultsByBenchmark byBench : bySuite.values()) {
                all.addAll(byBench.benchmarks().values());
            }
        }
        return all;
    }

    /**
     * Re-orders execution units, suites and benchmarks by {@code order}.
     */
    public void sortAllLevels(Comparator<String> order) {
        Map<String, Map<String, ResultsByBenchmark>> sortedExes = sorted(byExecutionUnit, order);
        for (Map.Entry<String, Map<String, ResultsByBenchmark>> exe : sortedExes.entrySet()) {
            Map<String, ResultsByBenchmark> sortedSuites = sorted(exe.getValue(), order);
            for (ResultsByBenchmark byBench : sortedSuites.values()) {
                byBench.replaceBenchmarks(sorted(byBench.benchmarks(), order));
            }
            exe.setValue(sortedSuites);
        }
        byExecutionUnit = sortedExes;
    }

    private static <V> Map<String, V> sorted(Map<String, V> map, Comparator<String> order) {
        Map<String, V> result = new LinkedHashMap<>();
        map.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(order))
                .forEachOrdered(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }
}
