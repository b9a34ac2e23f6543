package org.learningjava.benchtrend.domain.model.measurement;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Results of one suite on one execution unit, keyed by benchmark name.
 * The criteria record keeps the order in which criteria were first seen.
 */
public final class ResultsByBenchmark {

    private Map<String, ProcessedResult> benchmarks = new LinkedHashMap<>();
    private final Map<String, CriterionData> criteria = new LinkedHashMap<>();

    public ProcessedResult benchmark(String executionUnit, String suite, String benchmark) {
        return benchmarks.computeIfAbsent(benchmark, b -> new ProcessedResult(executionUnit, suite, b));
    }

    public void registerCriterion(CriterionData criterion) {
        criteria.put(criterion.name(), criterion);
    }

    public Map<String, ProcessedResult> benchmarks() {
        return benchmarks;
    }

    void replaceBenchmarks(Map<String, ProcessedResult> sorted) {
        this.benchmarks = sorted;
    }

    public Map<String, CriterionData> criteria() {
        return criteria;
    }
}
