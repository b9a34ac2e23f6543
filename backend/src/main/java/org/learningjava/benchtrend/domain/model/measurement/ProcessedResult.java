package org.learningjava.benchtrend.domain.model.measurement;

import org.learningjava.benchtrend.domain.model.compare.RunConfigComparison;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All series of one benchmark of one suite on one execution unit.
 */
public final class ProcessedResult {

    private final String executionUnit;
    private final String suite;
    private final String benchmark;
    private final List<Measurements> measurements = new ArrayList<>();
    private List<RunConfigComparison> comparisons = List.of();

    public ProcessedResult(String executionUnit, String suite, String benchmark) {
        this.executionUnit = executionUnit;
        this.suite = suite;
        this.benchmark = benchmark;
    }

    /**
     * Linear scan over this benchmark's series; {@code null} if none matches.
     */
    public Measurements find(int environmentId, String commitId, int runId, int trialId, String criterionName) {
        for (Measurements m : measurements) {
            if (m.matches(environmentId, commitId, runId, trialId, criterionName)) {
                return m;
            }
        }
        return null;
    }

    public void add(Measurements m) {
        measurements.add(m);
    }

    public String executionUnit() { return executionUnit; }
    public String suite() { return suite; }
    public String benchmark() { return benchmark; }

    public List<Measurements> measurements() {
        return Collections.unmodifiableList(measurements);
    }

    public List<RunConfigComparison> comparisons() {
        return comparisons;
    }

    public void setComparisons(List<RunConfigComparison> comparisons) {
        this.comparisons = List.copyOf(comparisons);
    }
}
