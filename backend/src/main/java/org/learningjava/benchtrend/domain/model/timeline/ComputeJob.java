package org.learningjava.benchtrend.domain.model.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Values of one (run, trial, criterion) waiting to be reduced to summary statistics.
 * Never holds {@code null} values.
 */
public final class ComputeJob {

    private final int runId;
    private final int trialId;
    private final int criterionId;
    private final List<Double> values;

    public ComputeJob(int runId, int trialId, int criterionId, List<Double> values) {
        this.runId = runId;
        this.trialId = trialId;
        this.criterionId = criterionId;
        this.values = new ArrayList<>(values);
    }

    public static String key(int runId, int trialId, int criterionId) {
        return trialId + "-" + runId + "-" + criterionId;
    }

    public void append(double value) {
        values.add(value);
    }

    public int runId() { return runId; }
    public int trialId() { return trialId; }
    public int criterionId() { return criterionId; }

    public List<Double> values() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toString() {
        return "ComputeJob[" + key(runId, trialId, criterionId) + ", n=" + values.size() + "]";
    }
}
