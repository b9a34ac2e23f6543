package org.learningjava.benchtrend.domain.model.measurement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A series: all values of one criterion for one (environment, commit, run, trial).
 * <p>
 * Values are kept as a sparse grid indexed by zero-based invocation, then
 * zero-based iteration. Slots that were never written hold {@code null}.
 */
public final class Measurements {

    private final CriterionData criterion;
    private final RunSettings runSettings;
    private final int environmentId;
    private final String commitId;
    private final int runId;
    private final int trialId;
    private final int experimentId;

    private final List<List<Double>> values = new ArrayList<>();

    public Measurements(CriterionData criterion,
                        RunSettings runSettings,
                        int environmentId,
                        String commitId,
                        int runId,
                        int trialId,
                        int experimentId) {
        this.criterion = criterion;
        this.runSettings = runSettings;
        this.environmentId = environmentId;
        this.commitId = commitId;
        this.runId = runId;
        this.trialId = trialId;
        this.experimentId = experimentId;
    }

    public boolean matches(int environmentId, String commitId, int runId, int trialId, String criterionName) {
        return this.environmentId == environmentId
                && this.commitId.equals(commitId)
                && this.runId == runId
                && this.trialId == trialId
                && this.criterion.name().equals(criterionName);
    }

    /**
     * Stores {@code value} at {@code [invocation-1][iteration-1]}, growing the grid as needed.
     */
    public void set(int invocation, int iteration, double value) {
        int inv = invocation - 1;
        int it = iteration - 1;
        while (values.size() <= inv) {
            values.add(null);
        }
        List<Double> iterations = values.get(inv);
        if (iterations == null) {
            iterations = new ArrayList<>();
            values.set(inv, iterations);
        }
        while (iterations.size() <= it) {
            iterations.add(null);
        }
        iterations.set(it, value);
    }

    /** Read-only view of the grid; missing invocations appear as {@code null} rows. */
    public List<List<Double>> values() {
        List<List<Double>> view = new ArrayList<>(values.size());
        for (List<Double> row : values) {
            view.add(row == null ? null : Collections.unmodifiableList(row));
        }
        return Collections.unmodifiableList(view);
    }

    /** All present values, invocation by invocation. */
    public List<Double> flatValues() {
        List<Double> flat = new ArrayList<>();
        for (List<Double> row : values) {
            if (row == null) continue;
            for (Double v : row) {
                if (v != null) flat.add(v);
            }
        }
        return flat;
    }

    public CriterionData criterion() { return criterion; }
    public RunSettings runSettings() { return runSettings; }
    public int environmentId() { return environmentId; }
    public String commitId() { return commitId; }
    public int runId() { return runId; }
    public int trialId() { return trialId; }
    public int experimentId() { return experimentId; }

    @Override
    public String toString() {
        return "Measurements[" + criterion.name() + ", env=" + environmentId + ", commit=" + commitId
                + ", run=" + runId + ", trial=" + trialId + ", values=" + values + "]";
    }
}
