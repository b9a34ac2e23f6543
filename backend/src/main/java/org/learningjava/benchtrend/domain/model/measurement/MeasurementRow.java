package org.learningjava.benchtrend.domain.model.measurement;

/**
 * One flat measurement as read from storage: a single value of one criterion,
 * for one iteration of one invocation of a benchmark run.
 */
public record MeasurementRow(
        String executionUnit,
        String suite,
        String benchmark,
        String criterionName,
        String unit,
        String commandLine,
        String varValue,
        String cores,
        String inputSize,
        String extraArgs,
        Integer warmup,
        int environmentId,
        String commitId,
        int runId,
        int trialId,
        int experimentId,
        int invocation,
        int iteration,
        double value
) {

    /** Largest accepted invocation or iteration number. */
    public static final int MAX_INDEX = 100_000;

    /**
     * @throws IllegalArgumentException if invocation or iteration is outside {@code 1..MAX_INDEX}
     */
    public void checkIndices() {
        if (invocation < 1 || iteration < 1 || invocation > MAX_INDEX || iteration > MAX_INDEX) {
            throw new IllegalArgumentException("Invocation and iteration must be in 1.." + MAX_INDEX + ", got "
                    + invocation + "/" + iteration + " for " + benchmark);
        }
    }
}
