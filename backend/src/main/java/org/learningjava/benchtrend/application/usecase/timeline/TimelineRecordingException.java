package org.learningjava.benchtrend.application.usecase.timeline;

import org.learningjava.benchtrend.domain.model.timeline.ComputeResult;

/**
 * Storing one timeline result failed; the remaining results of the same batch were not stored.
 */
public class TimelineRecordingException extends RuntimeException {

    private final transient ComputeResult result;

    public TimelineRecordingException(ComputeResult result, Throwable cause) {
        super("Failed to record timeline for run " + result.runId() + ", trial " + result.trialId()
                + ", criterion " + result.criterionId(), cause);
        this.result = result;
    }

    public ComputeResult result() {
        return result;
    }
}
