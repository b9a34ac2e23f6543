package org.learningjava.benchtrend.application.usecase.timeline;

import org.learningjava.benchtrend.domain.model.timeline.ComputeFailed;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResults;

/**
 * Receives the responses the statistics worker sends back.
 */
public interface ResultReceiver {
    void receiveResults(ComputeResults results);

    void requestFailed(ComputeFailed failure);
}
