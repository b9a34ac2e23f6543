package org.learningjava.benchtrend.domain.model.timeline;

/**
 * Acknowledgement of an {@link ExitRequest}; the worker sends nothing after it.
 */
public enum WorkerExiting implements WorkerResponse {
    INSTANCE;

    @Override
    public String toString() {
        return "exiting";
    }
}
