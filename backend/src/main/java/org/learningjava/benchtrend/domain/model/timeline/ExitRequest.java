package org.learningjava.benchtrend.domain.model.timeline;

public enum ExitRequest implements WorkerRequest {
    INSTANCE
}
