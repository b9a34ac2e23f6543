package org.learningjava.benchtrend.domain.model.timeline;

/**
 * Message sent back by the statistics worker.
 */
public interface WorkerResponse { }
