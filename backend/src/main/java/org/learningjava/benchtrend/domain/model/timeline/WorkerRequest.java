package org.learningjava.benchtrend.domain.model.timeline;

/**
 * Message sent to the statistics worker.
 */
public interface WorkerRequest { }
