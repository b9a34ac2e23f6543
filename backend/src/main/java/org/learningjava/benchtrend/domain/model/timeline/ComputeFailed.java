package org.learningjava.benchtrend.domain.model.timeline;

/**
 * Sent instead of {@link ComputeResults} when reducing a request failed.
 *
 * @param numJobs number of jobs in the failed request
 */
public record ComputeFailed(long waveId, int numJobs, RuntimeException cause) implements WorkerResponse { }
