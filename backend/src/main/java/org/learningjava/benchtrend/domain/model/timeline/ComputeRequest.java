package org.learningjava.benchtrend.domain.model.timeline;

import java.util.List;

/**
 * @param waveId       wave the jobs belong to, echoed back in the response
 * @param requestStart start marker of the submit that sent these jobs
 */
public record ComputeRequest(List<ComputeJob> jobs, long waveId, long requestStart) implements WorkerRequest {

    public ComputeRequest {
        jobs = List.copyOf(jobs);
    }
}
