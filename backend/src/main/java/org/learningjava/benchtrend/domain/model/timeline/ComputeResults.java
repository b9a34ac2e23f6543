package org.learningjava.benchtrend.domain.model.timeline;

import java.util.List;

public record ComputeResults(List<ComputeResult> results, long waveId, long requestStart) implements WorkerResponse {

    public ComputeResults {
        results = List.copyOf(results);
    }
}
