package org.learningjava.benchtrend.application.usecase.timeline;

import org.learningjava.benchtrend.domain.model.timeline.ComputeFailed;
import org.learningjava.benchtrend.domain.model.timeline.ComputeJob;
import org.learningjava.benchtrend.domain.model.timeline.ComputeRequest;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResult;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResults;
import org.learningjava.benchtrend.domain.model.timeline.ExitRequest;
import org.learningjava.benchtrend.domain.model.timeline.WorkerExiting;
import org.learningjava.benchtrend.domain.model.timeline.WorkerRequest;
import org.learningjava.benchtrend.domain.model.timeline.WorkerResponse;
import org.learningjava.benchtrend.domain.service.stats.SummaryStatisticsReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * Body of the worker thread. Takes requests from its inbox, reduces every job
 * independently, and posts one response per request.
 * <p>
 * A request that fails is logged and answered with {@link ComputeFailed}, so the
 * sender can give up on it.
 */
class StatisticsWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatisticsWorker.class);

    private final BlockingQueue<WorkerRequest> inbox;
    private final SummaryStatisticsReducer reducer;
    private final Consumer<WorkerResponse> outbox;

    StatisticsWorker(BlockingQueue<WorkerRequest> inbox,
                     SummaryStatisticsReducer reducer,
                     Consumer<WorkerResponse> outbox) {
        this.inbox = inbox;
        this.reducer = reducer;
        this.outbox = outbox;
    }

    @Override
    public void run() {
        while (true) {
            WorkerRequest message;
            try {
                message = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Timeline worker interrupted, stopping without acknowledgement");
                return;
            }

            if (message == ExitRequest.INSTANCE) {
                outbox.accept(WorkerExiting.INSTANCE);
                return;
            }

            if (message instanceof ComputeRequest request) {
                try {
                    outbox.accept(compute(request));
                } catch (RuntimeException e) {
                    log.error("Error on timeline worker", e);
                    outbox.accept(new ComputeFailed(request.waveId(), request.jobs().size(), e));
                }
            } else {
                log.warn("Timeline worker ignores unknown message {}", message);
            }
        }
    }

    private ComputeResults compute(ComputeRequest request) {
        List<ComputeResult> results = new ArrayList<>(request.jobs().size());
        for (ComputeJob job : request.jobs()) {
            results.add(new ComputeResult(job.runId(), job.trialId(), job.criterionId(),
                    reducer.reduce(job.values())));
        }
        log.debug("Reduced {} jobs", results.size());
        return new ComputeResults(results, request.waveId(), request.requestStart());
    }
}
