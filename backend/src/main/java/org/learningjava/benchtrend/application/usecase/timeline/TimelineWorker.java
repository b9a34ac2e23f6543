package org.learningjava.benchtrend.application.usecase.timeline;

import org.learningjava.benchtrend.domain.model.timeline.ComputeFailed;
import org.learningjava.benchtrend.domain.model.timeline.ComputeRequest;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResults;
import org.learningjava.benchtrend.domain.model.timeline.ExitRequest;
import org.learningjava.benchtrend.domain.model.timeline.WorkerExiting;
import org.learningjava.benchtrend.domain.model.timeline.WorkerRequest;
import org.learningjava.benchtrend.domain.model.timeline.WorkerResponse;
import org.learningjava.benchtrend.domain.service.stats.SummaryStatisticsReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the thread that computes timeline statistics and the thread that hands
 * its responses to a {@link ResultReceiver}. All interaction with the worker
 * is by message: requests go through a queue, responses come back through the
 * single-threaded dispatcher, so the receiver is never called concurrently.
 */
public class TimelineWorker {

    private static final Logger log = LoggerFactory.getLogger(TimelineWorker.class);

    private final BlockingQueue<WorkerRequest> inbox = new LinkedBlockingQueue<>();
    private final ExecutorService workerThread;
    private final ExecutorService dispatcher;
    private final ResultReceiver receiver;

    private volatile CompletableFuture<Void> shutdownFuture;

    public TimelineWorker(SummaryStatisticsReducer reducer, ResultReceiver receiver) {
        this.receiver = receiver;
        this.workerThread = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("timeline-worker-"));
        this.dispatcher = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("timeline-results-"));
        this.workerThread.execute(new StatisticsWorker(inbox, reducer, this::postResponse));
    }

    /**
     * @return {@code false} if the worker is shutting down and the request was not queued
     */
    public synchronized boolean sendRequest(ComputeRequest request) {
        if (shutdownFuture != null) {
            log.warn("Timeline worker is shutting down, rejecting request with {} jobs", request.jobs().size());
            return false;
        }
        inbox.add(request);
        return true;
    }

    /**
     * Asks the worker to exit. Completes once the worker acknowledged and its threads are gone.
     * Repeated calls return the same future.
     */
    public synchronized CompletableFuture<Void> shutdown() {
        if (shutdownFuture != null) {
            return shutdownFuture;
        }
        shutdownFuture = new CompletableFuture<>();
        inbox.add(ExitRequest.INSTANCE);
        return shutdownFuture;
    }

    private void postResponse(WorkerResponse response) {
        try {
            dispatcher.execute(() -> processResponse(response));
        } catch (RejectedExecutionException e) {
            log.warn("Timeline dispatcher already stopped, dropping {}", response);
        }
    }

    void processResponse(WorkerResponse message) {
        if (message == WorkerExiting.INSTANCE) {
            terminate();
            return;
        }

        if (message instanceof ComputeResults results) {
            try {
                receiver.receiveResults(results);
            } catch (RuntimeException e) {
                log.error("Failed to process {} timeline results", results.results().size(), e);
            }
        } else if (message instanceof ComputeFailed failure) {
            try {
                receiver.requestFailed(failure);
            } catch (RuntimeException e) {
                log.error("Failed to handle failed timeline request", e);
            }
        }
    }

    private void terminate() {
        workerThread.shutdown();
        try {
            if (!workerThread.awaitTermination(5, TimeUnit.SECONDS)) {
                workerThread.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerThread.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Timeline worker exited");

        dispatcher.shutdown();
        CompletableFuture<Void> done = shutdownFuture;
        if (done != null) {
            done.complete(null);
        }
    }
}
