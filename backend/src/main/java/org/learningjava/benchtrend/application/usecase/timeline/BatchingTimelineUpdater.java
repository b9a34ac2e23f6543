package org.learningjava.benchtrend.application.usecase.timeline;

import org.learningjava.benchtrend.application.port.TimelineStorePort;
import org.learningjava.benchtrend.domain.model.timeline.ComputeFailed;
import org.learningjava.benchtrend.domain.model.timeline.ComputeJob;
import org.learningjava.benchtrend.domain.model.timeline.ComputeRequest;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResult;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResults;
import org.learningjava.benchtrend.domain.service.perf.PerformanceTracker;
import org.learningjava.benchtrend.domain.service.stats.BootstrapSummarizer;
import org.learningjava.benchtrend.domain.service.stats.SummaryStatisticsReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Batches up values for the timeline and hands them to the {@link TimelineWorker}
 * in waves.
 * <p>
 * Recording measurements calls {@link #addValues} often and cheaply; once an upload
 * is stored, {@link #submitUpdateJobs} sends everything collected so far to the
 * worker and returns a future that completes with the number of jobs once all
 * results are stored.
 * <p>
 * A wave whose computation or storing fails is abandoned: its future never completes
 * and the next submit opens a new wave.
 */
public class BatchingTimelineUpdater implements ResultReceiver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchingTimelineUpdater.class);

    static final String PERF_LABEL = "generate-timeline";

    private final TimelineStorePort store;
    private final PerformanceTracker perf;
    private final TimelineWorker worker;
    private final Duration shutdownTimeout;

    // guarded by this
    private final Map<String, ComputeJob> requests = new LinkedHashMap<>();
    private Wave wave;
    private long lastWaveId;
    private CompletableFuture<Integer> quiescence;

    public BatchingTimelineUpdater(TimelineStorePort store, PerformanceTracker perf, int numBootstrapSamples) {
        this(store, perf, new BootstrapSummarizer(numBootstrapSamples), Duration.ofSeconds(30));
    }

    public BatchingTimelineUpdater(TimelineStorePort store,
                                   PerformanceTracker perf,
                                   SummaryStatisticsReducer reducer,
                                   Duration shutdownTimeout) {
        this.store = store;
        this.perf = perf;
        this.shutdownTimeout = shutdownTimeout;
        this.worker = new TimelineWorker(reducer, this);
    }

    /**
     * Adds values of one (run, trial, criterion); {@code null} entries are dropped.
     * If nothing remains, no job is created.
     */
    public synchronized void addValues(int runId, int trialId, int criterionId, List<Double> values) {
        String id = ComputeJob.key(runId, trialId, criterionId);
        ComputeJob job = requests.get(id);

        if (job == null) {
            List<Double> withoutMissing = new ArrayList<>(values.size());
            for (Double v : values) {
                if (v != null) withoutMissing.add(v);
            }
            if (withoutMissing.isEmpty()) {
                return;
            }
            requests.put(id, new ComputeJob(runId, trialId, criterionId, withoutMissing));
        } else {
            for (Double v : values) {
                if (v != null) job.append(v);
            }
        }
    }

    /**
     * Trigger processing of the collected timeline jobs.
     * Typically called once all data of an upload was recorded.
     *
     * @return future with the number of jobs processed; {@code 0} right away if there was nothing to do
     */
    public CompletableFuture<Integer> submitUpdateJobs() {
        long requestStart = perf.startRequest();
        List<ComputeJob> jobs = consumeUpdateJobs();
        return processUpdateJobs(jobs, requestStart);
    }

    /**
     * Takes all pending jobs and clears the table.
     */
    synchronized List<ComputeJob> consumeUpdateJobs() {
        List<ComputeJob> jobs = new ArrayList<>(requests.values());
        requests.clear();
        return jobs;
    }

    synchronized CompletableFuture<Integer> processUpdateJobs(List<ComputeJob> jobs, long requestStart) {
        if (jobs.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }

        if (wave != null) {
            // a wave is still out, these jobs join it
            wave.active += jobs.size();
            wave.total += jobs.size();
            log.info("Adding {} timeline jobs to the outstanding wave, {} now pending", jobs.size(), wave.active);
        } else {
            wave = new Wave(++lastWaveId, requestStart, jobs.size());
            quiescence = wave.done;
            log.info("Submitting {} timeline jobs", jobs.size());
        }

        Wave current = wave;
        if (!worker.sendRequest(new ComputeRequest(jobs, current.id, requestStart))) {
            wave = null;
            current.done.completeExceptionally(new IllegalStateException("Timeline worker is shut down"));
        }
        return current.done;
    }

    /**
     * Stores the results in arrival order. The first failing store aborts the rest of the batch
     * and abandons the wave, so later submits start a fresh one.
     */
    @Override
    public void receiveResults(ComputeResults r) {
        for (ComputeResult result : r.results()) {
            try {
                store.recordTimeline(result.runId(), result.trialId(), result.criterionId(), result.stats());
            } catch (RuntimeException e) {
                abandon(r.waveId(), "storing results failed");
                throw new TimelineRecordingException(result, e);
            }
        }

        Wave completed = null;
        synchronized (this) {
            if (wave == null || wave.id != r.waveId()) {
                log.debug("Stored {} timeline results of wave {} that is no longer open", r.results().size(), r.waveId());
                return;
            }

            wave.active -= r.results().size();
            if (wave.active < 0) {
                log.warn("Received {} timeline results more than were requested", -wave.active);
            }
            if (wave.active <= 0) {
                completed = wave;
                wave = null;
            }
        }

        if (completed != null) {
            perf.completeRequest(completed.start, PERF_LABEL);
            log.info("Timeline wave complete, {} jobs processed", completed.total);
            completed.done.complete(completed.total);
        }
    }

    @Override
    public void requestFailed(ComputeFailed failure) {
        abandon(failure.waveId(), "computing " + failure.numJobs() + " jobs failed");
    }

    /**
     * Closes the given wave without completing its future. Jobs submitted afterwards start a new wave.
     */
    private synchronized void abandon(long waveId, String reason) {
        if (wave != null && wave.id == waveId) {
            log.warn("Abandoning timeline wave {} with {} pending jobs, {}", waveId, wave.active, reason);
            wave = null;
        }
    }

    /**
     * The future of the last submitted wave, if any.
     */
    public synchronized Optional<CompletableFuture<Integer>> getQuiescence() {
        return Optional.ofNullable(quiescence);
    }

    synchronized int activeRequests() {
        return wave == null ? 0 : wave.active;
    }

    synchronized int pendingJobs() {
        return requests.size();
    }

    public CompletableFuture<Void> shutdown() {
        return worker.shutdown();
    }

    /**
     * Shuts the worker down and waits for it, at most for the configured timeout.
     */
    @Override
    public void close() {
        try {
            shutdown().get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timeline worker did not exit within {}", shutdownTimeout);
        } catch (ExecutionException e) {
            log.error("Timeline worker shutdown failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Wave {
        final long id;
        final long start;
        final CompletableFuture<Integer> done = new CompletableFuture<>();
        int active;
        int total;

        Wave(long id, long start, int numJobs) {
            this.id = id;
            this.start = start;
            this.active = numJobs;
            this.total = numJobs;
        }
    }
}
