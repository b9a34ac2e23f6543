package org.learningjava.benchtrend.application.usecase.timeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;
import org.learningjava.benchtrend.domain.model.timeline.ComputeFailed;
import org.learningjava.benchtrend.domain.model.timeline.ComputeJob;
import org.learningjava.benchtrend.domain.model.timeline.ComputeRequest;
import org.learningjava.benchtrend.domain.model.timeline.ComputeResults;
import org.learningjava.benchtrend.domain.service.stats.SummaryStatisticsReducer;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TimelineWorkerTest {

    private static final SummaryStatisticsReducer SIZE = values -> {
        if (values.contains(-1.0)) throw new IllegalArgumentException("negative");
        return new SummaryStatistics(0, 0, 0, 0, 0, values.size(), 0, 0);
    };

    private final LinkedBlockingQueue<ComputeResults> received = new LinkedBlockingQueue<>();
    private final LinkedBlockingQueue<ComputeFailed> failed = new LinkedBlockingQueue<>();
    private final ResultReceiver collecting = new ResultReceiver() {
        @Override
        public void receiveResults(ComputeResults results) {
            received.add(results);
        }

        @Override
        public void requestFailed(ComputeFailed failure) {
            failed.add(failure);
        }
    };
    private TimelineWorker worker;

    @AfterEach
    void tearDown() throws Exception {
        if (worker != null) worker.shutdown().get(5, TimeUnit.SECONDS);
    }

    private static ComputeRequest request(long waveId, ComputeJob... jobs) {
        return new ComputeRequest(List.of(jobs), waveId, System.nanoTime());
    }

    @Test
    void sendRequest_deliversOneResultPerJob_inOrder() throws Exception {
        worker = new TimelineWorker(SIZE, collecting);

        assertTrue(worker.sendRequest(request(4,
                new ComputeJob(1, 1, 1, List.of(1.0, 2.0)),
                new ComputeJob(1, 2, 1, List.of(3.0)))));

        ComputeResults r = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(r);
        assertEquals(4, r.waveId());
        assertEquals(2, r.results().size());
        assertEquals(2, r.results().get(0).stats().numberOfSamples());
        assertEquals(2, r.results().get(1).trialId());
    }

    @Test
    void failedRequest_isReported_and_workerKeepsServing() throws Exception {
        worker = new TimelineWorker(SIZE, collecting);

        worker.sendRequest(request(1, new ComputeJob(1, 1, 1, List.of(-1.0)), new ComputeJob(1, 3, 1, List.of(1.0))));
        worker.sendRequest(request(2, new ComputeJob(1, 2, 1, List.of(5.0))));

        ComputeFailed f = failed.poll(5, TimeUnit.SECONDS);
        assertNotNull(f);
        assertEquals(1, f.waveId());
        assertEquals(2, f.numJobs());
        assertInstanceOf(IllegalArgumentException.class, f.cause());

        ComputeResults r = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(r);
        assertEquals(2, r.results().get(0).trialId());
        assertNull(received.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void receiverFailure_isContained() throws Exception {
        ResultReceiver receiver = mock(ResultReceiver.class);
        doThrow(new IllegalStateException("nope")).doAnswer(inv -> {
            received.add(inv.getArgument(0));
            return null;
        }).when(receiver).receiveResults(any());
        worker = new TimelineWorker(SIZE, receiver);

        worker.sendRequest(request(1, new ComputeJob(1, 1, 1, List.of(1.0))));
        worker.sendRequest(request(1, new ComputeJob(1, 2, 1, List.of(1.0))));

        ComputeResults r = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(r);
        assertEquals(2, r.results().get(0).trialId());
    }

    @Test
    void shutdown_completes_and_laterRequestsAreRejected() throws Exception {
        ResultReceiver receiver = mock(ResultReceiver.class);
        worker = new TimelineWorker(SIZE, receiver);

        CompletableFuture<Void> done = worker.shutdown();
        done.get(5, TimeUnit.SECONDS);

        assertFalse(worker.sendRequest(request(1, new ComputeJob(1, 1, 1, List.of(1.0)))));

        assertSame(done, worker.shutdown());
        verifyNoInteractions(receiver);
    }
}
