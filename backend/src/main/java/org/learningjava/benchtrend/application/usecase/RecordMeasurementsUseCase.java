package org.learningjava.benchtrend.application.usecase;

import org.learningjava.benchtrend.application.port.MeasurementStorePort;
import org.learningjava.benchtrend.application.usecase.timeline.BatchingTimelineUpdater;
import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stores uploaded measurements and feeds them to the timeline.
 */
@Service
public class RecordMeasurementsUseCase {

    private static final Logger log = LoggerFactory.getLogger(RecordMeasurementsUseCase.class);

    private final MeasurementStorePort measurements;
    private final BatchingTimelineUpdater timeline;

    public RecordMeasurementsUseCase(MeasurementStorePort measurements, BatchingTimelineUpdater timeline) {
        this.measurements = measurements;
        this.timeline = timeline;
    }

    /**
     * @param project project the rows belong to
     * @param rows    measurements of one upload
     * @return number of stored rows, and the future of the timeline update they triggered
     * @throws IllegalArgumentException if a row has an invocation or iteration out of range; nothing is stored then
     */
    public RecordingOutcome record(String project, List<MeasurementRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return new RecordingOutcome(0, CompletableFuture.completedFuture(0));
        }

        rows.forEach(MeasurementRow::checkIndices);

        int stored = measurements.recordMeasurements(project, rows);
        int added = addToTimeline(rows);
        log.info("{}: stored {} measurements, {} invocations queued for the timeline", project, stored, added);

        CompletableFuture<Integer> timelineJobs = timeline.submitUpdateJobs();
        return new RecordingOutcome(stored, timelineJobs);
    }

    /**
     * One {@code addValues} call per invocation, iterations in order; gaps are passed as {@code null}.
     */
    private int addToTimeline(List<MeasurementRow> rows) {
        Map<InvocationKey, List<Double>> byInvocation = new LinkedHashMap<>();
        for (MeasurementRow row : rows) {
            var key = new InvocationKey(row.runId(), row.trialId(), row.criterionName(), row.unit(), row.invocation());
            List<Double> iterations = byInvocation.computeIfAbsent(key, k -> new ArrayList<>());
            int it = row.iteration() - 1;
            while (iterations.size() <= it) {
                iterations.add(null);
            }
            iterations.set(it, row.value());
        }

        Map<String, Integer> criterionIds = new HashMap<>();
        for (var e : byInvocation.entrySet()) {
            InvocationKey k = e.getKey();
            int criterionId = criterionIds.computeIfAbsent(k.criterion() + "|" + k.unit(),
                    c -> measurements.criterionId(k.criterion(), k.unit()));
            timeline.addValues(k.runId(), k.trialId(), criterionId, e.getValue());
        }
        return byInvocation.size();
    }

    public record RecordingOutcome(int storedMeasurements, CompletableFuture<Integer> timelineJobs) { }

    private record InvocationKey(int runId, int trialId, String criterion, String unit, int invocation) { }
}
