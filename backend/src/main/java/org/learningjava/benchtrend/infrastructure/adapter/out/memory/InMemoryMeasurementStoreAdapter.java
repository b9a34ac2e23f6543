package org.learningjava.benchtrend.infrastructure.adapter.out.memory;

import org.learningjava.benchtrend.application.port.MeasurementStorePort;
import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps measurements per project in memory. Rows are appended as they arrive.
 */
public class InMemoryMeasurementStoreAdapter implements MeasurementStorePort {

    private final Map<String, List<MeasurementRow>> byProject = new ConcurrentHashMap<>();
    private final Map<String, Integer> criteria = new ConcurrentHashMap<>();
    private final AtomicInteger nextCriterionId = new AtomicInteger(1);

    @Override
    public int recordMeasurements(String project, List<MeasurementRow> rows) {
        byProject.computeIfAbsent(project, p -> new CopyOnWriteArrayList<>()).addAll(rows);
        return rows.size();
    }

    @Override
    public int criterionId(String name, String unit) {
        return criteria.computeIfAbsent(name + "|" + unit, k -> nextCriterionId.getAndIncrement());
    }

    @Override
    public List<MeasurementRow> findMeasurementsForComparison(String project, String baselineCommit, String changeCommit) {
        List<MeasurementRow> rows = byProject.getOrDefault(project, List.of());
        List<MeasurementRow> out = new ArrayList<>();
        // baseline rows first so that it is the first revision the collator sees
        for (MeasurementRow r : rows) {
            if (r.commitId().equals(baselineCommit)) out.add(r);
        }
        if (!changeCommit.equals(baselineCommit)) {
            for (MeasurementRow r : rows) {
                if (r.commitId().equals(changeCommit)) out.add(r);
            }
        }
        return out;
    }
}
