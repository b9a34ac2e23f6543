package org.learningjava.benchtrend.domain.service.collate;

import org.learningjava.benchtrend.domain.model.measurement.CollatedResults;
import org.learningjava.benchtrend.domain.model.measurement.CriterionData;
import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;
import org.learningjava.benchtrend.domain.model.measurement.Measurements;
import org.learningjava.benchtrend.domain.model.measurement.ProcessedResult;
import org.learningjava.benchtrend.domain.model.measurement.ResultsByBenchmark;
import org.learningjava.benchtrend.domain.model.measurement.RunSettings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the flat list of measurements into a nested structure that separates
 * them by execution unit, suite, and benchmark.
 * <p>
 * No statistics are computed here. The order of the rows says nothing about
 * when all data of a series has been seen, so statistics run as a second step
 * over the finished structure.
 */
@Component
public class MeasurementCollator {

    public CollatedResults collate(List<MeasurementRow> rows) {
        Map<String, Map<String, ResultsByBenchmark>> byExe = new LinkedHashMap<>();
        Map<String, RunSettings> runSettings = new HashMap<>();
        Map<String, CriterionData> criteria = new HashMap<>();
        Set<String> revisions = new LinkedHashSet<>();

        for (MeasurementRow row : rows) {
            row.checkIndices();

            CriterionData criterion = criteria.computeIfAbsent(row.criterionName() + "|" + row.unit(),
                    k -> new CriterionData(row.criterionName(), row.unit()));

            RunSettings settings = runSettings.computeIfAbsent(row.commandLine(), cmd -> new RunSettings(
                    cmd,
                    row.varValue(),
                    row.cores(),
                    row.inputSize(),
                    row.extraArgs(),
                    row.warmup(),
                    CommandLineSimplifier.simplify(cmd)));

            ResultsByBenchmark forSuite = byExe
                    .computeIfAbsent(row.executionUnit(), e -> new LinkedHashMap<>())
                    .computeIfAbsent(row.suite(), s -> new ResultsByBenchmark());

            ProcessedResult result = forSuite.benchmark(row.executionUnit(), row.suite(), row.benchmark());

            Measurements series = result.find(row.environmentId(), row.commitId(), row.runId(), row.trialId(),
                    row.criterionName());
            if (series == null) {
                series = new Measurements(criterion, settings, row.environmentId(), row.commitId(),
                        row.runId(), row.trialId(), row.experimentId());
                result.add(series);
                forSuite.registerCriterion(criterion);
            }

            series.set(row.invocation(), row.iteration(), row.value());
            revisions.add(row.commitId());
        }

        CollatedResults collated = new CollatedResults(byExe, new ArrayList<>(revisions));
        collated.sortAllLevels(NumericAwareComparator.INSTANCE);
        return collated;
    }
}
