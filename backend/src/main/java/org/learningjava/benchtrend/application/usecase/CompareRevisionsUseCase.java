package org.learningjava.benchtrend.application.usecase;

import org.learningjava.benchtrend.application.port.MeasurementStorePort;
import org.learningjava.benchtrend.config.CompareProperties;
import org.learningjava.benchtrend.domain.model.compare.BenchmarkComparison;
import org.learningjava.benchtrend.domain.model.compare.ComparisonReport;
import org.learningjava.benchtrend.domain.model.measurement.CollatedResults;
import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;
import org.learningjava.benchtrend.domain.model.measurement.ProcessedResult;
import org.learningjava.benchtrend.domain.service.collate.MeasurementCollator;
import org.learningjava.benchtrend.domain.service.compare.ChangeStatisticsCalculator;
import org.learningjava.benchtrend.domain.service.compare.NavigationBuilder;
import org.learningjava.benchtrend.domain.service.perf.PerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the comparison of two revisions of a project.
 */
@Service
public class CompareRevisionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CompareRevisionsUseCase.class);

    private final MeasurementStorePort measurements;
    private final MeasurementCollator collator;
    private final ChangeStatisticsCalculator calculator;
    private final NavigationBuilder navigation;
    private final PerformanceTracker perf;
    private final CompareProperties props;

    public CompareRevisionsUseCase(MeasurementStorePort measurements,
                                   MeasurementCollator collator,
                                   ChangeStatisticsCalculator calculator,
                                   NavigationBuilder navigation,
                                   PerformanceTracker perf,
                                   CompareProperties props) {
        this.measurements = measurements;
        this.collator = collator;
        this.calculator = calculator;
        this.navigation = navigation;
        this.perf = perf;
        this.props = props;
    }

    /**
     * @return empty if the project has no data for one of the two revisions
     */
    public Optional<ComparisonReport> compare(String project, String baseline, String change) {
        long start = perf.startRequest();

        List<MeasurementRow> rows = measurements.findMeasurementsForComparison(project, baseline, change);
        CollatedResults collated = collator.collate(rows);

        int baseIdx = collated.revisions().indexOf(baseline);
        int changeIdx = collated.revisions().indexOf(change);
        if (baseIdx < 0 || changeIdx < 0) {
            log.warn("Project {} has no data on revisions {} and {}", project, baseline, change);
            return Optional.empty();
        }

        int numConfigs = calculator.calculateAllChangeStatistics(collated, baseIdx, changeIdx,
                props.getSignificanceThreshold());
        log.debug("{}: {} run configurations compared", project, numConfigs);

        List<BenchmarkComparison> benchmarks = new ArrayList<>();
        for (ProcessedResult r : collated.allResults()) {
            if (!r.comparisons().isEmpty()) {
                benchmarks.add(new BenchmarkComparison(r.executionUnit(), r.suite(), r.benchmark(), r.comparisons()));
            }
        }

        String criterion = props.getOverviewCriterion();
        ComparisonReport report = new ComparisonReport(
                project,
                baseline,
                change,
                navigation.getNavigation(collated),
                benchmarks,
                calculator.calculateDataForOverviewPlot(collated, criterion),
                calculator.summarize(collated, criterion));

        perf.completeRequest(start, "compare");
        return Optional.of(report);
    }
}
