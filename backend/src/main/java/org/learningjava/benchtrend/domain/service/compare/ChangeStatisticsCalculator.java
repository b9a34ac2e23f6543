package org.learningjava.benchtrend.domain.service.compare;

import org.learningjava.benchtrend.domain.model.compare.OverviewPlotData;
import org.learningjava.benchtrend.domain.model.compare.OverviewPlotPoint;
import org.learningjava.benchtrend.domain.model.compare.RunConfigComparison;
import org.learningjava.benchtrend.domain.model.compare.SignificancePolicy;
import org.learningjava.benchtrend.domain.model.compare.StatsSummary;
import org.learningjava.benchtrend.domain.model.measurement.CollatedResults;
import org.learningjava.benchtrend.domain.model.measurement.Measurements;
import org.learningjava.benchtrend.domain.model.measurement.ProcessedResult;
import org.learningjava.benchtrend.domain.model.measurement.RunSettings;
import org.learningjava.benchtrend.domain.model.stats.ComparisonStatistics;
import org.learningjava.benchtrend.domain.model.stats.OverviewSummaryStatistics;
import org.learningjava.benchtrend.domain.service.collate.NumericAwareComparator;
import org.learningjava.benchtrend.domain.service.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Compares two revisions of collated results, run configuration by run configuration.
 * <p>
 * A run configuration is one environment plus one command line. Within it, every
 * criterion measured in both the baseline and the change revision gets a
 * {@link ComparisonStatistics}; criteria measured in only one revision are left out.
 */
public class ChangeStatisticsCalculator {

    private static final Logger log = LoggerFactory.getLogger(ChangeStatisticsCalculator.class);

    private final SignificancePolicy policy;

    public ChangeStatisticsCalculator(SignificancePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param baselineIndex         index into {@link CollatedResults#revisions()}
     * @param changeIndex           index into {@link CollatedResults#revisions()}
     * @param significanceThreshold minimal absolute change in percent, or {@code null} to keep every change
     * @return number of run configurations compared
     */
    public int calculateAllChangeStatistics(CollatedResults results,
                                            int baselineIndex,
                                            int changeIndex,
                                            Double significanceThreshold) {
        List<String> revisions = results.revisions();
        if (baselineIndex < 0 || changeIndex < 0) {
            throw new IllegalArgumentException("Revision indexes must not be negative");
        }
        if (baselineIndex >= revisions.size() || changeIndex >= revisions.size()) {
            log.warn("Cannot compare revisions {} and {}, only {} revision(s) present",
                    baselineIndex, changeIndex, revisions.size());
            results.allResults().forEach(r -> r.setComparisons(List.of()));
            return 0;
        }

        String baseline = revisions.get(baselineIndex);
        String change = revisions.get(changeIndex);

        int numConfigs = 0;
        for (ProcessedResult result : results.allResults()) {
            List<RunConfigComparison> comparisons = compare(result, baseline, change, significanceThreshold);
            result.setComparisons(comparisons);
            numConfigs += comparisons.size();
        }
        log.debug("Compared {} run configurations of {} against {}", numConfigs, change, baseline);
        return numConfigs;
    }

    /**
     * One point per compared run configuration with its change ratio for {@code criterion}.
     * Needs {@link #calculateAllChangeStatistics} to have run first.
     */
    public OverviewPlotData calculateDataForOverviewPlot(CollatedResults results, String criterion) {
        Map<String, List<OverviewPlotPoint>> bySuite = new TreeMap<>(NumericAwareComparator.INSTANCE);

        for (ProcessedResult result : results.allResults()) {
            for (RunConfigComparison c : result.comparisons()) {
                Double ratio = c.changeRatios().get(criterion);
                if (ratio == null || ratio.isNaN()) continue;

                bySuite.computeIfAbsent(result.suite(), s -> new ArrayList<>())
                        .add(new OverviewPlotPoint(
                                result.executionUnit(),
                                result.suite(),
                                result.benchmark(),
                                c.environmentId(),
                                c.runSettings().simplifiedCommandLine(),
                                ratio));
            }
        }
        return new OverviewPlotData(criterion, new LinkedHashMap<>(bySuite));
    }

    /**
     * Min, max and geometric mean of the change ratios of {@code criterion} over the whole comparison.
     */
    public StatsSummary summarize(CollatedResults results, String criterion) {
        int numRunConfigs = 0;
        List<Double> ratios = new ArrayList<>();
        for (ProcessedResult result : results.allResults()) {
            for (RunConfigComparison c : result.comparisons()) {
                numRunConfigs++;
                Double ratio = c.changeRatios().get(criterion);
                if (ratio != null && Double.isFinite(ratio) && ratio > 0) {
                    ratios.add(ratio);
                }
            }
        }

        if (ratios.isEmpty()) {
            return new StatsSummary(criterion, numRunConfigs, null);
        }
        double[] sorted = Statistics.toSortedArray(ratios);
        return new StatsSummary(criterion, numRunConfigs, new OverviewSummaryStatistics(
                sorted[0], sorted[sorted.length - 1], Statistics.geomean(sorted)));
    }

    private List<RunConfigComparison> compare(ProcessedResult result,
                                              String baseline,
                                              String change,
                                              Double threshold) {
        Map<RunConfigKey, Map<String, List<Measurements>>> base = new LinkedHashMap<>();
        Map<RunConfigKey, Map<String, List<Measurements>>> chg = new LinkedHashMap<>();
        Map<RunConfigKey, RunSettings> settings = new LinkedHashMap<>();

        for (Measurements m : result.measurements()) {
            Map<RunConfigKey, Map<String, List<Measurements>>> target;
            if (m.commitId().equals(baseline)) {
                target = base;
            } else if (m.commitId().equals(change)) {
                target = chg;
            } else {
                continue;
            }
            RunConfigKey key = new RunConfigKey(m.environmentId(), m.runSettings().commandLine());
            settings.putIfAbsent(key, m.runSettings());
            target.computeIfAbsent(key, k -> new LinkedHashMap<>())
                    .computeIfAbsent(m.criterion().name(), k -> new ArrayList<>())
                    .add(m);
        }

        List<RunConfigComparison> comparisons = new ArrayList<>();
        for (Map.Entry<RunConfigKey, Map<String, List<Measurements>>> entry : base.entrySet()) {
            Map<String, List<Measurements>> changeCriteria = chg.get(entry.getKey());
            if (changeCriteria == null) continue;

            Map<String, ComparisonStatistics> stats = new LinkedHashMap<>();
            Map<String, Double> ratios = new LinkedHashMap<>();
            for (Map.Entry<String, List<Measurements>> criterion : entry.getValue().entrySet()) {
                List<Measurements> changeSeries = changeCriteria.get(criterion.getKey());
                if (changeSeries == null) continue;

                List<Double> baseValues = pooled(criterion.getValue());
                List<Double> changeValues = pooled(changeSeries);
                if (baseValues.isEmpty() || changeValues.isEmpty()) continue;

                double baseMedian = Statistics.median(baseValues);
                double changeMedian = Statistics.median(changeValues);

                stats.put(criterion.getKey(), comparison(baseMedian, changeMedian, changeValues.size(), threshold));
                ratios.put(criterion.getKey(), ratio(baseMedian, changeMedian));
            }

            if (!stats.isEmpty()) {
                comparisons.add(new RunConfigComparison(
                        entry.getKey().environmentId(), settings.get(entry.getKey()), stats, ratios));
            }
        }
        return comparisons;
    }

    ComparisonStatistics comparison(double baseMedian, double changeMedian, int samples, Double threshold) {
        double changeM = (ratio(baseMedian, changeMedian) - 1.0) * 100.0;

        Boolean significant = null;
        if (threshold != null) {
            significant = Double.isNaN(changeM) || Math.abs(changeM) >= threshold;
            if (!significant && policy == SignificancePolicy.SUPPRESS) {
                changeM = 0.0;
            }
        }
        return new ComparisonStatistics(changeMedian, samples, changeM, significant);
    }

    private static double ratio(double baseMedian, double changeMedian) {
        if (baseMedian == 0.0) {
            return changeMedian == 0.0 ? 1.0 : Double.NaN;
        }
        return changeMedian / baseMedian;
    }

    private static List<Double> pooled(List<Measurements> series) {
        if (series.size() == 1) {
            return series.get(0).flatValues();
        }
        List<Double> all = new ArrayList<>();
        for (Measurements m : series) {
            all.addAll(m.flatValues());
        }
        return all;
    }

    private record RunConfigKey(int environmentId, String commandLine) { }
}
