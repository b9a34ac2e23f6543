package org.learningjava.benchtrend.domain.model.compare;

import org.learningjava.benchtrend.domain.model.measurement.RunSettings;
import org.learningjava.benchtrend.domain.model.stats.ComparisonStatistics;

import java.util.Map;

/**
 * Baseline/change comparison of one run configuration (environment + command line),
 * one entry per criterion measured in both revisions.
 *
 * @param changeRatios change median divided by baseline median, per criterion
 */
public record RunConfigComparison(
        int environmentId,
        RunSettings runSettings,
        Map<String, ComparisonStatistics> statistics,
        Map<String, Double> changeRatios
) { }
