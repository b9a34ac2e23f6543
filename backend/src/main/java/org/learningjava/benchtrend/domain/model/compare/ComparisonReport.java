package org.learningjava.benchtrend.domain.model.compare;

import java.util.List;

public record ComparisonReport(
        String project,
        String baselineCommit,
        String changeCommit,
        Navigation navigation,
        List<BenchmarkComparison> benchmarks,
        OverviewPlotData overview,
        StatsSummary summary
) { }
