package org.learningjava.benchtrend.domain.model.stats;

public record OverviewSummaryStatistics(double min, double max, double geomean) { }
