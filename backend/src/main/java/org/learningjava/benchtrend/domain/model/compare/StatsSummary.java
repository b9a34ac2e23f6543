package org.learningjava.benchtrend.domain.model.compare;

import org.learningjava.benchtrend.domain.model.stats.OverviewSummaryStatistics;

public record StatsSummary(String criterion, int numRunConfigs, OverviewSummaryStatistics ratios) { }
