package org.learningjava.benchtrend.domain.service.stats;

import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;

import java.util.List;

/**
 * Reduces the raw values of one series to summary statistics.
 * Implementations must be stateless between calls.
 */
public interface SummaryStatisticsReducer {

    SummaryStatistics reduce(List<Double> values);
}
