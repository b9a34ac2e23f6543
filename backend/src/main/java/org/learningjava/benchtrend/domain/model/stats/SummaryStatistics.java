package org.learningjava.benchtrend.domain.model.stats;

/**
 * Reduced statistics of one series, as stored in the timeline.
 * {@code bci95low}/{@code bci95up} bound the bootstrap 95% confidence interval of the median.
 */
public record SummaryStatistics(
        double min,
        double max,
        double standardDeviation,
        double mean,
        double median,
        int numberOfSamples,
        double bci95low,
        double bci95up
) { }
