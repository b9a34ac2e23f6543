package org.learningjava.benchtrend.domain.service.stats;

import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;

import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;
import java.util.function.Supplier;

/**
 * Descriptive statistics plus a bootstrap 95% confidence interval of the median:
 * the values are resampled with replacement {@code numBootstrapSamples} times, and
 * the 2.5th and 97.5th percentiles of the resampled medians bound the interval.
 */
public class BootstrapSummarizer implements SummaryStatisticsReducer {

    private final int numBootstrapSamples;
    private final Supplier<SplittableRandom> randomSource;

    public BootstrapSummarizer(int numBootstrapSamples) {
        this(numBootstrapSamples, SplittableRandom::new);
    }

    /** {@code randomSource} is asked for a fresh generator per reduction. */
    public BootstrapSummarizer(int numBootstrapSamples, Supplier<SplittableRandom> randomSource) {
        if (numBootstrapSamples < 1) {
            throw new IllegalArgumentException("numBootstrapSamples must be positive, got " + numBootstrapSamples);
        }
        this.numBootstrapSamples = numBootstrapSamples;
        this.randomSource = randomSource;
    }

    public int numBootstrapSamples() {
        return numBootstrapSamples;
    }

    @Override
    public SummaryStatistics reduce(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty series");
        }
        double[] sorted = Statistics.toSortedArray(values);
        double mean = Statistics.mean(sorted);
        double median = Statistics.medianOfSorted(sorted);

        double[] medians = bootstrapMedians(sorted, randomSource.get());
        Arrays.sort(medians);

        return new SummaryStatistics(
                sorted[0],
                sorted[sorted.length - 1],
                Statistics.standardDeviation(sorted, mean),
                mean,
                median,
                sorted.length,
                Statistics.percentileOfSorted(medians, 0.025),
                Statistics.percentileOfSorted(medians, 0.975));
    }

    private double[] bootstrapMedians(double[] data, SplittableRandom random) {
        double[] medians = new double[numBootstrapSamples];
        double[] resample = new double[data.length];
        for (int s = 0; s < numBootstrapSamples; s++) {
            for (int i = 0; i < data.length; i++) {
                resample[i] = data[random.nextInt(data.length)];
            }
            Arrays.sort(resample);
            medians[s] = Statistics.medianOfSorted(resample);
        }
        return medians;
    }
}
