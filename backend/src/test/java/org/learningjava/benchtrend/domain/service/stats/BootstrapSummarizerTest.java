package org.learningjava.benchtrend.domain.service.stats;

import org.junit.jupiter.api.Test;
import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;

import java.util.List;
import java.util.SplittableRandom;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class BootstrapSummarizerTest {

    private static final double EPS = 1e-9;

    @Test
    void reduce_descriptiveStatistics() {
        BootstrapSummarizer s = new BootstrapSummarizer(200, () -> new SplittableRandom(7));

        SummaryStatistics st = s.reduce(List.of(3.0, 1.0, 2.0, 5.0, 4.0));

        assertEquals(1.0, st.min(), EPS);
        assertEquals(5.0, st.max(), EPS);
        assertEquals(3.0, st.mean(), EPS);
        assertEquals(3.0, st.median(), EPS);
        assertEquals(5, st.numberOfSamples());
        assertEquals(Math.sqrt(2.5), st.standardDeviation(), EPS);
    }

    @Test
    void reduce_confidenceInterval_liesWithinRange_andAroundMedian() {
        BootstrapSummarizer s = new BootstrapSummarizer(1000, () -> new SplittableRandom(11));

        SummaryStatistics st = s.reduce(List.of(10.0, 11.0, 12.0, 9.0, 10.5, 11.5, 9.5, 10.0, 30.0));

        assertThat(st.bci95low(), greaterThanOrEqualTo(st.min()));
        assertThat(st.bci95up(), lessThanOrEqualTo(st.max()));
        assertThat(st.bci95low(), lessThanOrEqualTo(st.median()));
        assertThat(st.bci95up(), greaterThanOrEqualTo(st.median()));
    }

    @Test
    void reduce_sameSeed_sameResult() {
        var values = List.of(4.0, 8.0, 15.0, 16.0, 23.0, 42.0);

        SummaryStatistics a = new BootstrapSummarizer(500, () -> new SplittableRandom(1)).reduce(values);
        SummaryStatistics b = new BootstrapSummarizer(500, () -> new SplittableRandom(1)).reduce(values);

        assertEquals(a, b);
    }

    @Test
    void reduce_singleValue_collapsesInterval() {
        SummaryStatistics st = new BootstrapSummarizer(50).reduce(List.of(7.0));

        assertEquals(7.0, st.bci95low(), EPS);
        assertEquals(7.0, st.bci95up(), EPS);
        assertEquals(0.0, st.standardDeviation(), EPS);
    }

    @Test
    void reduce_empty_throws() {
        assertThrows(IllegalArgumentException.class, () -> new BootstrapSummarizer(10).reduce(List.of()));
    }

    @Test
    void constructor_rejectsNonPositiveSampleCount() {
        assertThrows(IllegalArgumentException.class, () -> new BootstrapSummarizer(0));
    }
}
