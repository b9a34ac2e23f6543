package org.learningjava.benchtrend.config;

import org.learningjava.benchtrend.application.port.MeasurementStorePort;
import org.learningjava.benchtrend.application.port.PerformanceStorePort;
import org.learningjava.benchtrend.application.port.TimelineStorePort;
import org.learningjava.benchtrend.application.usecase.timeline.BatchingTimelineUpdater;
import org.learningjava.benchtrend.domain.service.compare.ChangeStatisticsCalculator;
import org.learningjava.benchtrend.domain.service.perf.PerformanceTracker;
import org.learningjava.benchtrend.domain.service.stats.BootstrapSummarizer;
import org.learningjava.benchtrend.infrastructure.adapter.out.memory.InMemoryMeasurementStoreAdapter;
import org.learningjava.benchtrend.infrastructure.adapter.out.memory.InMemoryPerformanceStoreAdapter;
import org.learningjava.benchtrend.infrastructure.adapter.out.memory.InMemoryTimelineStoreAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppConfig {

    //storage, swap for a database-backed adapter in production
    @Bean
    MeasurementStorePort measurementStore() {
        return new InMemoryMeasurementStoreAdapter();
    }

    @Bean
    TimelineStorePort timelineStore() {
        return new InMemoryTimelineStoreAdapter();
    }

    @Bean
    PerformanceStorePort performanceStore() {
        return new InMemoryPerformanceStoreAdapter();
    }

    @Bean
    PerformanceTracker performanceTracker(PerformanceStorePort store) {
        return new PerformanceTracker(store);
    }

    @Bean
    ChangeStatisticsCalculator changeStatisticsCalculator(CompareProperties props) {
        return new ChangeStatisticsCalculator(props.getSignificancePolicy());
    }

    @Bean(destroyMethod = "close")
    BatchingTimelineUpdater timelineUpdater(TimelineStorePort store,
                                            PerformanceTracker perf,
                                            TimelineProperties props) {
        return new BatchingTimelineUpdater(
                store,
                perf,
                new BootstrapSummarizer(props.getNumBootstrapSamples()),
                Duration.ofSeconds(props.getShutdownTimeoutSeconds()));
    }
}
