package org.learningjava.benchtrend.infrastructure.adapter.out.memory;

import org.learningjava.benchtrend.application.port.TimelineStorePort;
import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;
import org.learningjava.benchtrend.domain.model.timeline.TimelineEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timeline statistics keyed by (run, trial, criterion); a new result replaces the old one.
 */
public class InMemoryTimelineStoreAdapter implements TimelineStorePort {

    private final Map<String, TimelineEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTimelineStoreAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryTimelineStoreAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void recordTimeline(int runId, int trialId, int criterionId, SummaryStatistics stats) {
        String key = runId + "-" + trialId + "-" + criterionId;
        entries.put(key, new TimelineEntry(runId, trialId, criterionId, stats, Instant.now(clock)));
    }

    @Override
    public List<TimelineEntry> findTimeline(int runId, int criterionId) {
        return entries.values().stream()
                .filter(e -> e.runId() == runId && e.criterionId() == criterionId)
                .sorted(Comparator.comparingInt(TimelineEntry::trialId))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
