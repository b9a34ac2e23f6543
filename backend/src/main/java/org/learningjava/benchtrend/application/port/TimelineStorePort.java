package org.learningjava.benchtrend.application.port;

import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;
import org.learningjava.benchtrend.domain.model.timeline.TimelineEntry;

import java.util.List;

public interface TimelineStorePort {

    /**
     * Stores (or replaces) the timeline statistics of one run, trial and criterion.
     */
    void recordTimeline(int runId, int trialId, int criterionId, SummaryStatistics stats);

    // Reads
    List<TimelineEntry> findTimeline(int runId, int criterionId);
}
