package org.learningjava.benchtrend.domain.model.timeline;

import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;

import java.time.Instant;

public record TimelineEntry(
        int runId,
        int trialId,
        int criterionId,
        SummaryStatistics stats,
        Instant recordedAt
) { }
