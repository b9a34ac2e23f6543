package org.learningjava.benchtrend.domain.model.timeline;

import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;

public record ComputeResult(int runId, int trialId, int criterionId, SummaryStatistics stats) { }
