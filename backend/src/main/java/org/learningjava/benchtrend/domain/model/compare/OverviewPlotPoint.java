package org.learningjava.benchtrend.domain.model.compare;

public record OverviewPlotPoint(
        String executionUnit,
        String suite,
        String benchmark,
        int environmentId,
        String commandLine,
        double ratio
) { }
