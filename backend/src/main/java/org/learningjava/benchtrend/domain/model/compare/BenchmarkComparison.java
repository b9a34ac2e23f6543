package org.learningjava.benchtrend.domain.model.compare;

import java.util.List;

public record BenchmarkComparison(
        String executionUnit,
        String suite,
        String benchmark,
        List<RunConfigComparison> runConfigs
) { }
