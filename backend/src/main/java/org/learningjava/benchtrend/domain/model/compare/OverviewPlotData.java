package org.learningjava.benchtrend.domain.model.compare;

import java.util.List;
import java.util.Map;

/**
 * One point per compared run configuration, grouped by suite.
 */
public record OverviewPlotData(String criterion, Map<String, List<OverviewPlotPoint>> bySuite) {

    public int numberOfPoints() {
        return bySuite.values().stream().mapToInt(List::size).sum();
    }
}
