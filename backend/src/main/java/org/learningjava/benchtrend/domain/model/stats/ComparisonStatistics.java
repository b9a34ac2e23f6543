package org.learningjava.benchtrend.domain.model.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics of the change revision of one series, relative to its baseline.
 *
 * @param median      median of the change series
 * @param samples     number of values in the change series
 * @param changeM     percentage change of the median, 100 means the median doubled
 * @param significant {@code null} when no significance threshold was applied
 */
public record ComparisonStatistics(
        double median,
        int samples,
        @JsonProperty("change_m") double changeM,
        @JsonInclude(JsonInclude.Include.NON_NULL) Boolean significant
) { }
