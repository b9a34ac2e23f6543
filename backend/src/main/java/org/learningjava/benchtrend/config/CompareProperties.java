package org.learningjava.benchtrend.config;

import org.learningjava.benchtrend.domain.model.compare.SignificancePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "benchtrend.compare")
public class CompareProperties {
    // percent; null keeps every change
    private Double significanceThreshold;
    private SignificancePolicy significancePolicy = SignificancePolicy.FLAG;
    private String overviewCriterion = "total";

    public Double getSignificanceThreshold() { return significanceThreshold; }
    public void setSignificanceThreshold(Double v) { this.significanceThreshold = v; }
    public SignificancePolicy getSignificancePolicy() { return significancePolicy; }
    public void setSignificancePolicy(SignificancePolicy v) { this.significancePolicy = v; }
    public String getOverviewCriterion() { return overviewCriterion; }
    public void setOverviewCriterion(String v) { this.overviewCriterion = v; }
}
