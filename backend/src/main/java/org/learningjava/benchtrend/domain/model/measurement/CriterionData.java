package org.learningjava.benchtrend.domain.model.measurement;

public record CriterionData(String name, String unit) { }
