package org.learningjava.benchtrend.domain.model.compare;

import java.util.List;

/**
 * Table of contents of a comparison.
 *
 * @param nav                  suites per execution unit
 * @param exeComparisonSuites  suites measured on more than one execution unit
 */
public record Navigation(List<Entry> nav, List<String> exeComparisonSuites) {

    public record Entry(String exeName, List<String> suites) { }
}
