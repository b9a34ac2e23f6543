package org.learningjava.benchtrend.domain.model.compare;

/**
 * What to do with a change whose magnitude is below the significance threshold.
 */
public enum SignificancePolicy {
    /** Keep the computed change and mark it as not significant. */
    FLAG,
    /** Report the change as zero and mark it as not significant. */
    SUPPRESS
}
