package org.learningjava.benchtrend.domain.model.measurement;

/**
 * Settings shared by every series recorded with the same command line.
 * Created once per command line during collation and shared by reference.
 */
public record RunSettings(
        String commandLine,
        String varValue,
        String cores,
        String inputSize,
        String extraArgs,
        Integer warmup,
        String simplifiedCommandLine
) { }
