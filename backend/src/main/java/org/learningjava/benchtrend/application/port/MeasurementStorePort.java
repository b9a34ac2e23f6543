package org.learningjava.benchtrend.application.port;

import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;

import java.util.List;

public interface MeasurementStorePort {

    // Writes (return number of rows stored)
    int recordMeasurements(String project, List<MeasurementRow> rows);

    /**
     * Id of the (name, unit) criterion, created on first use.
     */
    int criterionId(String name, String unit);

    // Reads
    List<MeasurementRow> findMeasurementsForComparison(String project, String baselineCommit, String changeCommit);
}
