package org.learningjava.benchtrend.bootstrap;

import org.junit.jupiter.api.Test;
import org.learningjava.benchtrend.application.usecase.CompareRevisionsUseCase;
import org.learningjava.benchtrend.application.usecase.RecordMeasurementsUseCase;
import org.learningjava.benchtrend.domain.model.compare.ComparisonReport;
import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.benchtrend.domain.model.measurement.TestRows.row;

@SpringBootTest(classes = BenchTrendApplication.class, properties = "benchtrend.timeline.num-bootstrap-samples=50")
class BenchTrendApplicationTest {

    @Autowired
    private RecordMeasurementsUseCase record;

    @Autowired
    private CompareRevisionsUseCase compare;

    @Test
    void upload_then_compare() throws Exception {
        List<MeasurementRow> rows = new ArrayList<>();
        for (int it = 1; it <= 5; it++) {
            rows.add(row("Richards", "total", "base", 1, it, 100 + it));
            rows.add(row("som", "macro", "Richards", "total", "som -cp core-lib Richards", 1, "change",
                    1, 2, 1, it, 90 + it));
        }

        var outcome = record.record("som", rows);

        assertEquals(10, outcome.storedMeasurements());
        // one timeline job per trial
        assertEquals(2, outcome.timelineJobs().get(10, TimeUnit.SECONDS));

        ComparisonReport report = compare.compare("som", "base", "change").orElseThrow();
        double change = report.benchmarks().get(0).runConfigs().get(0).statistics().get("total").changeM();
        assertEquals((93.0 / 103.0 - 1) * 100, change, 1e-9);
    }
}
