package org.learningjava.benchtrend.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.learningjava.benchtrend.application.usecase.RecordMeasurementsUseCase;
import org.learningjava.benchtrend.domain.model.measurement.MeasurementRow;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rebenchdb/results")
public class MeasurementsController {
    private final RecordMeasurementsUseCase useCase;

    public MeasurementsController(RecordMeasurementsUseCase useCase) {
        this.useCase = useCase;
    }

    // the timeline update keeps running after the response
    @PutMapping
    @ResponseStatus(HttpStatus.CREATED)
    public UploadResponse upload(@Valid @RequestBody ResultsUpload req) {
        var rows = req.measurements().stream().map(MeasurementDTO::toRow).toList();
        var outcome = useCase.record(req.project(), rows);
        return new UploadResponse(outcome.storedMeasurements(),
                "Stored " + outcome.storedMeasurements() + " measurements. Timeline update is ongoing");
    }

    public record ResultsUpload(
            @NotBlank String project,
            @NotEmpty List<@Valid MeasurementDTO> measurements
    ) {
    }

    public record MeasurementDTO(
            @NotBlank String exe,
            @NotBlank String suite,
            @NotBlank String bench,
            @NotBlank String criterion,
            @NotNull String unit,
            @NotBlank String cmdline,
            String varValue,
            String cores,
            String inputSize,
            String extraArgs,
            Integer warmup,
            int envId,
            @NotBlank String commitId,
            int runId,
            int trialId,
            int expId,
            @Min(1) @Max(MeasurementRow.MAX_INDEX) int invocation,
            @Min(1) @Max(MeasurementRow.MAX_INDEX) int iteration,
            double value
    ) {
        MeasurementRow toRow() {
            return new MeasurementRow(
                    exe, suite, bench,
                    criterion, unit, cmdline,
                    varValue, cores, inputSize, extraArgs, warmup,
                    envId, commitId, runId, trialId, expId,
                    invocation, iteration, value
            );
        }
    }

    public record UploadResponse(int stored, String message) {
    }
}
