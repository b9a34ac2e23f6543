package org.learningjava.benchtrend.infrastructure.adapter.in.web;

import org.learningjava.benchtrend.application.usecase.CompareRevisionsUseCase;
import org.learningjava.benchtrend.domain.model.compare.ComparisonReport;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/compare")
public class CompareController {

    private final CompareRevisionsUseCase useCase;

    public CompareController(CompareRevisionsUseCase useCase) {
        this.useCase = useCase;
    }

    @GetMapping("/{project}/{baseline}/{change}")
    public ComparisonReport compare(@PathVariable("project") String project,
                                    @PathVariable("baseline") String baseline,
                                    @PathVariable("change") String change) {
        return useCase.compare(project, baseline, change)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "The requested project " + project + " does not have data on the revisions "
                                + baseline + " and " + change + "."));
    }
}
