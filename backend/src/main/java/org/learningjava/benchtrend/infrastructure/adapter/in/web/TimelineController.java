package org.learningjava.benchtrend.infrastructure.adapter.in.web;

import org.learningjava.benchtrend.application.port.TimelineStorePort;
import org.learningjava.benchtrend.domain.model.timeline.TimelineEntry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/timeline")
public class TimelineController {

    private final TimelineStorePort store;

    public TimelineController(TimelineStorePort store) {
        this.store = store;
    }

    @GetMapping
    public List<TimelineEntry> list(@RequestParam("runId") int runId, @RequestParam("criterionId") int criterionId) {
        return store.findTimeline(runId, criterionId);
    }
}
