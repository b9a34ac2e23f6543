package org.learningjava.benchtrend.infrastructure.adapter.in.web.admin;

import org.learningjava.benchtrend.application.usecase.timeline.BatchingTimelineUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/admin")
public class TimelineAdminController {

    private static final Logger log = LoggerFactory.getLogger(TimelineAdminController.class);

    private final BatchingTimelineUpdater timeline;
    private final JobRegistry jobs;
    private final Executor executor;

    public TimelineAdminController(BatchingTimelineUpdater timeline,
                                   JobRegistry jobs,
                                   @Qualifier("applicationTaskExecutor") Executor executor) {
        this.timeline = timeline;
        this.jobs = jobs;
        this.executor = executor;
    }

    // answers right away, progress through /admin/jobs/{id}
    @PostMapping("/perform-timeline-update")
    public Map<String, Object> performTimelineUpdate() {
        String jobId = jobs.start("TIMELINE");

        try {
            executor.execute(() -> runTimelineUpdate(jobId));
        } catch (RejectedExecutionException e) {
            jobs.fail(jobId, "Too many timeline updates queued");
            log.warn("[{}] Timeline update rejected, executor is saturated", jobId);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many timeline updates queued", e);
        }

        return Map.of("jobId", jobId);
    }

    private void runTimelineUpdate(String jobId) {
        log.info("[{}] Timeline update requested", jobId);
        try {
            timeline.submitUpdateJobs().whenComplete((numJobs, e) -> {
                if (e != null) {
                    jobs.fail(jobId, e.getMessage());
                    log.error("[{}] Timeline update failed", jobId, e);
                } else {
                    jobs.done(jobId, numJobs, "Processed " + numJobs + " timeline jobs");
                    log.info("[{}] Timeline update done: {} jobs", jobId, numJobs);
                }
            });
        } catch (RuntimeException e) {
            jobs.fail(jobId, e.getMessage());
            log.error("[{}] Timeline update could not be submitted", jobId, e);
        }
    }

    @GetMapping("/jobs/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        JobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job " + id);
        }
        return status;
    }
}
