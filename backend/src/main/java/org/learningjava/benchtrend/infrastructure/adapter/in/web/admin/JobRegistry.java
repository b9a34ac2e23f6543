package org.learningjava.benchtrend.infrastructure.adapter.in.web.admin;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Status of fire-and-forget admin jobs, so callers can poll what became of them.
 */
@Component
public class JobRegistry {

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            int processed,
            Instant startedAt
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();

    public String start(String type) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", 0, Instant.now()));
        return id;
    }

    public void done(String id, int processed, String message) {
        finish(id, JobState.DONE, processed, message != null ? message : "Done");
    }

    public void fail(String id, String message) {
        JobStatus cur = jobs.get(id);
        finish(id, JobState.FAILED, cur == null ? 0 : cur.processed(), message != null ? message : "Failed");
    }

    public JobStatus get(String id) {
        return jobs.get(id);
    }

    private void finish(String id, JobState state, int processed, String message) {
        jobs.compute(id, (k, j) -> {
            String type = j != null ? j.type() : "TIMELINE";
            Instant startedAt = j != null ? j.startedAt() : Instant.now();
            return new JobStatus(id, type, state, message, processed, startedAt);
        });
    }
}
