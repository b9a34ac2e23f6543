package org.learningjava.benchtrend.infrastructure.adapter.in.web.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.benchtrend.application.usecase.timeline.BatchingTimelineUpdater;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TimelineAdminControllerTest {

    private BatchingTimelineUpdater timeline;
    private JobRegistry jobs;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        timeline = mock(BatchingTimelineUpdater.class);
        jobs = mock(JobRegistry.class);

        // Run tasks immediately so we can assert interactions deterministically
        TimelineAdminController controller = new TimelineAdminController(timeline, jobs, Runnable::run);

        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mvc = MockMvcBuilders
                .standaloneSetup(controller)
                .setMessageConverters(new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    @Test
    void performTimelineUpdate_returnsJobId_and_marksDone() throws Exception {
        given(jobs.start("TIMELINE")).willReturn("job-ok");
        given(timeline.submitUpdateJobs()).willReturn(CompletableFuture.completedFuture(4));

        mvc.perform(post("/admin/perform-timeline-update"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.jobId", equalTo("job-ok")));

        verify(timeline).submitUpdateJobs();
        verify(jobs).done(eq("job-ok"), eq(4), contains("4"));
        verify(jobs, never()).fail(anyString(), anyString());
    }

    @Test
    void performTimelineUpdate_pendingWave_leavesJobRunning() throws Exception {
        given(jobs.start("TIMELINE")).willReturn("job-wait");
        given(timeline.submitUpdateJobs()).willReturn(new CompletableFuture<>());

        mvc.perform(post("/admin/perform-timeline-update"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId", equalTo("job-wait")));

        verify(jobs, never()).done(anyString(), anyInt(), anyString());
        verify(jobs, never()).fail(anyString(), anyString());
    }

    @Test
    void performTimelineUpdate_failedWave_marksJobFailed() throws Exception {
        given(jobs.start("TIMELINE")).willReturn("job-bad");
        given(timeline.submitUpdateJobs()).willReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        mvc.perform(post("/admin/perform-timeline-update"))
                .andExpect(status().isOk());

        verify(jobs).fail(eq("job-bad"), contains("boom"));
    }

    @Test
    void performTimelineUpdate_saturatedExecutor_returns503_and_failsJob() throws Exception {
        given(jobs.start("TIMELINE")).willReturn("job-full");
        TimelineAdminController saturated = new TimelineAdminController(timeline, jobs, task -> {
            throw new TaskRejectedException("queue full");
        });
        MockMvc full = MockMvcBuilders.standaloneSetup(saturated).build();

        full.perform(post("/admin/perform-timeline-update"))
                .andExpect(status().isServiceUnavailable());

        verify(jobs).fail(eq("job-full"), contains("Too many"));
        verifyNoInteractions(timeline);
    }

    @Test
    void jobStatus_returnsSnapshot() throws Exception {
        JobRegistry.JobStatus snap = new JobRegistry.JobStatus(
                "j-1", "TIMELINE", JobRegistry.JobState.DONE, "ok", 10, Instant.parse("2026-01-02T03:04:05Z"));
        given(jobs.get("j-1")).willReturn(snap);

        mvc.perform(get("/admin/jobs/{id}", "j-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", equalTo("j-1")))
                .andExpect(jsonPath("$.type", equalTo("TIMELINE")))
                .andExpect(jsonPath("$.state", equalTo("DONE")))
                .andExpect(jsonPath("$.processed", equalTo(10)))
                .andExpect(jsonPath("$.startedAt", equalTo("2026-01-02T03:04:05Z")));
    }

    @Test
    void jobStatus_unknownId_returns404() throws Exception {
        mvc.perform(get("/admin/jobs/{id}", "missing"))
                .andExpect(status().isNotFound());
    }
}
