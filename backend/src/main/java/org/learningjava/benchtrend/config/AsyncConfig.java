package org.learningjava.benchtrend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs admin-triggered timeline updates off the request thread.
 * Sized by {@code benchtrend.timeline.admin-*}; tasks beyond the queue are rejected.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "applicationTaskExecutor")
    public TaskExecutor applicationTaskExecutor(TimelineProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getAdminPoolSize());
        ex.setMaxPoolSize(props.getAdminPoolSize());
        ex.setQueueCapacity(props.getAdminQueueCapacity());
        ex.setThreadNamePrefix("timeline-admin-");
        ex.initialize();
        return ex;
    }
}
