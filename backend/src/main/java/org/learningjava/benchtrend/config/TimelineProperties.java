package org.learningjava.benchtrend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "benchtrend.timeline")
public class TimelineProperties {
    private int numBootstrapSamples = 1000;
    private int shutdownTimeoutSeconds = 30;
    private int adminPoolSize = 1;
    private int adminQueueCapacity = 16;

    public int getNumBootstrapSamples() { return numBootstrapSamples; }
    public void setNumBootstrapSamples(int v) { this.numBootstrapSamples = v; }
    public int getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
    public void setShutdownTimeoutSeconds(int v) { this.shutdownTimeoutSeconds = v; }
    public int getAdminPoolSize() { return adminPoolSize; }
    public void setAdminPoolSize(int v) { this.adminPoolSize = v; }
    public int getAdminQueueCapacity() { return adminQueueCapacity; }
    public void setAdminQueueCapacity(int v) { this.adminQueueCapacity = v; }
}
