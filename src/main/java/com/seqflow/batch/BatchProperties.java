package com.seqflow.batch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "seqflow.batch")
public class BatchProperties {

    private String backend = "docker";
    private String queue = "optimal";
    private String jobRole = "";
    private Duration pollInterval = Duration.ofSeconds(10);
    private int maxRetries = 5;
    private Duration initialBackoff = Duration.ofSeconds(2);
    private int maxPollFailures = 5;
    private String scratchMount = "/scratch";

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }
    public String getQueue() { return queue; }
    public void setQueue(String queue) { this.queue = queue; }
    public String getJobRole() { return jobRole; }
    public void setJobRole(String jobRole) { this.jobRole = jobRole; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    public int getMaxPollFailures() { return maxPollFailures; }
    public void setMaxPollFailures(int maxPollFailures) { this.maxPollFailures = maxPollFailures; }
    public String getScratchMount() { return scratchMount; }
    public void setScratchMount(String scratchMount) { this.scratchMount = scratchMount; }
}
