package com.seqflow.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "seqflow.scheduler")
public class SchedulerProperties {

    private int workers = 500;
    private int maxAttempts = 1;
    private String engine = "docker";

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public String getEngine() { return engine; }
    public void setEngine(String engine) { this.engine = engine; }
}
