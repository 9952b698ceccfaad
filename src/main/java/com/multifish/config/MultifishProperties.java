package com.multifish.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "multifish")
public class MultifishProperties {

    private JobServiceProperties jobService = new JobServiceProperties();
    private List<MachineProperties> machines = new ArrayList<>();

    public JobServiceProperties getJobService() { return jobService; }
    public void setJobService(JobServiceProperties jobService) { this.jobService = jobService; }

    public List<MachineProperties> getMachines() { return machines; }
    public void setMachines(List<MachineProperties> machines) { this.machines = machines; }

    public static class JobServiceProperties {
        private int workerPoolSize = 99;
        private String logsDir = "./logs";
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration driftWarningThreshold = Duration.ofMillis(100);
        private Duration delayWarningThreshold = Duration.ofSeconds(2);

        public int getWorkerPoolSize() { return workerPoolSize; }
        public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
        public String getLogsDir() { return logsDir; }
        public void setLogsDir(String logsDir) { this.logsDir = logsDir; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public Duration getDriftWarningThreshold() { return driftWarningThreshold; }
        public void setDriftWarningThreshold(Duration d) { this.driftWarningThreshold = d; }
        public Duration getDelayWarningThreshold() { return delayWarningThreshold; }
        public void setDelayWarningThreshold(Duration d) { this.delayWarningThreshold = d; }
    }

    public static class MachineProperties {
        private String id;
        private String endpoint;
        private List<String> supportedActions = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public List<String> getSupportedActions() { return supportedActions; }
        public void setSupportedActions(List<String> supportedActions) { this.supportedActions = supportedActions; }
    }
}
