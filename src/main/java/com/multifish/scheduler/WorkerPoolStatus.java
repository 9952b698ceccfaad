package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkerPoolStatus(
        @JsonProperty("WorkerPoolSize") int poolSize,
        @JsonProperty("ActiveWorkers") int activeWorkers,
        @JsonProperty("AvailableWorkers") int availableWorkers,
        @JsonProperty("TotalJobs") int totalJobs,
        @JsonProperty("RunningJobs") int runningJobs
) {}
