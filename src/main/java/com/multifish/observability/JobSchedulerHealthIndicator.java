package com.multifish.observability;

import com.multifish.scheduler.JobScheduler;
import com.multifish.scheduler.WorkerPoolStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class JobSchedulerHealthIndicator implements HealthIndicator {

    private final JobScheduler scheduler;

    public JobSchedulerHealthIndicator(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        WorkerPoolStatus pool = scheduler.getWorkerPoolStatus();
        Health.Builder builder = scheduler.isRunning() ? Health.up() : Health.down();
        return builder
                .withDetail("workerPoolSize", pool.poolSize())
                .withDetail("activeWorkers", pool.activeWorkers())
                .withDetail("totalJobs", pool.totalJobs())
                .withDetail("runningJobs", pool.runningJobs())
                .build();
    }
}
