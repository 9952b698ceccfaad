package com.multifish.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for the job service.
 */
@Component
public class JobServiceMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger poolSize = new AtomicInteger(0);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);

    public JobServiceMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("multifish.workers.pool_size", poolSize);
        registry.gauge("multifish.workers.active", activeWorkers);
    }

    // --- Job runs ---

    public void recordJobExecution(String action, String status, Duration duration) {
        Counter.builder("multifish.jobs.executions")
                .tag("action", action)
                .tag("status", status)
                .register(registry).increment();
        Timer.builder("multifish.jobs.duration")
                .tag("action", action)
                .register(registry).record(duration);
    }

    public void recordMachineAttempt(String action, boolean success) {
        Counter.builder("multifish.machine.attempts")
                .tag("action", action)
                .tag("outcome", success ? "success" : "failure")
                .register(registry).increment();
    }

    // --- Scheduler ---

    public void recordSkippedPoolFull() {
        registry.counter("multifish.scheduler.skipped", "reason", "pool_full").increment();
    }

    public void recordSchedulingAnomaly() {
        registry.counter("multifish.scheduler.anomalies").increment();
    }

    public void updateWorkerPool(int size, int active) {
        poolSize.set(size);
        activeWorkers.set(active);
    }
}
