package com.multifish.scheduler;

import com.multifish.config.MultifishProperties.JobServiceProperties;
import com.multifish.observability.JobServiceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Job service facade. Owns the tick loop that finds due jobs, admits them
 * through the {@link WorkerPool} without blocking, and hands them to the
 * {@link ExecutionEngine}.
 *
 * <p>Lock order is registry lock, then the running-set monitor. A job is never
 * executed twice concurrently; a due job that finds the pool full waits for a
 * later tick.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobRegistry registry;
    private final JobValidator validator;
    private final ExecutionEngine executionEngine;
    private final ScheduleCalculator scheduleCalculator;
    private final JobServiceMetrics metrics;
    private final Clock clock;
    private final TaskExecutor jobExecutor;
    private final TaskScheduler tickScheduler;
    private final LongSupplier nanoTime;
    private final WorkerPool workerPool;
    private final Duration tickInterval;
    private final Duration driftWarningThreshold;
    private final Duration delayWarningThreshold;

    private final Set<String> runningJobs = new HashSet<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong lastTickNanos = new AtomicLong(0);
    private volatile ScheduledFuture<?> tickFuture;

    public JobScheduler(JobRegistry registry,
                        JobValidator validator,
                        ExecutionEngine executionEngine,
                        ScheduleCalculator scheduleCalculator,
                        JobServiceMetrics metrics,
                        Clock clock,
                        JobServiceProperties properties,
                        TaskExecutor jobExecutor,
                        TaskScheduler tickScheduler) {
        this(registry, validator, executionEngine, scheduleCalculator, metrics, clock, properties,
                jobExecutor, tickScheduler, System::nanoTime);
    }

    JobScheduler(JobRegistry registry,
                 JobValidator validator,
                 ExecutionEngine executionEngine,
                 ScheduleCalculator scheduleCalculator,
                 JobServiceMetrics metrics,
                 Clock clock,
                 JobServiceProperties properties,
                 TaskExecutor jobExecutor,
                 TaskScheduler tickScheduler,
                 LongSupplier nanoTime) {
        this.registry = registry;
        this.validator = validator;
        this.executionEngine = executionEngine;
        this.scheduleCalculator = scheduleCalculator;
        this.metrics = metrics;
        this.clock = clock;
        this.jobExecutor = jobExecutor;
        this.tickScheduler = tickScheduler;
        this.nanoTime = nanoTime;
        this.workerPool = new WorkerPool(properties.getWorkerPoolSize());
        this.tickInterval = properties.getTickInterval();
        this.driftWarningThreshold = properties.getDriftWarningThreshold();
        this.delayWarningThreshold = properties.getDelayWarningThreshold();
        metrics.updateWorkerPool(workerPool.capacity(), 0);
    }

    // --- Lifecycle ---

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        tickFuture = tickScheduler.scheduleAtFixedRate(this::onTick,
                clock.instant().plus(tickInterval), tickInterval);
        log.info("Job scheduler started: tickInterval={} workerPoolSize={}",
                tickInterval, workerPool.capacity());
    }

    /**
     * Stops the tick loop. Runs already in progress are not interrupted.
     * Calling this more than once has no further effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> future = tickFuture;
        if (future != null) {
            future.cancel(false);
        }
        log.info("Job scheduler stopped");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    // --- Job API ---

    public JobCreationResult createJob(JobCreateRequest request) {
        ValidationResult validation = validator.validate(request);
        if (!validation.valid()) {
            log.info("Job rejected: name={} reason={}", request.name(), validation.message());
            return new JobCreationResult(null, validation);
        }
        Job job = registry.create(request.name(), request.machines(), validation.resolvedAction(),
                validation.resolvedPayload(), request.schedule());
        if (scheduleCalculator.nextRun(job.getSchedule(), job.getCreatedTime()).fallback()) {
            metrics.recordSchedulingAnomaly();
        }
        return new JobCreationResult(job, validation);
    }

    public Job getJob(String jobId) {
        return registry.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<Job> listJobs() {
        return registry.list();
    }

    public void deleteJob(String jobId) {
        if (!registry.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
    }

    public Job cancelJob(String jobId) {
        if (!registry.cancel(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return getJob(jobId);
    }

    public WorkerPoolStatus getWorkerPoolStatus() {
        int totalJobs = registry.size();
        int running;
        synchronized (runningJobs) {
            running = runningJobs.size();
        }
        return new WorkerPoolStatus(workerPool.capacity(), workerPool.active(),
                workerPool.available(), totalJobs, running);
    }

    /**
     * Changes the number of concurrent job executions. Runs in flight keep their
     * slots as far as the new size allows.
     */
    public void setWorkerPoolSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("worker pool size must be greater than 0, got " + size);
        }
        int[] previous = new int[1];
        registry.runLocked(() -> {
            previous[0] = workerPool.capacity();
            workerPool.resize(size);
        });
        metrics.updateWorkerPool(workerPool.capacity(), workerPool.active());
        log.info("Worker pool resized: {} -> {}", previous[0], size);
    }

    // --- Tick ---

    /**
     * One timer firing: drift check, then {@link #tick()}. Never throws, so the
     * fixed-rate task keeps running.
     */
    void onTick() {
        try {
            checkDrift();
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    private void checkDrift() {
        long nowNanos = nanoTime.getAsLong();
        long previous = lastTickNanos.getAndSet(nowNanos);
        if (previous == 0) {
            return;
        }
        Duration drift = Duration.ofNanos(nowNanos - previous).minus(tickInterval).abs();
        if (drift.compareTo(driftWarningThreshold) > 0) {
            log.warn("Scheduler tick drift of {} exceeds {}", drift, driftWarningThreshold);
            metrics.recordSchedulingAnomaly();
        }
    }

    /**
     * Admits every due job the pool has room for. Package-private so tests can
     * drive scheduling without the timer thread.
     */
    void tick() {
        Instant now = clock.instant();
        List<Job> admitted = new ArrayList<>();

        registry.forEach(job -> {
            Instant nextRun = job.getNextRunTime();
            if (job.isCancelled() || nextRun == null || !now.isAfter(nextRun)) {
                return;
            }
            synchronized (runningJobs) {
                if (runningJobs.contains(job.getId())) {
                    return;
                }
                if (!workerPool.tryAcquire()) {
                    log.debug("Worker pool full, job {} deferred", job.getId());
                    metrics.recordSkippedPoolFull();
                    return;
                }
                runningJobs.add(job.getId());
            }
            Duration delay = Duration.between(nextRun, now);
            if (delay.compareTo(delayWarningThreshold) > 0) {
                log.warn("Job {} started {} after its scheduled time", job.getId(), delay);
                metrics.recordSchedulingAnomaly();
            }
            job.setStatus(JobStatus.RUNNING);
            admitted.add(job.copy());
        });

        metrics.updateWorkerPool(workerPool.capacity(), workerPool.active());
        for (Job job : admitted) {
            submit(job);
        }
    }

    private void submit(Job job) {
        try {
            jobExecutor.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            log.error("Job {} could not be submitted: {}", job.getId(), e.getMessage());
            registry.update(job.getId(), stored -> {
                if (!stored.isCancelled()) {
                    stored.setStatus(JobStatus.PENDING);
                }
            });
            releaseSlot(job.getId());
        }
    }

    private void run(Job job) {
        MDC.put("jobId", job.getId());
        ExecutionHistory history = null;
        try {
            history = executionEngine.executeJob(job);
        } catch (RuntimeException e) {
            log.error("Job {} execution aborted: {}", job.getId(), e.getMessage(), e);
        } finally {
            try {
                completeRun(job, history);
            } finally {
                releaseSlot(job.getId());
                MDC.remove("jobId");
            }
        }
    }

    private void completeRun(Job job, ExecutionHistory history) {
        Instant finished = clock.instant();
        JobStatus outcome = history != null ? history.status() : JobStatus.FAILED;
        boolean[] fallback = new boolean[1];

        boolean present = registry.update(job.getId(), stored -> {
            stored.setLastRunTime(finished);
            stored.incrementExecutionCount();
            if (stored.isCancelled()) {
                return;
            }
            if (stored.getSchedule().isOnce()) {
                stored.setStatus(outcome);
                stored.setNextRunTime(null);
            } else {
                ScheduleCalculator.NextRun next = scheduleCalculator.nextRun(stored.getSchedule(), finished);
                if (next.fallback()) {
                    fallback[0] = true;
                    log.warn("Job {} has no computable next run ({}), falling back to {}",
                            stored.getId(), next.reason(), next.time());
                }
                stored.setStatus(JobStatus.PENDING);
                stored.setNextRunTime(next.time());
            }
        });
        if (fallback[0]) {
            metrics.recordSchedulingAnomaly();
        }
        if (!present) {
            log.debug("Job {} was deleted while running", job.getId());
        }
    }

    private void releaseSlot(String jobId) {
        synchronized (runningJobs) {
            runningJobs.remove(jobId);
            workerPool.release();
        }
        metrics.updateWorkerPool(workerPool.capacity(), workerPool.active());
    }
}
