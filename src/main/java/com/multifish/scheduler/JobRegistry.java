package com.multifish.scheduler;

import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * In-memory job store. Every access goes through one registry-wide lock; callers
 * receive copies so stored jobs are only changed through this class.
 */
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ScheduleCalculator scheduleCalculator;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public JobRegistry(ScheduleCalculator scheduleCalculator, Clock clock) {
        this(scheduleCalculator, clock, () -> "Job-" + UUID.randomUUID());
    }

    public JobRegistry(ScheduleCalculator scheduleCalculator, Clock clock, Supplier<String> idGenerator) {
        this.scheduleCalculator = scheduleCalculator;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public Job create(String name, List<String> machines, ActionType action,
                      JobPayload payload, Schedule schedule) {
        lock.lock();
        try {
            String id = idGenerator.get();
            while (jobs.containsKey(id)) {
                id = idGenerator.get();
            }
            Instant now = clock.instant();
            Job job = new Job(id, name, machines, action, payload, schedule, now);
            ScheduleCalculator.NextRun nextRun = scheduleCalculator.nextRun(schedule, now);
            if (nextRun.fallback()) {
                log.warn("Job {} has no computable next run ({}), falling back to {}",
                        id, nextRun.reason(), nextRun.time());
            }
            job.setNextRunTime(nextRun.time());
            jobs.put(id, job);
            log.info("Job created: id={} action={} machines={} nextRun={}",
                    id, action.wireName(), machines.size(), nextRun.time());
            return job.copy();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> get(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.copy());
        } finally {
            lock.unlock();
        }
    }

    public List<Job> list() {
        lock.lock();
        try {
            List<Job> snapshot = new ArrayList<>(jobs.size());
            for (Job job : jobs.values()) {
                snapshot.add(job.copy());
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the job. A run already in progress is left to finish.
     */
    public boolean delete(String jobId) {
        lock.lock();
        try {
            boolean removed = jobs.remove(jobId) != null;
            if (removed) {
                log.info("Job deleted: id={}", jobId);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the job Cancelled and clears its next run. Repeated calls are harmless.
     */
    public boolean cancel(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            job.setStatus(JobStatus.CANCELLED);
            job.setNextRunTime(null);
            log.info("Job cancelled: id={}", jobId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code mutation} to the stored job under the registry lock.
     * Returns false when the job no longer exists.
     */
    boolean update(String jobId, Consumer<Job> mutation) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            mutation.accept(job);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Visits every stored job under the registry lock. The visitor must not block.
     */
    void forEach(Consumer<Job> visitor) {
        lock.lock();
        try {
            jobs.values().forEach(visitor);
        } finally {
            lock.unlock();
        }
    }

    void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
