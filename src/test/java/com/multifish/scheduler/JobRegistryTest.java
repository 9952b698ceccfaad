package com.multifish.scheduler;

import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;
import com.multifish.action.payload.PatchProfilePayload;
import com.multifish.action.payload.ProfilePatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private static final Instant NOW = Instant.parse("2026-02-10T10:00:00Z");
    private static final JobPayload PAYLOAD = PatchProfilePayload.of(
            List.of(new PatchProfilePayload.Entry("bmc", new ProfilePatch("Balanced"))));

    private final MutableClock clock = new MutableClock(NOW);
    private final AtomicInteger ids = new AtomicInteger();

    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new JobRegistry(new ScheduleCalculator(ZoneOffset.UTC), clock,
                () -> "Job-" + ids.incrementAndGet());
    }

    private Job createOnce(String time) {
        return registry.create("profile", List.of("m1", "m2"), ActionType.PATCH_PROFILE,
                PAYLOAD, Schedule.once(time));
    }

    @Test
    void createComputesNextRunAndStartsPending() {
        Job job = createOnce("12:00:00");

        assertEquals("Job-1", job.getId());
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(NOW, job.getCreatedTime());
        assertEquals(Instant.parse("2026-02-10T12:00:00Z"), job.getNextRunTime());
        assertEquals(0, job.getExecutionCount());
        assertNull(job.getLastRunTime());
        assertEquals(List.of("m1", "m2"), job.getMachines());
    }

    @Test
    void defaultIdsArePrefixedAndUnique() {
        JobRegistry defaults = new JobRegistry(new ScheduleCalculator(ZoneOffset.UTC), clock);

        Job first = defaults.create("a", List.of("m1"), ActionType.PATCH_PROFILE, PAYLOAD, Schedule.once("12:00:00"));
        Job second = defaults.create("b", List.of("m1"), ActionType.PATCH_PROFILE, PAYLOAD, Schedule.once("12:00:00"));

        assertTrue(first.getId().startsWith("Job-"));
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void unmatchableScheduleStillGetsFallbackRunTime() {
        Period neverMatches = new Period("2026-01-01", "2026-12-31", List.of(), "1,15");

        Job job = registry.create("dom", List.of("m1"), ActionType.PATCH_PROFILE, PAYLOAD,
                Schedule.continuous("02:00:00", neverMatches));

        assertEquals(NOW.plus(ScheduleCalculator.FALLBACK_DELAY), job.getNextRunTime());
    }

    @Test
    void returnedJobsAreCopies() {
        Job job = createOnce("12:00:00");
        job.setStatus(JobStatus.FAILED);

        assertEquals(JobStatus.PENDING, registry.get(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void listKeepsCreationOrder() {
        createOnce("12:00:00");
        createOnce("13:00:00");

        List<Job> jobs = registry.list();
        assertEquals(List.of("Job-1", "Job-2"), jobs.stream().map(Job::getId).toList());
        assertEquals(2, registry.size());
    }

    @Test
    void cancelIsTerminalAndRepeatable() {
        Job job = createOnce("12:00:00");

        assertTrue(registry.cancel(job.getId()));
        assertTrue(registry.cancel(job.getId()));

        Job stored = registry.get(job.getId()).orElseThrow();
        assertEquals(JobStatus.CANCELLED, stored.getStatus());
        assertNull(stored.getNextRunTime());
        assertFalse(registry.cancel("Job-404"));
    }

    @Test
    void deleteRemovesJob() {
        Job job = createOnce("12:00:00");

        assertTrue(registry.delete(job.getId()));
        assertTrue(registry.get(job.getId()).isEmpty());
        assertFalse(registry.delete(job.getId()));
    }

    @Test
    void updateReportsMissingJob() {
        assertFalse(registry.update("Job-404", job -> fail("must not be called")));
    }
}
