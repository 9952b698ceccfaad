package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;

import java.time.Instant;
import java.util.List;

/**
 * A scheduled unit of work. Instances handed out by {@link JobRegistry} are
 * copies; only the registry and the scheduler mutate the stored instance.
 */
@JsonPropertyOrder({"Id", "Name", "Machines", "Action", "Payload", "Schedule", "Status",
        "CreatedTime", "LastRunTime", "NextRunTime", "ExecutionCount"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {

    private final String id;
    private final String name;
    private final List<String> machines;
    private final ActionType action;
    private final JobPayload payload;
    private final Schedule schedule;
    private final Instant createdTime;

    private JobStatus status = JobStatus.PENDING;
    private Instant lastRunTime;
    private Instant nextRunTime;
    private int executionCount;

    public Job(String id, String name, List<String> machines, ActionType action,
               JobPayload payload, Schedule schedule, Instant createdTime) {
        this.id = id;
        this.name = name;
        this.machines = List.copyOf(machines);
        this.action = action;
        this.payload = payload;
        this.schedule = schedule;
        this.createdTime = createdTime;
    }

    Job copy() {
        Job copy = new Job(id, name, machines, action, payload, schedule, createdTime);
        copy.status = status;
        copy.lastRunTime = lastRunTime;
        copy.nextRunTime = nextRunTime;
        copy.executionCount = executionCount;
        return copy;
    }

    @JsonProperty("Id")
    public String getId() { return id; }

    @JsonProperty("Name")
    public String getName() { return name; }

    @JsonProperty("Machines")
    public List<String> getMachines() { return machines; }

    @JsonProperty("Action")
    public ActionType getAction() { return action; }

    @JsonProperty("Payload")
    public JobPayload getPayload() { return payload; }

    @JsonProperty("Schedule")
    public Schedule getSchedule() { return schedule; }

    @JsonProperty("Status")
    public JobStatus getStatus() { return status; }

    @JsonProperty("CreatedTime")
    public Instant getCreatedTime() { return createdTime; }

    @JsonProperty("LastRunTime")
    public Instant getLastRunTime() { return lastRunTime; }

    @JsonProperty("NextRunTime")
    public Instant getNextRunTime() { return nextRunTime; }

    @JsonProperty("ExecutionCount")
    public int getExecutionCount() { return executionCount; }

    void setStatus(JobStatus status) { this.status = status; }
    void setLastRunTime(Instant lastRunTime) { this.lastRunTime = lastRunTime; }
    void setNextRunTime(Instant nextRunTime) { this.nextRunTime = nextRunTime; }
    void incrementExecutionCount() { this.executionCount++; }

    boolean isCancelled() {
        return status == JobStatus.CANCELLED;
    }
}
