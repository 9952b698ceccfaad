package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * When a job runs. {@code type} is kept as received so the validator can report
 * unknown values instead of failing deserialization.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Schedule(
        @JsonProperty("Type") String type,
        @JsonProperty("Time") String time,
        @JsonProperty("Period") Period period
) {

    public static Schedule once(String time) {
        return new Schedule(ScheduleType.ONCE.wireName(), time, null);
    }

    public static Schedule continuous(String time, Period period) {
        return new Schedule(ScheduleType.CONTINUOUS.wireName(), time, period);
    }

    public Optional<ScheduleType> scheduleType() {
        return ScheduleType.fromWireName(type);
    }

    @JsonIgnore
    public boolean isOnce() {
        return scheduleType().orElse(null) == ScheduleType.ONCE;
    }
}
