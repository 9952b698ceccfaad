package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recurrence constraint of a continuous schedule. Dates are {@code YYYY-MM-DD},
 * weekdays are English day names. No weekday and no day-of-month filter means
 * every day between the (inclusive) bounds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Period(
        @JsonProperty("StartDay") String startDay,
        @JsonProperty("EndDay") String endDay,
        @JsonProperty("DaysOfWeek") List<String> daysOfWeek,
        @JsonProperty("DaysOfMonth") String daysOfMonth
) {
    public Period {
        // null entries are kept so validation can report them
        daysOfWeek = daysOfWeek == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(daysOfWeek));
    }

    public boolean hasDaysOfMonth() {
        return daysOfMonth != null && !daysOfMonth.isEmpty();
    }

    public static Period everyDay(String startDay, String endDay) {
        return new Period(startDay, endDay, List.of(), null);
    }
}
