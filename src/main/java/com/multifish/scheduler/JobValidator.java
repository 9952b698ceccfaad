package com.multifish.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;
import com.multifish.machine.MachineDirectory;
import com.multifish.machine.MachineHandle;
import com.multifish.machine.MachineNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates job creation requests. Read-only against the {@link MachineDirectory};
 * problems are reported in the returned {@link ValidationResult}, never thrown.
 */
@Component
public class JobValidator {

    private static final Logger log = LoggerFactory.getLogger(JobValidator.class);

    private static final Set<String> WEEKDAY_NAMES = Arrays.stream(DayOfWeek.values())
            .map(day -> day.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
            .collect(Collectors.toUnmodifiableSet());

    private final MachineDirectory machineDirectory;
    private final ObjectMapper objectMapper;

    public JobValidator(MachineDirectory machineDirectory, ObjectMapper objectMapper) {
        this.machineDirectory = machineDirectory;
        this.objectMapper = objectMapper;
    }

    public ValidationResult validate(JobCreateRequest request) {
        List<String> requestErrors = validateStructure(request);
        List<String> scheduleErrors = validateSchedule(request.schedule());

        List<String> actionErrors = new ArrayList<>();
        ActionType action = ActionType.fromWireName(request.action()).orElse(null);
        if (action == null) {
            actionErrors.add("unsupported action type '" + request.action()
                    + "'. Valid actions are: " + ActionType.wireNames());
        }

        List<String> payloadErrors = new ArrayList<>();
        JobPayload payload = null;
        if (action == null) {
            payloadErrors.add("payload cannot be checked without a supported action type");
        } else {
            payload = parsePayload(action, request, payloadErrors);
        }

        List<MachineValidationResult> machineResults = request.machines().stream()
                .map(machineId -> validateMachine(machineId, request.action(), action))
                .toList();

        ValidationResult result = ValidationResult.of(requestErrors, scheduleErrors, actionErrors,
                payloadErrors, machineResults, action, payloadErrors.isEmpty() ? payload : null);
        if (!result.valid()) {
            log.debug("Job validation failed: name={} action={} request={} schedule={} payload={}",
                    request.name(), request.action(), requestErrors, scheduleErrors, payloadErrors);
        }
        return result;
    }

    private List<String> validateStructure(JobCreateRequest request) {
        List<String> errors = new ArrayList<>();
        if (request.machines().isEmpty()) {
            errors.add("At least one machine must be specified");
            return errors;
        }
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new HashSet<>();
        for (String machineId : request.machines()) {
            if (machineId == null || machineId.isBlank()) {
                errors.add("machine identifiers cannot be empty");
            } else if (!seen.add(machineId)) {
                duplicates.add(machineId);
            }
        }
        if (!duplicates.isEmpty()) {
            log.warn("Job request '{}' targets machines more than once: {}", request.name(), duplicates);
        }
        return errors;
    }

    List<String> validateSchedule(Schedule schedule) {
        List<String> errors = new ArrayList<>();
        if (schedule == null) {
            errors.add("Schedule is required");
            return errors;
        }

        Optional<ScheduleType> type = schedule.scheduleType();
        if (type.isEmpty()) {
            errors.add("invalid schedule type: " + schedule.type() + " (must be 'Once' or 'Continuous')");
        }
        if (ScheduleCalculator.parseTime(schedule.time()).isEmpty()) {
            errors.add("invalid time format: " + schedule.time() + " (expected HH:MM:SS)");
        }

        if (type.orElse(null) == ScheduleType.ONCE && schedule.period() != null) {
            errors.add("Period must be null for 'Once' schedule type");
        } else if (type.orElse(null) == ScheduleType.CONTINUOUS) {
            if (schedule.period() == null) {
                errors.add("Period is required for 'Continuous' schedule type");
            } else {
                errors.addAll(validatePeriod(schedule.period()));
            }
        }
        return errors;
    }

    private List<String> validatePeriod(Period period) {
        List<String> errors = new ArrayList<>();
        Optional<LocalDate> start = ScheduleCalculator.parseDate(period.startDay());
        Optional<LocalDate> end = ScheduleCalculator.parseDate(period.endDay());
        if (period.startDay() != null && start.isEmpty()) {
            errors.add("invalid StartDay format: " + period.startDay() + " (expected YYYY-MM-DD)");
        }
        if (period.endDay() != null && end.isEmpty()) {
            errors.add("invalid EndDay format: " + period.endDay() + " (expected YYYY-MM-DD)");
        }
        if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
            errors.add("StartDay must be before or equal to EndDay");
        }
        for (String day : period.daysOfWeek()) {
            if (day == null || !WEEKDAY_NAMES.contains(day)) {
                errors.add("invalid day of week: " + day);
            }
        }
        return errors;
    }

    private JobPayload parsePayload(ActionType action, JobCreateRequest request, List<String> errors) {
        if (request.payload() == null || request.payload().isNull()) {
            errors.add("payload is required for " + action.wireName() + " action");
            return null;
        }
        ObjectReader reader = objectMapper.readerFor(action.payloadType())
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        JobPayload payload;
        try {
            payload = reader.readValue(request.payload());
        } catch (UnrecognizedPropertyException e) {
            errors.add("field '" + e.getPropertyName() + "' is not allowed for " + action.wireName()
                    + ". Allowed fields: " + e.getKnownPropertyIds());
            return null;
        } catch (JsonProcessingException e) {
            errors.add("invalid payload format for " + action.wireName() + " action: " + e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            errors.add("invalid payload format for " + action.wireName() + " action: " + e.getMessage());
            return null;
        }
        if (payload == null) {
            errors.add("payload is required for " + action.wireName() + " action");
            return null;
        }
        errors.addAll(payload.validate());
        return payload;
    }

    private MachineValidationResult validateMachine(String machineId, String requestedAction,
                                                    ActionType action) {
        MachineHandle machine;
        try {
            machine = machineDirectory.resolve(machineId);
        } catch (MachineNotFoundException e) {
            return new MachineValidationResult(machineId, false, "Machine not found", List.of(e.getMessage()));
        }

        List<String> errors = new ArrayList<>();
        if (action == null) {
            errors.add("action '" + requestedAction + "' is not supported");
        } else if (!machine.supports(action)) {
            errors.add("machine " + machineId + " does not support action " + action.wireName());
        }
        return errors.isEmpty()
                ? new MachineValidationResult(machineId, true, "Machine is valid for the requested action", errors)
                : new MachineValidationResult(machineId, false, "Machine validation failed", errors);
    }
}
