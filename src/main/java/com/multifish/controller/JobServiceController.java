package com.multifish.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.multifish.scheduler.Job;
import com.multifish.scheduler.JobCreateRequest;
import com.multifish.scheduler.JobCreationResult;
import com.multifish.scheduler.JobNotFoundException;
import com.multifish.scheduler.JobScheduler;
import com.multifish.scheduler.ValidationResult;
import com.multifish.scheduler.WorkerPoolStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Redfish-style REST surface of the job service.
 */
@RestController
@RequestMapping("/MultiFish/v1/JobService")
public class JobServiceController {

    private static final Logger log = LoggerFactory.getLogger(JobServiceController.class);

    static final String SERVICE_PATH = "/MultiFish/v1/JobService";
    static final String JOBS_PATH = SERVICE_PATH + "/Jobs";

    private final JobScheduler scheduler;

    public JobServiceController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    // --- Service root ---

    @GetMapping
    public JobServiceResource getJobService() {
        return serviceResource();
    }

    @PatchMapping
    public JobServiceResource patchJobService(@RequestBody JobServicePatch patch) {
        if (patch.serviceCapabilities() != null && patch.serviceCapabilities().workerPoolSize() != null) {
            try {
                scheduler.setWorkerPoolSize(patch.serviceCapabilities().workerPoolSize());
            } catch (IllegalArgumentException e) {
                throw new InvalidPropertyException("Invalid WorkerPoolSize: " + e.getMessage());
            }
        }
        return serviceResource();
    }

    // --- Jobs ---

    @GetMapping("/Jobs")
    public JobCollection listJobs() {
        List<OdataLink> members = scheduler.listJobs().stream()
                .map(job -> new OdataLink(JOBS_PATH + "/" + job.getId()))
                .toList();
        return new JobCollection("#JobCollection.JobCollection", JOBS_PATH, "Job Collection",
                members, members.size());
    }

    @PostMapping("/Jobs")
    public ResponseEntity<?> createJob(@RequestBody JobCreateRequest request) {
        JobCreationResult result = scheduler.createJob(request);
        if (!result.created()) {
            ValidationResult validation = result.validation();
            ErrorResponse body = new ErrorResponse(new ErrorDetail("JobValidationFailed",
                    "job validation failed",
                    List.of(new ExtendedInfo("Base.1.0.JobValidationFailed", validation.message(),
                            "Critical", validation))));
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResource.of(result.job()));
    }

    @GetMapping("/Jobs/{jobId}")
    public JobResource getJob(@PathVariable String jobId) {
        return JobResource.of(scheduler.getJob(jobId));
    }

    @DeleteMapping("/Jobs/{jobId}")
    public StatusMessage deleteJob(@PathVariable String jobId) {
        scheduler.deleteJob(jobId);
        return new StatusMessage("Job " + jobId + " deleted successfully", jobId);
    }

    @PostMapping("/Jobs/{jobId}/Actions/Cancel")
    public StatusMessage cancelJob(@PathVariable String jobId) {
        scheduler.cancelJob(jobId);
        return new StatusMessage("Job " + jobId + " cancelled successfully", jobId);
    }

    // --- Errors ---

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "ResourceNotFound", "Job not found: " + e.getJobId());
    }

    @ExceptionHandler(InvalidPropertyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidProperty(InvalidPropertyException e) {
        return error(HttpStatus.BAD_REQUEST, "PropertyValueError", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedJSON",
                "Invalid request body: " + e.getMostSpecificCause().getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String messageId, String message) {
        ErrorResponse body = new ErrorResponse(new ErrorDetail("Base.1.0." + messageId, message,
                List.of(new ExtendedInfo(messageId, message, "Critical", null))));
        return ResponseEntity.status(status).body(body);
    }

    private JobServiceResource serviceResource() {
        WorkerPoolStatus pool = scheduler.getWorkerPoolStatus();
        return new JobServiceResource("#JobService.v1_0_0.JobService", SERVICE_PATH, "JobService",
                "Job Service", new OdataLink(JOBS_PATH), pool);
    }

    static class InvalidPropertyException extends RuntimeException {
        InvalidPropertyException(String message) {
            super(message);
        }
    }

    record OdataLink(@JsonProperty("@odata.id") String id) {}

    record JobServiceResource(
            @JsonProperty("@odata.type") String type,
            @JsonProperty("@odata.id") String odataId,
            @JsonProperty("Id") String id,
            @JsonProperty("Name") String name,
            @JsonProperty("Jobs") OdataLink jobs,
            @JsonProperty("ServiceCapabilities") WorkerPoolStatus serviceCapabilities) {}

    record JobServicePatch(@JsonProperty("ServiceCapabilities") CapabilitiesPatch serviceCapabilities) {}

    record CapabilitiesPatch(@JsonProperty("WorkerPoolSize") Integer workerPoolSize) {}

    record JobCollection(
            @JsonProperty("@odata.type") String type,
            @JsonProperty("@odata.id") String odataId,
            @JsonProperty("Name") String name,
            @JsonProperty("Members") List<OdataLink> members,
            @JsonProperty("Members@odata.count") int count) {}

    static final class JobResource {

        private final Job job;

        private JobResource(Job job) {
            this.job = job;
        }

        static JobResource of(Job job) {
            return new JobResource(job);
        }

        @JsonProperty("@odata.type")
        public String getType() { return "#Job.v1_0_0.Job"; }

        @JsonProperty("@odata.id")
        public String getOdataId() { return JOBS_PATH + "/" + job.getId(); }

        @JsonUnwrapped
        public Job getJob() { return job; }
    }

    record StatusMessage(@JsonProperty("message") String message, @JsonProperty("JobId") String jobId) {}

    record ErrorResponse(@JsonProperty("error") ErrorDetail error) {}

    record ErrorDetail(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("@Message.ExtendedInfo") List<ExtendedInfo> extendedInfo) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ExtendedInfo(
            @JsonProperty("MessageId") String messageId,
            @JsonProperty("Message") String message,
            @JsonProperty("Severity") String severity,
            @JsonProperty("ValidationDetails") ValidationResult validationDetails) {}
}
