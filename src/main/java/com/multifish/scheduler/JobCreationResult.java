package com.multifish.scheduler;

/**
 * Either the created job or the validation detail explaining why it was refused.
 */
public record JobCreationResult(Job job, ValidationResult validation) {

    public boolean created() {
        return job != null;
    }
}
