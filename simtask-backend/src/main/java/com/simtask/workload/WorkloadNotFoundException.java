package com.simtask.workload;

/**
 * Thrown when no workload file was loaded under the requested name.
 */
public class WorkloadNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public WorkloadNotFoundException(String message) {
        super(message);
    }
}
