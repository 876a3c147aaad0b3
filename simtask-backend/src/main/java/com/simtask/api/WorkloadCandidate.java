package com.simtask.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * A workload discovered from the YAML directory.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkloadCandidate {
    private String name;
    private String sourceFile;
    private String description;
    private int taskCount;
}
