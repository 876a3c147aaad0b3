package com.simtask.model;

import lombok.Data;

import java.util.List;

/**
 * One workload YAML file as parsed from disk.
 */
@Data
public class WorkloadConfig {
    private String description;
    private List<TaskDefinition> tasks;
}
