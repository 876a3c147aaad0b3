package com.simtask.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class Workload {
    private String name;
    private String sourceFile;
    private String description;
    private List<SimulationTask> tasks;
}
