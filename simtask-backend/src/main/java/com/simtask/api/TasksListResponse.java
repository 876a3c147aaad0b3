package com.simtask.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response payload for {@code GET /v1/workloads/{name}/tasks}.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TasksListResponse {
    private String workload;
    private List<TaskView> tasks;
}
