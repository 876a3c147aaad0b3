package com.simtask.api;

import lombok.Data;

/**
 * Response for {@code POST /v1/workloads/reload}.
 */
@Data
public class WorkloadsReloadResponse {
    private String status;
    private int workloads;
}
