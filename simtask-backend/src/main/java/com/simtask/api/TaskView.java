package com.simtask.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TaskView {
    private Object id;
    private String query;
}
