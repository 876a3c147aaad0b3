package com.simtask.model;

import lombok.Data;

@Data
public class TaskDefinition {
    private Object id;
    private String query;
}
