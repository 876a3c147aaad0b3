package com.simtask.controller;

import com.simtask.api.TaskView;
import com.simtask.api.TasksListResponse;
import com.simtask.api.WorkloadCandidate;
import com.simtask.api.WorkloadsListResponse;
import com.simtask.api.WorkloadsReloadResponse;
import com.simtask.model.SimulationTask;
import com.simtask.model.Workload;
import com.simtask.web.TraceIdFilter;
import com.simtask.workload.TaskCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1/workloads")
public class WorkloadController {

    private static final Logger log = LoggerFactory.getLogger(WorkloadController.class);

    private final TaskCatalog taskCatalog;

    public WorkloadController(TaskCatalog taskCatalog) {
        this.taskCatalog = taskCatalog;
    }

    /**
     * List the loaded workloads.
     *
     * GET /v1/workloads
     */
    @GetMapping
    public ResponseEntity<WorkloadsListResponse> listWorkloads() {
        List<WorkloadCandidate> candidates = taskCatalog.listWorkloads().stream()
                .map(WorkloadController::toCandidate)
                .collect(Collectors.toList());
        return ResponseEntity.ok(WorkloadsListResponse.builder()
                .workloads(candidates)
                .build());
    }

    /**
     * List the tasks of one workload, optionally only those with a given identifier.
     *
     * GET /v1/workloads/{name}/tasks
     *
     * @param name workload name
     * @param id identifier filter (string form)
     * @return matching tasks in file order
     */
    @GetMapping("/{name}/tasks")
    public ResponseEntity<TasksListResponse> listTasks(
            @PathVariable("name") String name,
            @RequestParam(value = "id", required = false) String id
    ) {
        List<TaskView> tasks = taskCatalog.findTasks(name, id).stream()
                .map(WorkloadController::toView)
                .collect(Collectors.toList());
        return ResponseEntity.ok(TasksListResponse.builder()
                .workload(name)
                .tasks(tasks)
                .build());
    }

    /**
     * Re-read all workload files from disk.
     *
     * POST /v1/workloads/reload
     */
    @PostMapping("/reload")
    public ResponseEntity<WorkloadsReloadResponse> reload() {
        log.info("Workload reload requested: trace_id={}", MDC.get(TraceIdFilter.MDC_TRACE_ID));
        int loaded = taskCatalog.reloadWorkloads();

        WorkloadsReloadResponse response = new WorkloadsReloadResponse();
        response.setStatus("ok");
        response.setWorkloads(loaded);
        return ResponseEntity.ok(response);
    }

    private static WorkloadCandidate toCandidate(Workload workload) {
        return WorkloadCandidate.builder()
                .name(workload.getName())
                .sourceFile(workload.getSourceFile())
                .description(workload.getDescription())
                .taskCount(workload.getTasks().size())
                .build();
    }

    private static TaskView toView(SimulationTask task) {
        return TaskView.builder()
                .id(task.getId())
                .query(task.getQuery())
                .build();
    }
}
