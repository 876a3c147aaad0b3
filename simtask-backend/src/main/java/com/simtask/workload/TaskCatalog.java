package com.simtask.workload;

import com.simtask.model.SimulationTask;
import com.simtask.model.TaskDefinition;
import com.simtask.model.Workload;
import com.simtask.model.WorkloadConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory catalog of simulation tasks declared in workload YAML files.
 *
 * Every {@code *.yaml}/{@code *.yml} file under {@code simulation.workloads.path} is one
 * workload, named after the file without its extension. Files are read in name order; when two
 * files share a workload name the first one wins.
 */
@Component
public class TaskCatalog {
    private static final Logger log = LoggerFactory.getLogger(TaskCatalog.class);

    private final String workloadsPath;

    private volatile Map<String, Workload> workloadsByName = new ConcurrentHashMap<>();

    public TaskCatalog(@Value("${simulation.workloads.path:workloads}") String workloadsPath) {
        this.workloadsPath = workloadsPath;
    }

    @PostConstruct
    public void loadWorkloads() {
        reloadWorkloads();
    }

    /**
     * Reloads all workload files from the configured directory.
     *
     * The new map is built completely before it replaces the current one, so readers never see a
     * partially loaded catalog.
     *
     * @return number of workloads loaded
     */
    public int reloadWorkloads() {
        Map<String, Workload> newWorkloadsByName = new ConcurrentHashMap<>();
        Path workloadsDir = Paths.get(workloadsPath);
        if (!Files.isDirectory(workloadsDir)) {
            log.warn("Workloads directory not found: {}", workloadsPath);
            workloadsByName = newWorkloadsByName;
            return 0;
        }

        try (Stream<Path> files = Files.list(workloadsDir)) {
            files.filter(Files::isRegularFile)
                    .filter(TaskCatalog::isYamlFile)
                    .sorted(Comparator.comparing((Path path) -> path.getFileName().toString()))
                    .forEach(yamlFile -> {
                        try {
                            Workload workload = loadWorkload(yamlFile);
                            Workload existing = newWorkloadsByName.putIfAbsent(workload.getName(), workload);
                            if (existing != null) {
                                log.error("Duplicate workload name '{}': keeping {}, ignoring {}",
                                        workload.getName(), existing.getSourceFile(), workload.getSourceFile());
                                return;
                            }
                            log.debug("Loaded workload: {} ({} tasks)", workload.getName(), workload.getTasks().size());
                        } catch (Exception e) {
                            log.error("Failed to load workload: {}", yamlFile, e);
                        }
                    });
        } catch (Exception e) {
            log.error("Failed to list workloads in: {}", workloadsPath, e);
        }

        workloadsByName = newWorkloadsByName;
        log.info("Reloaded {} workloads from {}", newWorkloadsByName.size(), workloadsPath);
        return newWorkloadsByName.size();
    }

    public List<Workload> listWorkloads() {
        return workloadsByName.values().stream()
                .sorted(Comparator.comparing(Workload::getName))
                .collect(Collectors.toList());
    }

    public Workload getWorkload(String name) {
        Workload workload = name == null ? null : workloadsByName.get(name);
        if (workload == null) {
            throw new WorkloadNotFoundException("Workload not found: " + name);
        }
        return workload;
    }

    /**
     * Find the tasks of a workload whose identifier matches {@code id}.
     *
     * Identifiers are compared by their string form, so {@code "1"} matches a YAML id of {@code 1}.
     * Identifiers are not required to be unique and every match is returned.
     *
     * @param name workload name
     * @param id identifier to match, or null for all tasks
     * @return matching tasks in file order
     */
    public List<SimulationTask> findTasks(String name, String id) {
        List<SimulationTask> tasks = getWorkload(name).getTasks();
        if (id == null) {
            return tasks;
        }
        return tasks.stream()
                .filter(task -> Objects.equals(String.valueOf(task.getId()), id))
                .collect(Collectors.toList());
    }

    private Workload loadWorkload(Path yamlFile) throws Exception {
        WorkloadConfig config;
        try (InputStream in = Files.newInputStream(yamlFile)) {
            config = new Yaml().loadAs(in, WorkloadConfig.class);
        }

        List<SimulationTask> tasks = new ArrayList<>();
        if (config != null && config.getTasks() != null) {
            for (TaskDefinition definition : config.getTasks()) {
                if (definition == null) {
                    continue;
                }
                tasks.add(new SimulationTask(definition.getId(), definition.getQuery()));
            }
        }

        String fileName = yamlFile.getFileName().toString();
        return Workload.builder()
                .name(stripExtension(fileName))
                .sourceFile(fileName)
                .description(config == null ? null : config.getDescription())
                .tasks(List.copyOf(tasks))
                .build();
    }

    private static boolean isYamlFile(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
