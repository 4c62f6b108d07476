package com.taskwise.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.taskwise.core.extract.TaskExtractor;
import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.MiseConfig;
import com.taskwise.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes task mutations back to the project: inline entries into the document,
 * complex tasks as script files under the task directory.
 * <p>
 * Each call loads the document fresh and writes it back at most once.
 */
@Service
public class ConfigPersister {

    private static final Logger log = LoggerFactory.getLogger(ConfigPersister.class);

    private static final String HEADER_PREFIX = "#MISE ";

    private final MiseConfigStore configStore;
    private final TaskExtractor taskExtractor;
    private final TomlMapper tomlMapper = new TomlMapper();

    public ConfigPersister(MiseConfigStore configStore, TaskExtractor taskExtractor) {
        this.configStore = configStore;
        this.taskExtractor = taskExtractor;
    }

    /**
     * Creates or replaces a task. Script tasks are written as executable files with
     * their metadata in {@code #MISE} header lines; any inline entry under the same
     * name is dropped so the script is the only declaration.
     *
     * @return the file written: the script, or the document
     */
    public Path save(Path projectRoot, TaskDefinition task) throws IOException {
        MiseConfig config = configStore.load(projectRoot);
        if (task.isFileTask()) {
            writeScript(task);
            if (config.getTasks().remove(task.name()) != null) {
                configStore.save(projectRoot, config);
            }
            log.info("Saved script task {} to {}", task.fullName(), task.filePath());
            return task.filePath();
        }

        config.getTasks().put(task.name(), toTable(task));
        configStore.save(projectRoot, config);
        log.info("Saved inline task {}", task.fullName());
        return configStore.resolveConfigFile(projectRoot);
    }

    /**
     * Removes one task. Dependents are reported, never repaired.
     */
    public RemovalResult remove(Path projectRoot, TaskDefinition task, TaskGraph graph) throws IOException {
        return removeAll(projectRoot, List.of(task), graph).get(0);
    }

    /**
     * Removes several tasks with a single document rewrite. Dependents that are
     * themselves being removed are not reported.
     */
    public List<RemovalResult> removeAll(Path projectRoot, List<TaskDefinition> tasks, TaskGraph graph) throws IOException {
        MiseConfig config = configStore.load(projectRoot);
        var removing = tasks.stream().map(TaskDefinition::fullName).toList();
        var results = new ArrayList<RemovalResult>();
        boolean documentChanged = false;

        for (TaskDefinition task : tasks) {
            var warnings = new ArrayList<String>();
            boolean inline = config.getTasks().remove(task.name()) != null;
            documentChanged |= inline;

            Path deleted = null;
            if (task.isFileTask()) {
                if (isUnderTaskDir(projectRoot, task.filePath())) {
                    if (Files.deleteIfExists(task.filePath())) {
                        deleted = task.filePath();
                    }
                } else {
                    warnings.add("Script " + task.filePath() + " is referenced by an inline entry and was left in place");
                }
            }

            var affected = graph.referrers(task.fullName()).stream()
                    .filter(name -> !removing.contains(name))
                    .toList();
            for (String dependent : affected) {
                warnings.add("Task '" + dependent + "' still references '" + task.fullName()
                        + "'; update its dependency lists");
            }
            results.add(new RemovalResult(task.fullName(), affected, inline, deleted, warnings));
            log.info("Removed task {} (inline: {}, file: {}, {} dependents affected)",
                    task.fullName(), inline, deleted, affected.size());
        }

        if (documentChanged) {
            configStore.save(projectRoot, config);
        }
        return results;
    }

    // ── Inline entries ───────────────────────────────────────────────

    /** Document table for a task; empty fields are left out. */
    static Map<String, Object> toTable(TaskDefinition task) {
        var table = new LinkedHashMap<String, Object>();
        if (!task.description().isBlank()) table.put("description", task.description());
        table.put("run", task.run().size() == 1 ? task.run().get(0) : task.run());
        putMetadata(table, task);
        return table;
    }

    private static void putMetadata(Map<String, Object> table, TaskDefinition task) {
        if (!task.depends().isEmpty()) table.put("depends", task.depends());
        if (!task.dependsPost().isEmpty()) table.put("depends_post", task.dependsPost());
        if (!task.waitFor().isEmpty()) table.put("wait_for", task.waitFor());
        if (!task.sources().isEmpty()) table.put("sources", task.sources());
        if (!task.outputs().isEmpty()) table.put("outputs", task.outputs());
        if (!task.env().isEmpty()) table.put("env", new LinkedHashMap<>(task.env()));
        if (task.dir() != null) table.put("dir", task.dir());
        if (task.alias() != null) table.put("alias", task.alias());
        if (task.hide()) table.put("hide", true);
        if (task.confirm() != null) table.put("confirm", task.confirm());
    }

    // ── Script tasks ─────────────────────────────────────────────────

    private void writeScript(TaskDefinition task) throws IOException {
        Path script = task.filePath();
        AtomicWrites.writeString(script, scriptContent(task));
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            log.debug("Cannot mark {} executable on this filesystem", script);
        }
    }

    String scriptContent(TaskDefinition task) throws JsonProcessingException {
        var header = new LinkedHashMap<String, Object>();
        if (!task.description().isBlank()) {
            header.put("description", task.description().replaceAll("\\R", " "));
        }
        putMetadata(header, task);

        var content = new StringBuilder("#!/usr/bin/env bash\n");
        if (!header.isEmpty()) {
            for (String line : tomlMapper.writeValueAsString(header).split("\\R")) {
                if (!line.isBlank()) {
                    content.append(HEADER_PREFIX).append(line).append('\n');
                }
            }
        }
        content.append('\n');
        for (String command : task.run()) {
            content.append(command).append('\n');
        }
        return content.toString();
    }

    private boolean isUnderTaskDir(Path projectRoot, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        return taskExtractor.existingTaskDirs(projectRoot).stream()
                .map(dir -> dir.toAbsolutePath().normalize())
                .anyMatch(absolute::startsWith);
    }
}
