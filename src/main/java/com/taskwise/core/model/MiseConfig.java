package com.taskwise.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory form of a project's {@code .mise.toml}. Only the recognized top-level
 * sections are kept; anything else in the file is dropped on save.
 * <p>
 * Task entries are raw tables keyed by full task name, in declaration order.
 */
public final class MiseConfig {

    private final Map<String, Object> tools;
    private final Map<String, Object> env;
    private final Map<String, Map<String, Object>> tasks;
    private final Map<String, Object> vars;
    private final Map<String, Object> taskConfig;

    public MiseConfig() {
        this(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public MiseConfig(Map<String, Object> tools,
                      Map<String, Object> env,
                      Map<String, Map<String, Object>> tasks,
                      Map<String, Object> vars,
                      Map<String, Object> taskConfig) {
        this.tools = new LinkedHashMap<>(tools);
        this.env = new LinkedHashMap<>(env);
        this.tasks = new LinkedHashMap<>();
        tasks.forEach((name, table) -> this.tasks.put(name, new LinkedHashMap<>(table)));
        this.vars = new LinkedHashMap<>(vars);
        this.taskConfig = new LinkedHashMap<>(taskConfig);
    }

    public Map<String, Object> getTools() { return tools; }
    public Map<String, Object> getEnv() { return env; }
    public Map<String, Map<String, Object>> getTasks() { return tasks; }
    public Map<String, Object> getVars() { return vars; }
    public Map<String, Object> getTaskConfig() { return taskConfig; }

    public boolean isEmpty() {
        return tools.isEmpty() && env.isEmpty() && tasks.isEmpty()
                && vars.isEmpty() && taskConfig.isEmpty();
    }
}
