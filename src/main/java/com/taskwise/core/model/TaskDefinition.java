package com.taskwise.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single declared task, either inline in the document or backed by a script file.
 *
 * @param name        task name as declared; may already be domain-prefixed ({@code build:dev})
 * @param domain      functional category
 * @param description human-readable summary
 * @param run         ordered commands; a single command is a one-element list
 * @param depends     hard dependencies (full names) that must succeed first
 * @param dependsPost tasks that run after this one; their failure does not block it
 * @param waitFor     soft ordering hints, never blocking
 * @param sources     input globs for incremental tracking
 * @param outputs     output globs for incremental tracking
 * @param env         task environment
 * @param dir         working directory, or {@code null}
 * @param alias       alias, or {@code null}
 * @param hide        whether the task is hidden from listings
 * @param confirm     confirmation prompt text, or {@code null}
 * @param complexity  derived complexity; never {@link TaskComplexity#SIMPLE} for file tasks
 * @param filePath    script file for file tasks, otherwise {@code null}
 */
public record TaskDefinition(
    String name,
    TaskDomain domain,
    String description,
    List<String> run,
    List<String> depends,
    List<String> dependsPost,
    List<String> waitFor,
    List<String> sources,
    List<String> outputs,
    Map<String, String> env,
    String dir,
    String alias,
    boolean hide,
    String confirm,
    TaskComplexity complexity,
    Path filePath
) {

    public TaskDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(domain, "domain");
        description = description == null ? "" : description;
        run = run == null ? List.of() : List.copyOf(run);
        depends = depends == null ? List.of() : List.copyOf(depends);
        dependsPost = dependsPost == null ? List.of() : List.copyOf(dependsPost);
        waitFor = waitFor == null ? List.of() : List.copyOf(waitFor);
        sources = sources == null ? List.of() : List.copyOf(sources);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        if (complexity == null) {
            complexity = TaskComplexity.SIMPLE;
        }
        if (filePath != null && complexity == TaskComplexity.SIMPLE) {
            complexity = TaskComplexity.MODERATE;
        }
    }

    /** Domain-prefixed, colon-separated identifier. */
    public String fullName() {
        if (name.contains(":")) {
            return name;
        }
        return domain.value() + ":" + name;
    }

    /** Last colon-separated segment of the full name. */
    public String leafName() {
        String full = fullName();
        return full.substring(full.lastIndexOf(':') + 1);
    }

    /** Leading segment of the full name as written, which may not be a recognized domain. */
    public String declaredPrefix() {
        String full = fullName();
        return full.substring(0, full.indexOf(':'));
    }

    public boolean isFileTask() {
        return filePath != null;
    }

    public TaskStorage storage() {
        return isFileTask() ? new TaskStorage.Script(filePath) : new TaskStorage.Inline(run);
    }

    /** Commands joined the way a shell would see them, used for textual comparison. */
    public String effectiveCommand() {
        return String.join("\n", run).trim();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name).domain(domain).description(description).run(run)
                .depends(depends).dependsPost(dependsPost).waitFor(waitFor)
                .sources(sources).outputs(outputs).env(env).dir(dir).alias(alias)
                .hide(hide).confirm(confirm).complexity(complexity).filePath(filePath);
    }

    public static Builder builder(String name, TaskDomain domain) {
        return new Builder().name(name).domain(domain);
    }

    public static final class Builder {
        private String name;
        private TaskDomain domain;
        private String description = "";
        private List<String> run = new ArrayList<>();
        private List<String> depends = new ArrayList<>();
        private List<String> dependsPost = new ArrayList<>();
        private List<String> waitFor = new ArrayList<>();
        private List<String> sources = new ArrayList<>();
        private List<String> outputs = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String dir;
        private String alias;
        private boolean hide;
        private String confirm;
        private TaskComplexity complexity = TaskComplexity.SIMPLE;
        private Path filePath;

        private Builder() {}

        public Builder name(String name) { this.name = name; return this; }
        public Builder domain(TaskDomain domain) { this.domain = domain; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder run(List<String> run) { this.run = run; return this; }
        public Builder run(String command) { this.run = List.of(command); return this; }
        public Builder depends(List<String> depends) { this.depends = depends; return this; }
        public Builder dependsPost(List<String> dependsPost) { this.dependsPost = dependsPost; return this; }
        public Builder waitFor(List<String> waitFor) { this.waitFor = waitFor; return this; }
        public Builder sources(List<String> sources) { this.sources = sources; return this; }
        public Builder outputs(List<String> outputs) { this.outputs = outputs; return this; }
        public Builder env(Map<String, String> env) { this.env = env; return this; }
        public Builder dir(String dir) { this.dir = dir; return this; }
        public Builder alias(String alias) { this.alias = alias; return this; }
        public Builder hide(boolean hide) { this.hide = hide; return this; }
        public Builder confirm(String confirm) { this.confirm = confirm; return this; }
        public Builder complexity(TaskComplexity complexity) { this.complexity = complexity; return this; }
        public Builder filePath(Path filePath) { this.filePath = filePath; return this; }

        public TaskDefinition build() {
            return new TaskDefinition(name, domain, description, run, depends, dependsPost, waitFor,
                    sources, outputs, env, dir, alias, hide, confirm, complexity, filePath);
        }
    }
}
