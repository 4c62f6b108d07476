package com.taskwise.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;
import com.taskwise.core.model.ExtractionNote;
import com.taskwise.core.model.ExtractionResult;
import com.taskwise.core.model.GeneratedDescriptions;
import com.taskwise.core.model.MiseConfig;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import com.taskwise.core.persistence.MiseConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the inline task table and the script task directories of a project and
 * turns every entry into a {@link TaskDefinition}.
 * <p>
 * Broken entries never abort the run: they are skipped and reported as
 * {@link ExtractionNote}s. Only when every entry is broken does extraction fail.
 */
@Service
public class TaskExtractor {

    private static final Logger log = LoggerFactory.getLogger(TaskExtractor.class);

    /** Header prefixes that carry task metadata inside a script. */
    private static final List<String> HEADER_PREFIXES = List.of("#MISE ", "# mise ", "//MISE ");

    private static final List<String> SCRIPT_EXTENSIONS = List.of(".sh", ".bash", ".zsh", ".py", ".js", ".ts", ".rb");

    private static final Set<String> IGNORED_FILES = Set.of("README.md", ".DS_Store", "Thumbs.db");

    private final MiseConfigStore configStore;
    private final ComplexityClassifier complexityClassifier;
    private final TaskwiseProperties properties;
    private final TomlMapper tomlMapper = new TomlMapper();

    public TaskExtractor(MiseConfigStore configStore, ComplexityClassifier complexityClassifier,
                         TaskwiseProperties properties) {
        this.configStore = configStore;
        this.complexityClassifier = complexityClassifier;
        this.properties = properties;
    }

    /**
     * Extracts every task declared in the project.
     *
     * @param projectRoot an existing project directory
     * @return tasks in declaration order plus notes for skipped entries
     * @throws IOException if the document or a task directory cannot be read
     * @throws TaskGraphException ({@link ErrorKind#MALFORMED_TASK}) when entries exist but none is usable
     */
    public ExtractionResult extract(Path projectRoot) throws IOException {
        MiseConfig config = configStore.load(projectRoot);
        return extract(projectRoot, config);
    }

    ExtractionResult extract(Path projectRoot, MiseConfig config) throws IOException {
        var tasks = new LinkedHashMap<String, TaskDefinition>();
        var notes = new ArrayList<ExtractionNote>();
        String document = configStore.resolveConfigFile(projectRoot).toString();
        int entries = 0;

        for (var entry : config.getTasks().entrySet()) {
            entries++;
            TaskDefinition task = fromTable(entry.getKey(), entry.getValue(), projectRoot, document, notes);
            if (task == null) continue;
            if (tasks.containsKey(task.fullName())) {
                notes.add(new ExtractionNote(entry.getKey(), document,
                        "duplicate full name " + task.fullName() + "; first declaration kept"));
                continue;
            }
            tasks.put(task.fullName(), task);
        }

        for (Path taskDir : existingTaskDirs(projectRoot)) {
            for (Path script : listScripts(taskDir)) {
                entries++;
                TaskDefinition task = fromScript(taskDir, script, notes);
                if (task == null) continue;
                if (tasks.containsKey(task.fullName())) {
                    notes.add(new ExtractionNote(task.fullName(), script.toString(),
                            "shadowed by an earlier task with the same name"));
                    continue;
                }
                tasks.put(task.fullName(), task);
            }
        }

        if (entries > 0 && tasks.isEmpty()) {
            throw new TaskGraphException(ErrorKind.MALFORMED_TASK,
                    "All " + entries + " task entries are malformed: "
                            + notes.stream().map(n -> n.task() + " (" + n.reason() + ")").collect(Collectors.joining("; ")),
                    notes.stream().map(ExtractionNote::task).toList());
        }

        for (var note : notes) {
            log.warn("Skipped task entry '{}' from {}: {}", note.task(), note.source(), note.reason());
        }
        log.debug("Extracted {} tasks ({} skipped) from {}", tasks.size(), notes.size(), projectRoot);
        return new ExtractionResult(new ArrayList<>(tasks.values()), notes);
    }

    /**
     * Resolves the domain for a declared name: the leading colon segment when it is a
     * recognized domain, the bare name itself when it names a domain, otherwise the
     * configured default.
     */
    public TaskDomain resolveDomain(String name) {
        String head = name.contains(":") ? name.substring(0, name.indexOf(':')) : name;
        return TaskDomain.fromValue(head).orElseGet(this::defaultDomain);
    }

    /** Task directories under the project root that exist on disk, in configured order. */
    public List<Path> existingTaskDirs(Path projectRoot) {
        return properties.getTaskDirs().stream()
                .map(projectRoot::resolve)
                .filter(Files::isDirectory)
                .toList();
    }

    /** Directory new script tasks are written to: the first existing task dir, or the first configured one. */
    public Path primaryTaskDir(Path projectRoot) {
        var existing = existingTaskDirs(projectRoot);
        return existing.isEmpty() ? projectRoot.resolve(properties.getTaskDirs().get(0)) : existing.get(0);
    }

    private TaskDomain defaultDomain() {
        return TaskDomain.fromValue(properties.getDefaultDomain()).orElse(TaskDomain.BUILD);
    }

    // ── Inline entries ───────────────────────────────────────────────

    private TaskDefinition fromTable(String name, Map<String, Object> table, Path projectRoot,
                                     String document, List<ExtractionNote> notes) {
        if (name.isBlank()) {
            notes.add(new ExtractionNote(name, document, "empty task name"));
            return null;
        }

        Path filePath = null;
        List<String> run = stringList(table.get("run"));
        Object file = table.get("file");
        if (run.isEmpty() && file instanceof String f && !f.isBlank()) {
            filePath = projectRoot.resolve(f);
            if (!Files.isRegularFile(filePath)) {
                notes.add(new ExtractionNote(name, document, "script file " + f + " does not exist"));
                return null;
            }
            List<String> lines = readScript(name, filePath, notes);
            if (lines == null) {
                return null;
            }
            run = bodyLines(lines);
        }
        if (run.isEmpty()) {
            notes.add(new ExtractionNote(name, document, "missing 'run'"));
            return null;
        }

        TaskDomain domain = resolveDomain(name);
        var complexity = filePath != null
                ? complexityClassifier.classifyScript(run)
                : complexityClassifier.classify(run);

        return TaskDefinition.builder(name, domain)
                .description(describe(table.get("description"), run))
                .run(run)
                .depends(stringList(table.get("depends")))
                .dependsPost(stringList(table.get("depends_post")))
                .waitFor(stringList(table.get("wait_for")))
                .sources(stringList(table.get("sources")))
                .outputs(stringList(table.get("outputs")))
                .env(stringMap(table.get("env")))
                .dir(string(table.get("dir")))
                .alias(firstString(table.get("alias")))
                .hide(Boolean.TRUE.equals(table.get("hide")))
                .confirm(string(table.get("confirm")))
                .complexity(complexity)
                .filePath(filePath)
                .build();
    }

    // ── Script tasks ─────────────────────────────────────────────────

    private List<Path> listScripts(Path taskDir) throws IOException {
        try (var stream = Files.walk(taskDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !IGNORED_FILES.contains(p.getFileName().toString()))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        }
    }

    private TaskDefinition fromScript(Path taskDir, Path script, List<ExtractionNote> notes) {
        String name = scriptTaskName(taskDir, script);
        List<String> lines = readScript(name, script, notes);
        if (lines == null) {
            return null;
        }
        List<String> body = bodyLines(lines);
        if (body.isEmpty()) {
            notes.add(new ExtractionNote(name, script.toString(), "script has no commands"));
            return null;
        }

        Map<String, Object> header = readHeader(name, script, lines, notes);
        TaskDomain domain = resolveDomain(name);

        return TaskDefinition.builder(name, domain)
                .description(header.containsKey("description")
                        ? string(header.get("description"))
                        : GeneratedDescriptions.forScript(taskDir.relativize(script).toString()))
                .run(body)
                .depends(stringList(header.get("depends")))
                .dependsPost(stringList(header.get("depends_post")))
                .waitFor(stringList(header.get("wait_for")))
                .sources(stringList(header.get("sources")))
                .outputs(stringList(header.get("outputs")))
                .env(stringMap(header.get("env")))
                .dir(string(header.get("dir")))
                .alias(firstString(header.get("alias")))
                .hide(Boolean.TRUE.equals(header.get("hide")))
                .confirm(string(header.get("confirm")))
                .complexity(complexityClassifier.classifyScript(body))
                .filePath(script)
                .build();
    }

    /** Lines of a script file, or {@code null} with a note when it cannot be read as UTF-8 text. */
    private static List<String> readScript(String name, Path script, List<ExtractionNote> notes) {
        try {
            return Files.readAllLines(script);
        } catch (IOException e) {
            notes.add(new ExtractionNote(name, script.toString(), "unreadable script (" + e.getClass().getSimpleName() + "): " + e.getMessage()));
            return null;
        }
    }

    /** {@code build/frontend.sh} under the task dir becomes {@code build:frontend}. */
    static String scriptTaskName(Path taskDir, Path script) {
        var segments = new ArrayList<String>();
        for (Path segment : taskDir.relativize(script)) {
            segments.add(segment.toString());
        }
        int last = segments.size() - 1;
        segments.set(last, stripExtension(segments.get(last)));
        return String.join(":", segments);
    }

    private static String stripExtension(String fileName) {
        for (String ext : SCRIPT_EXTENSIONS) {
            if (fileName.endsWith(ext) && fileName.length() > ext.length()) {
                return fileName.substring(0, fileName.length() - ext.length());
            }
        }
        return fileName;
    }

    private Map<String, Object> readHeader(String name, Path script, List<String> lines, List<ExtractionNote> notes) {
        var header = new StringBuilder();
        for (String line : lines) {
            for (String prefix : HEADER_PREFIXES) {
                if (line.startsWith(prefix)) {
                    header.append(line.substring(prefix.length()).trim()).append('\n');
                }
            }
        }
        if (header.length() == 0) {
            return Map.of();
        }
        try {
            return tomlMapper.readValue(header.toString(), new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            notes.add(new ExtractionNote(name, script.toString(), "unreadable #MISE header ignored: " + e.getOriginalMessage()));
            return Map.of();
        }
    }

    /** Command lines of a script: everything except blank lines, the shebang and comments. */
    private static List<String> bodyLines(List<String> lines) {
        return lines.stream()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .filter(l -> !l.startsWith("#") && !l.startsWith("//"))
                .toList();
    }

    // ── Value coercion ───────────────────────────────────────────────

    private static String describe(Object declared, List<String> run) {
        String description = string(declared);
        if (description != null && !description.isBlank()) {
            return description;
        }
        return GeneratedDescriptions.forCommands(run);
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static String firstString(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty() ? null : String.valueOf(list.get(0));
        }
        return string(value);
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .filter(v -> v != null && !String.valueOf(v).isBlank())
                    .map(String::valueOf)
                    .toList();
        }
        String single = String.valueOf(value);
        return single.isBlank() ? List.of() : List.of(single);
    }

    private static Map<String, String> stringMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        var result = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> {
            if (v != null) result.put(String.valueOf(k), String.valueOf(v));
        });
        return result;
    }
}
