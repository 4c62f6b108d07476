package com.taskwise.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.model.MiseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Load/save primitive for the project's {@code .mise.toml}.
 * <p>
 * Every load reads the file fresh. Every save rewrites the whole document (only the
 * recognized sections) through {@link AtomicWrites}, so readers never observe a
 * half-written file. There is no locking: concurrent writers race, last write wins.
 */
@Component
public class MiseConfigStore {

    private static final Logger log = LoggerFactory.getLogger(MiseConfigStore.class);

    static final String TOOLS = "tools";
    static final String ENV = "env";
    static final String TASKS = "tasks";
    static final String VARS = "vars";
    static final String TASK_CONFIG = "task_config";

    private final TomlMapper tomlMapper = new TomlMapper();
    private final TaskwiseProperties properties;

    public MiseConfigStore(TaskwiseProperties properties) {
        this.properties = properties;
    }

    /**
     * Returns the document path for a project: the first configured file name that
     * exists, or the first configured name when none exists yet.
     */
    public Path resolveConfigFile(Path projectRoot) {
        List<String> names = properties.getConfigFileNames();
        for (String name : names) {
            Path candidate = projectRoot.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return projectRoot.resolve(names.get(0));
    }

    /**
     * Loads the document, returning an empty config when the file does not exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public MiseConfig load(Path projectRoot) throws IOException {
        Path file = resolveConfigFile(projectRoot);
        if (!Files.isRegularFile(file)) {
            log.debug("No task document at {}", file);
            return new MiseConfig();
        }

        Map<String, Object> data = tomlMapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
        log.debug("Loaded {} ({} top-level sections)", file, data.size());

        return new MiseConfig(
                table(data.get(TOOLS)),
                table(data.get(ENV)),
                tasks(data.get(TASKS)),
                table(data.get(VARS)),
                table(data.get(TASK_CONFIG))
        );
    }

    /**
     * Rewrites the whole document from the given config.
     */
    public void save(Path projectRoot, MiseConfig config) throws IOException {
        Path file = resolveConfigFile(projectRoot);

        var data = new LinkedHashMap<String, Object>();
        putIfNotEmpty(data, TOOLS, config.getTools());
        putIfNotEmpty(data, ENV, config.getEnv());
        putIfNotEmpty(data, TASKS, config.getTasks());
        putIfNotEmpty(data, VARS, config.getVars());
        putIfNotEmpty(data, TASK_CONFIG, config.getTaskConfig());

        AtomicWrites.writeString(file, tomlMapper.writeValueAsString(data));
        log.info("Wrote {} ({} tasks)", file, config.getTasks().size());
    }

    private static void putIfNotEmpty(Map<String, Object> data, String key, Map<String, ?> section) {
        if (!section.isEmpty()) {
            data.put(key, section);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> table(Object value) {
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return new LinkedHashMap<>();
    }

    /**
     * Normalizes the task table. The shorthand forms {@code name = "cmd"} and
     * {@code name = ["cmd1", "cmd2"]} become {@code {run = ...}}; any other
     * non-table value is kept as an empty table so the extractor reports it.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> tasks(Object value) {
        var tasks = new LinkedHashMap<String, Map<String, Object>>();
        if (!(value instanceof Map<?, ?> map)) {
            return tasks;
        }
        map.forEach((key, entry) -> {
            String name = String.valueOf(key);
            if (entry instanceof Map<?, ?> table) {
                tasks.put(name, new LinkedHashMap<>((Map<String, Object>) table));
            } else if (entry instanceof String || entry instanceof List<?>) {
                var table = new LinkedHashMap<String, Object>();
                table.put("run", entry);
                tasks.put(name, table);
            } else {
                tasks.put(name, new LinkedHashMap<>());
            }
        });
        return tasks;
    }
}
