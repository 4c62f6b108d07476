package com.taskwise.core.planner;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;
import com.taskwise.core.extract.ComplexityClassifier;
import com.taskwise.core.extract.TaskExtractor;
import com.taskwise.core.model.ProjectStructure;
import com.taskwise.core.model.TaskComplexity;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides domain, complexity, name and storage form for a task described in prose.
 * <p>
 * Planning has no side effects; the result is handed to the persister.
 */
@Service
public class TaskPlacementPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlacementPlanner.class);

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "to", "for", "of", "and", "or", "in", "on", "with", "from", "into",
            "that", "this", "it", "all", "run", "runs", "execute", "my", "our", "project", "using",
            "use", "via", "then", "also", "be", "is", "are", "should", "will", "task", "new");

    /** Executables whose presence as the first word marks a description as a command line. */
    private static final Set<String> SHELL_COMMANDS = Set.of(
            "npm", "npx", "yarn", "pnpm", "bun", "node", "deno", "tsc", "eslint", "prettier", "jest", "vitest",
            "cargo", "rustc", "go", "gofmt", "python", "python3", "pip", "pip3", "uv", "poetry", "pytest",
            "ruff", "black", "mypy", "flake8", "alembic", "make", "cmake", "mvn", "gradle", "java",
            "docker", "docker-compose", "kubectl", "helm", "terraform", "git", "rm", "mkdir", "cp", "mv",
            "echo", "bash", "sh", "curl", "mise");

    private static final Pattern SHELL_OPERATORS = Pattern.compile("\\s(?:&&|\\|\\||\\|)\\s");

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^a-z0-9:_-]+");

    private final ComplexityClassifier complexityClassifier;
    private final TaskExtractor taskExtractor;
    private final TaskwiseProperties properties;

    public TaskPlacementPlanner(ComplexityClassifier complexityClassifier, TaskExtractor taskExtractor,
                                TaskwiseProperties properties) {
        this.complexityClassifier = complexityClassifier;
        this.taskExtractor = taskExtractor;
        this.properties = properties;
    }

    /**
     * Plans a new task.
     *
     * @param request       description plus optional name, complexity and domain hint
     * @param structure     project layout, used to pick default commands
     * @param existingNames full names already taken
     * @throws TaskGraphException {@code INVALID_DOMAIN}, {@code INVALID_COMPLEXITY} or
     *                            {@code NAME_COLLISION}
     */
    public PlacementResult plan(PlacementRequest request, ProjectStructure structure, Collection<String> existingNames) {
        String description = request.description() == null ? "" : request.description().strip();
        var warnings = new ArrayList<String>();

        String suggested = normalizeName(request.suggestedName());
        TaskDomain domain = resolveDomain(request.domainHint(), suggested, description);

        boolean isCommand = looksLikeCommand(description);
        TaskComplexity complexity = resolveComplexity(request.forcedComplexity(), description, isCommand);

        String fullName = suggested != null
                ? qualify(suggested, domain, warnings)
                : domain.value() + ":" + deriveLeafName(description, domain);
        fullName = resolveCollision(fullName, existingNames, warnings);

        List<String> run = runCommand(description, isCommand, domain, structure, fullName, warnings);

        Path scriptPath = null;
        if (complexity == TaskComplexity.COMPLEX) {
            scriptPath = scriptPath(structure.rootPath(), fullName);
        }

        TaskDefinition task = TaskDefinition.builder(fullName, domain)
                .description(description.isEmpty() ? "Task " + fullName : description)
                .run(run)
                .sources(DefaultCommands.sources(domain))
                .outputs(DefaultCommands.outputs(domain))
                .complexity(complexity)
                .filePath(scriptPath)
                .build();

        log.info("Planned task {} ({} / {}) stored {}", fullName, domain.value(),
                complexity.value(), task.storage().kind());
        return new PlacementResult(fullName, task.storage(), task, warnings);
    }

    // ── Domain & complexity ──────────────────────────────────────────

    private TaskDomain resolveDomain(String hint, String suggestedName, String description) {
        if (hint != null && !hint.isBlank()) {
            return TaskDomain.fromValue(hint.strip().toLowerCase(Locale.ROOT))
                    .orElseThrow(() -> new TaskGraphException(ErrorKind.INVALID_DOMAIN,
                            "Invalid domain '" + hint + "'. Must be one of: " + String.join(", ", TaskDomain.allValues())));
        }
        if (suggestedName != null && suggestedName.contains(":")) {
            var prefixed = TaskDomain.fromValue(suggestedName.substring(0, suggestedName.indexOf(':')));
            if (prefixed.isPresent()) {
                return prefixed.get();
            }
        }
        return DomainKeywordClassifier.classify(description)
                .orElseGet(() -> TaskDomain.fromValue(properties.getDefaultDomain()).orElse(TaskDomain.BUILD));
    }

    private TaskComplexity resolveComplexity(String forced, String description, boolean isCommand) {
        if (forced != null && !forced.isBlank()) {
            return TaskComplexity.fromValue(forced.strip().toLowerCase(Locale.ROOT))
                    .orElseThrow(() -> new TaskGraphException(ErrorKind.INVALID_COMPLEXITY,
                            "Invalid complexity '" + forced + "'. Must be one of: "
                                    + String.join(", ", TaskComplexity.allValues())));
        }
        return isCommand
                ? complexityClassifier.classify(List.of(description))
                : complexityClassifier.classifyDescription(description);
    }

    // ── Naming ───────────────────────────────────────────────────────

    private static String normalizeName(String suggested) {
        if (suggested == null || suggested.isBlank()) {
            return null;
        }
        String name = suggested.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        name = INVALID_NAME_CHARS.matcher(name).replaceAll("");
        name = name.replaceAll("^[:]+|[:]+$", "");
        return name.isEmpty() ? null : name;
    }

    /**
     * Prefixes a suggested name with the task's domain. A recognized domain prefix that
     * disagrees with the domain is replaced; any other prefix is kept below the domain.
     */
    private static String qualify(String suggested, TaskDomain domain, List<String> warnings) {
        String prefix = domain.value() + ":";
        if (suggested.startsWith(prefix)) {
            return suggested;
        }
        if (!suggested.contains(":")) {
            return prefix + suggested;
        }
        String head = suggested.substring(0, suggested.indexOf(':'));
        String qualified = TaskDomain.fromValue(head).isPresent()
                ? prefix + suggested.substring(head.length() + 1)
                : prefix + suggested;
        warnings.add("Suggested name '" + suggested + "' does not match domain '" + domain.value()
                + "'; created as '" + qualified + "'");
        return qualified;
    }

    /** First significant words of the description, joined with {@code -}. */
    String deriveLeafName(String description, TaskDomain domain) {
        List<String> words = Arrays.stream(description.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> !w.isEmpty())
                .filter(w -> !STOP_WORDS.contains(w))
                .filter(w -> !w.equals(domain.value()))
                .distinct()
                .limit(Math.max(1, properties.getPlacement().getMaxNameWords()))
                .toList();
        return words.isEmpty() ? domain.value() : String.join("-", words);
    }

    private String resolveCollision(String fullName, Collection<String> existingNames, List<String> warnings) {
        if (!existingNames.contains(fullName)) {
            return fullName;
        }
        if (!properties.getPlacement().isAutoDisambiguate()) {
            throw new TaskGraphException(ErrorKind.NAME_COLLISION,
                    "Task '" + fullName + "' already exists", List.of(fullName));
        }
        int suffix = 2;
        while (existingNames.contains(fullName + "-" + suffix)) {
            suffix++;
        }
        String renamed = fullName + "-" + suffix;
        warnings.add("Task '" + fullName + "' already exists; created as '" + renamed + "'");
        return renamed;
    }

    // ── Command & storage ────────────────────────────────────────────

    static boolean looksLikeCommand(String description) {
        if (description.isEmpty()) {
            return false;
        }
        String first = description.split("\\s+", 2)[0];
        return SHELL_COMMANDS.contains(first)
                || first.startsWith("./")
                || SHELL_OPERATORS.matcher(description).find();
    }

    private List<String> runCommand(String description, boolean isCommand, TaskDomain domain,
                                    ProjectStructure structure, String fullName, List<String> warnings) {
        if (isCommand) {
            return List.of(description);
        }
        var byConvention = DefaultCommands.forDomain(domain, structure.packageManagers());
        if (byConvention.isPresent()) {
            return List.of(byConvention.get());
        }
        warnings.add("No command could be derived for '" + fullName + "'; edit the placeholder run command");
        return List.of("echo 'Task " + fullName + " is not implemented yet' && exit 1");
    }

    /** {@code deploy:production} becomes {@code <taskdir>/deploy/production}. */
    private Path scriptPath(Path projectRoot, String fullName) {
        Path path = taskExtractor.primaryTaskDir(projectRoot);
        for (String segment : fullName.split(":")) {
            path = path.resolve(segment);
        }
        return path;
    }
}
