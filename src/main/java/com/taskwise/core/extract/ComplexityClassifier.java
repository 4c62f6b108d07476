package com.taskwise.core.extract;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.model.TaskComplexity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives {@link TaskComplexity} from command counts. Thresholds come from
 * {@code taskwise.complexity.*}; the same thresholds apply to extracted commands,
 * script bodies and free-text descriptions of new tasks.
 */
@Component
public class ComplexityClassifier {

    private static final Pattern COMMAND_SEPARATOR = Pattern.compile("\\s*(?:&&|\\|\\|)\\s*");

    private static final Pattern STEP_SEPARATOR = Pattern.compile(
            "(?i)\\s*(?:&&|;|\\n|,\\s*then\\b|\\bthen\\b|,|\\band\\b)\\s*");

    /** Phrases that describe a multi-tool workflow regardless of step count. */
    private static final List<String> COMPLEX_PHRASES = List.of(
            "pipeline", "workflow", "orchestrate", "multi-stage", "multi-environment",
            "multiple environments", "matrix");

    private final TaskwiseProperties properties;

    public ComplexityClassifier(TaskwiseProperties properties) {
        this.properties = properties;
    }

    /**
     * Counts the individual commands across all run entries. Blank lines and
     * comment lines do not count; {@code &&} / {@code ||} chains count per segment.
     */
    public int countCommands(List<String> run) {
        int count = 0;
        for (String entry : run) {
            for (String line : entry.split("\\R")) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                for (String segment : COMMAND_SEPARATOR.split(trimmed)) {
                    if (!segment.isBlank()) count++;
                }
            }
        }
        return count;
    }

    public TaskComplexity classify(List<String> run) {
        int commands = countCommands(run);
        int longest = run.stream().mapToInt(String::length).max().orElse(0);
        return byCount(commands, longest);
    }

    /** Script bodies are at least moderate. */
    public TaskComplexity classifyScript(List<String> bodyLines) {
        TaskComplexity complexity = classify(bodyLines);
        return complexity == TaskComplexity.SIMPLE ? TaskComplexity.MODERATE : complexity;
    }

    /**
     * Estimates complexity for a task that exists only as a description, counting
     * the steps it names.
     */
    public TaskComplexity classifyDescription(String description) {
        if (description == null || description.isBlank()) {
            return TaskComplexity.SIMPLE;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        for (String phrase : COMPLEX_PHRASES) {
            if (lower.contains(phrase)) {
                return TaskComplexity.COMPLEX;
            }
        }
        int steps = 0;
        for (String step : STEP_SEPARATOR.split(description.trim())) {
            if (!step.isBlank()) steps++;
        }
        return byCount(steps, description.length());
    }

    private TaskComplexity byCount(int commands, int longestCommand) {
        if (commands <= properties.getSimpleMaxCommands()) {
            return longestCommand > properties.getLongCommandLength()
                    ? TaskComplexity.MODERATE
                    : TaskComplexity.SIMPLE;
        }
        if (commands <= properties.getModerateMaxCommands()) {
            return TaskComplexity.MODERATE;
        }
        return TaskComplexity.COMPLEX;
    }
}
