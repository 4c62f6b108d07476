package com.taskwise.core.redundancy;

import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.TaskDefinition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Flags tasks that are connected to nothing, track no files and whose command is a
 * no-op ({@code true}, {@code :}, a bare {@code echo}) or a single short step such as
 * {@code cargo fmt}. Commands that redirect, pipe, chain or substitute are never
 * considered trivial.
 */
@Component
@Order(1)
public class IsolatedTaskPolicy implements PruningPolicy {

    private static final Pattern NO_OP = Pattern.compile("^(?:true|:|exit 0|echo(?:\\s.*)?|printf(?:\\s.*)?)$");

    private static final Pattern SIDE_EFFECT = Pattern.compile("[>|;&`]|\\$\\(");

    private static final int TRIVIAL_MAX_WORDS = 2;

    private static final String ISOLATED = "No dependencies and no dependents, tracks no sources or outputs";

    @Override
    public String name() {
        return "isolated";
    }

    @Override
    public List<PruningCandidate> evaluate(TaskGraph graph) {
        var candidates = new ArrayList<PruningCandidate>();
        for (TaskDefinition task : graph.tasks()) {
            String name = task.fullName();
            if (!graph.isIsolated(name)) continue;
            if (!task.sources().isEmpty() || !task.outputs().isEmpty()) continue;
            if (isNoOp(task)) {
                candidates.add(new PruningCandidate(name, name(), ISOLATED + ", and its command does nothing"));
            } else if (isTrivial(task)) {
                candidates.add(new PruningCandidate(name, name(), ISOLATED + ", and its command is a single short step"));
            }
        }
        return candidates;
    }

    static boolean isNoOp(TaskDefinition task) {
        for (String line : commandLines(task)) {
            if (SIDE_EFFECT.matcher(line).find() || !NO_OP.matcher(line).matches()) {
                return false;
            }
        }
        return true;
    }

    static boolean isTrivial(TaskDefinition task) {
        List<String> lines = commandLines(task);
        if (lines.size() != 1) {
            return false;
        }
        String line = lines.get(0);
        return !SIDE_EFFECT.matcher(line).find() && line.split("\\s+").length <= TRIVIAL_MAX_WORDS;
    }

    private static List<String> commandLines(TaskDefinition task) {
        var lines = new ArrayList<String>();
        for (String command : task.run()) {
            for (String line : command.split("\\R")) {
                String trimmed = line.strip().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    lines.add(trimmed);
                }
            }
        }
        return lines;
    }
}
