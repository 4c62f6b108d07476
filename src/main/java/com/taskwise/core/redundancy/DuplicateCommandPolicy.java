package com.taskwise.core.redundancy;

import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Flags a task whose normalized command matches an earlier task in the same domain.
 * The first declaration is kept; later copies are the candidates.
 */
@Component
@Order(2)
public class DuplicateCommandPolicy implements PruningPolicy {

    @Override
    public String name() {
        return "duplicate-command";
    }

    @Override
    public List<PruningCandidate> evaluate(TaskGraph graph) {
        var firstByCommand = new HashMap<TaskDomain, HashMap<String, String>>();
        var candidates = new ArrayList<PruningCandidate>();
        for (TaskDefinition task : graph.tasks()) {
            String command = normalize(task.effectiveCommand());
            if (command.isEmpty()) continue;
            var seen = firstByCommand.computeIfAbsent(task.domain(), d -> new HashMap<>());
            String original = seen.putIfAbsent(command, task.fullName());
            if (original != null) {
                candidates.add(new PruningCandidate(task.fullName(), name(),
                        "Runs the same command as " + original + " in the " + task.domain().value() + " domain"));
            }
        }
        return candidates;
    }

    /** Collapses whitespace so formatting differences do not hide a duplicate. */
    static String normalize(String command) {
        return command.strip().replaceAll("\\s+", " ");
    }
}
