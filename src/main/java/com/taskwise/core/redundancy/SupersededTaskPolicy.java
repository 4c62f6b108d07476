package com.taskwise.core.redundancy;

import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.model.TaskDefinition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags a task whose name marks it as outdated ({@code old}, {@code legacy},
 * {@code deprecated}, {@code v1}) when another task runs exactly the same command.
 */
@Component
@Order(3)
public class SupersededTaskPolicy implements PruningPolicy {

    private static final Set<String> OUTDATED_MARKERS = Set.of("old", "legacy", "deprecated", "v1", "obsolete");

    @Override
    public String name() {
        return "superseded";
    }

    @Override
    public List<PruningCandidate> evaluate(TaskGraph graph) {
        List<TaskDefinition> tasks = graph.tasks();
        var candidates = new ArrayList<PruningCandidate>();
        for (TaskDefinition task : tasks) {
            if (!isMarkedOutdated(task.fullName())) continue;
            String command = DuplicateCommandPolicy.normalize(task.effectiveCommand());
            if (command.isEmpty()) continue;
            tasks.stream()
                    .filter(other -> other != task)
                    .filter(other -> !isMarkedOutdated(other.fullName()))
                    .filter(other -> DuplicateCommandPolicy.normalize(other.effectiveCommand()).equals(command))
                    .findFirst()
                    .ifPresent(replacement -> candidates.add(new PruningCandidate(task.fullName(), name(),
                            "Marked as outdated and superseded by " + replacement.fullName()
                                    + ", which runs the identical command")));
        }
        return candidates;
    }

    static boolean isMarkedOutdated(String fullName) {
        for (String word : fullName.toLowerCase(Locale.ROOT).split("[:_-]")) {
            if (OUTDATED_MARKERS.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
