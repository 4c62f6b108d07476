package com.taskwise.core.planner;

import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskStorage;

import java.util.List;

/**
 * Where and how a new task will be stored.
 *
 * @param fullName domain-prefixed name of the new task
 * @param storage  inline commands, or the script file to write
 * @param task     the definition to persist
 * @param warnings non-fatal notes (renamed on collision, placeholder command, ...)
 */
public record PlacementResult(
    String fullName,
    TaskStorage storage,
    TaskDefinition task,
    List<String> warnings
) {
    public PlacementResult {
        warnings = List.copyOf(warnings);
    }
}
