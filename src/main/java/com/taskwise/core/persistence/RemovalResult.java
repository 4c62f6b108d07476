package com.taskwise.core.persistence;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of removing one task.
 *
 * @param removed            full name of the removed task
 * @param affectedDependents tasks that still reference it; their records are left untouched
 * @param documentUpdated    whether an inline entry was deleted from the document
 * @param deletedFile        the script file that was deleted, or {@code null}
 * @param warnings           follow-ups the caller must take care of
 */
public record RemovalResult(
    String removed,
    List<String> affectedDependents,
    boolean documentUpdated,
    Path deletedFile,
    List<String> warnings
) {
    public RemovalResult {
        affectedDependents = List.copyOf(affectedDependents);
        warnings = List.copyOf(warnings);
    }
}
