package com.taskwise.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Where a task's command body lives: inline in the document, or in a script file.
 */
public sealed interface TaskStorage permits TaskStorage.Inline, TaskStorage.Script {

    /** Short label used in results ({@code inline} / {@code file}). */
    String kind();

    record Inline(List<String> commands) implements TaskStorage {
        public Inline {
            commands = commands == null ? List.of() : List.copyOf(commands);
        }

        @Override
        public String kind() {
            return "inline";
        }
    }

    record Script(Path path) implements TaskStorage {
        @Override
        public String kind() {
            return "file";
        }
    }
}
