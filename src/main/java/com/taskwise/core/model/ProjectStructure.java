package com.taskwise.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Snapshot of a project's layout gathered from marker files and conventional
 * directory names. Rebuilt on every call, never persisted.
 */
public record ProjectStructure(
    Path rootPath,
    Set<String> packageManagers,
    Set<String> languages,
    Set<String> frameworks,
    boolean hasTests,
    boolean hasDocs,
    boolean hasCi,
    boolean hasDatabase,
    List<String> buildArtifacts,
    List<String> sourceDirs
) {
    public ProjectStructure {
        packageManagers = Collections.unmodifiableSet(new LinkedHashSet<>(packageManagers));
        languages = Collections.unmodifiableSet(new LinkedHashSet<>(languages));
        frameworks = Collections.unmodifiableSet(new LinkedHashSet<>(frameworks));
        buildArtifacts = List.copyOf(buildArtifacts);
        sourceDirs = List.copyOf(sourceDirs);
    }

    public boolean uses(String packageManager) {
        return packageManagers.contains(packageManager);
    }
}
