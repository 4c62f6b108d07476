package com.taskwise.core.security;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Vets a caller-supplied project path before anything reads or writes under it.
 */
@Service
public class ProjectPathGuard {

    private final TaskwiseProperties properties;

    public ProjectPathGuard(TaskwiseProperties properties) {
        this.properties = properties;
    }

    /**
     * Resolves the path to an existing project directory.
     *
     * @throws TaskGraphException {@code ACCESS_DENIED} for traversal segments or system
     *                            directories, {@code PATH_NOT_FOUND} when no such directory exists
     */
    public Path resolve(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            throw new TaskGraphException(ErrorKind.PATH_NOT_FOUND, "No project path given");
        }

        Path path;
        try {
            path = Path.of(projectPath.strip());
        } catch (InvalidPathException e) {
            throw new TaskGraphException(ErrorKind.PATH_NOT_FOUND, "Invalid project path: " + projectPath, e);
        }
        for (Path segment : path) {
            if (segment.toString().equals("..")) {
                throw new TaskGraphException(ErrorKind.ACCESS_DENIED,
                        "Project path must not contain '..': " + projectPath);
            }
        }

        Path absolute = path.toAbsolutePath().normalize();
        checkNotDenied(absolute, projectPath);
        if (!Files.isDirectory(absolute)) {
            throw new TaskGraphException(ErrorKind.PATH_NOT_FOUND, "Project path " + projectPath + " does not exist");
        }

        try {
            Path real = absolute.toRealPath();
            checkNotDenied(real, projectPath);
            return real;
        } catch (IOException e) {
            throw new TaskGraphException(ErrorKind.PATH_NOT_FOUND, "Project path " + projectPath + " is not accessible", e);
        }
    }

    public boolean isDenied(Path absolute) {
        for (String root : properties.getSecurity().getDeniedRoots()) {
            if (absolute.startsWith(Path.of(root))) {
                return true;
            }
        }
        return false;
    }

    private void checkNotDenied(Path absolute, String original) {
        if (isDenied(absolute)) {
            throw new TaskGraphException(ErrorKind.ACCESS_DENIED,
                    "Access to system directory denied: " + original);
        }
    }
}
