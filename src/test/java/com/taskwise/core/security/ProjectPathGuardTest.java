package com.taskwise.core.security;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectPathGuardTest {

    @TempDir
    Path tempDir;

    private final TaskwiseProperties properties = new TaskwiseProperties();
    private final ProjectPathGuard guard = new ProjectPathGuard(properties);

    private ErrorKind failureKind(String path) {
        return assertThrows(TaskGraphException.class, () -> guard.resolve(path)).getKind();
    }

    @Test
    @DisplayName("existing directory resolves to its real path")
    void existingDirectory() throws IOException {
        assertEquals(tempDir.toRealPath(), guard.resolve(tempDir.toString()));
    }

    @Test
    @DisplayName("system directories are denied")
    void systemDirectories() {
        assertEquals(ErrorKind.ACCESS_DENIED, failureKind("/etc"));
        assertEquals(ErrorKind.ACCESS_DENIED, failureKind("/usr/bin"));
        assertEquals(ErrorKind.ACCESS_DENIED, failureKind("/proc/self"));
    }

    @Test
    @DisplayName("traversal segments are denied")
    void traversal() {
        assertEquals(ErrorKind.ACCESS_DENIED, failureKind(tempDir.resolve("a/../b").toString()));
        assertEquals(ErrorKind.ACCESS_DENIED, failureKind("../../etc"));
    }

    @Test
    @DisplayName("missing, blank and file paths are not found")
    void notFound() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

        assertEquals(ErrorKind.PATH_NOT_FOUND, failureKind(tempDir.resolve("missing").toString()));
        assertEquals(ErrorKind.PATH_NOT_FOUND, failureKind(file.toString()));
        assertEquals(ErrorKind.PATH_NOT_FOUND, failureKind(" "));
        assertEquals(ErrorKind.PATH_NOT_FOUND, failureKind(null));
    }

    @Test
    @DisplayName("denied roots come from configuration")
    void configurableRoots() throws IOException {
        properties.getSecurity().setDeniedRoots(List.of(tempDir.toRealPath().toString()));

        assertEquals(ErrorKind.ACCESS_DENIED, failureKind(tempDir.toString()));
    }

    @Test
    @DisplayName("symlinks into a denied root are denied")
    void symlinkIntoDeniedRoot() throws IOException {
        Path target = Files.createDirectories(tempDir.resolve("secret"));
        Path link = Files.createSymbolicLink(tempDir.resolve("link"), target);
        properties.getSecurity().setDeniedRoots(List.of(target.toRealPath().toString()));

        assertEquals(ErrorKind.ACCESS_DENIED, failureKind(link.toString()));
    }
}
