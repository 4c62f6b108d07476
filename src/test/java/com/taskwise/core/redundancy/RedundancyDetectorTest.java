package com.taskwise.core.redundancy;

import com.taskwise.core.graph.DependencyGraphBuilder;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RedundancyDetectorTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();
    private final RedundancyDetector detector = new RedundancyDetector(List.of(
            new IsolatedTaskPolicy(), new DuplicateCommandPolicy(), new SupersededTaskPolicy()));

    private static TaskDefinition.Builder task(String fullName, String command) {
        String prefix = fullName.substring(0, fullName.indexOf(':'));
        return TaskDefinition.builder(fullName, TaskDomain.fromValue(prefix).orElse(TaskDomain.BUILD))
                .description("Does " + fullName)
                .run(command);
    }

    private List<PruningCandidate> candidates(TaskDefinition... tasks) {
        return detector.findCandidates(builder.build(List.of(tasks)));
    }

    @Nested
    @DisplayName("isolated tasks")
    class Isolated {

        @Test
        @DisplayName("isolated no-op is flagged with a reason citing absent dependencies")
        void isolatedNoOp() {
            var result = candidates(
                    task("build:app", "npm run build").build(),
                    task("build:placeholder", "echo placeholder").build());

            assertEquals(1, result.size());
            assertEquals("build:placeholder", result.get(0).task());
            assertEquals("isolated", result.get(0).policy());
            assertTrue(result.get(0).reason().contains("No dependencies"));
        }

        @Test
        @DisplayName("isolated single short step is flagged")
        void shortStepFlagged() {
            var result = candidates(task("lint:fmt", "cargo fmt").build());

            assertEquals(1, result.size());
            assertEquals("isolated", result.get(0).policy());
            assertTrue(result.get(0).reason().contains("single short step"));
        }

        @Test
        @DisplayName("isolated task with a multi-word command is kept")
        void realCommandKept() {
            assertTrue(candidates(task("build:app", "npm run build").build()).isEmpty());
        }

        @Test
        @DisplayName("echo that redirects, pipes or substitutes is neither a no-op nor trivial")
        void sideEffectsKept() {
            assertTrue(candidates(
                    task("setup:env", "echo $TOKEN > .env").build(),
                    task("db:reset", "echo y | ./reset.sh").build(),
                    task("build:log", "printf done >> build.log").build(),
                    task("build:stamp", "echo $(date)").build()).isEmpty());
            assertFalse(IsolatedTaskPolicy.isNoOp(task("setup:env", "echo $TOKEN > .env").build()));
            assertFalse(IsolatedTaskPolicy.isTrivial(task("setup:go", "echo hi;./go").build()));
        }

        @Test
        @DisplayName("no-op that tracks files is kept")
        void trackedFilesKept() {
            assertTrue(candidates(task("build:stamp", "true").outputs(List.of("stamp")).build()).isEmpty());
        }

        @Test
        @DisplayName("no-op with a dependent is kept")
        void connectedKept() {
            assertTrue(candidates(
                    task("ci:marker", ":").build(),
                    task("ci:all", "make ci").depends(List.of("ci:marker")).build()).isEmpty());
        }
    }

    @Nested
    @DisplayName("duplicate commands")
    class Duplicates {

        @Test
        @DisplayName("later task with the same command in the same domain is flagged")
        void sameDomain() {
            var result = candidates(
                    task("build:app", "npm run build").build(),
                    task("build:again", "npm   run build").build());

            assertEquals(1, result.size());
            assertEquals("build:again", result.get(0).task());
            assertEquals("duplicate-command", result.get(0).policy());
            assertTrue(result.get(0).reason().contains("build:app"));
        }

        @Test
        @DisplayName("same command in different domains is not a duplicate")
        void differentDomains() {
            assertTrue(candidates(
                    task("build:app", "make -j4 all").build(),
                    task("ci:app", "make -j4 all").build()).isEmpty());
        }
    }

    @Nested
    @DisplayName("superseded tasks")
    class Superseded {

        @Test
        @DisplayName("outdated name with an identical command elsewhere is flagged")
        void legacyFlagged() {
            var result = candidates(
                    task("ci:legacy-check", "make check -j4").build(),
                    task("test:check", "make check -j4").build());

            assertEquals(1, result.size());
            assertEquals("ci:legacy-check", result.get(0).task());
            assertEquals("superseded", result.get(0).policy());
            assertTrue(result.get(0).reason().contains("test:check"));
        }

        @Test
        @DisplayName("outdated name without a replacement is kept")
        void legacyWithoutReplacement() {
            assertTrue(candidates(task("deploy:v1", "./deploy-v1.sh --env prod").build()).isEmpty());
        }

        @Test
        @DisplayName("outdated markers are whole name segments")
        void markers() {
            assertTrue(SupersededTaskPolicy.isMarkedOutdated("build:old-bundle"));
            assertTrue(SupersededTaskPolicy.isMarkedOutdated("deploy:v1"));
            assertFalse(SupersededTaskPolicy.isMarkedOutdated("build:golden"));
        }
    }

    @Test
    @DisplayName("a task flagged by several policies is reported once")
    void reportedOnce() {
        var result = candidates(
                task("build:a", "echo hi").build(),
                task("build:b", "echo hi").build());

        assertEquals(List.of("build:a", "build:b"), result.stream().map(PruningCandidate::task).toList());
        assertTrue(result.stream().allMatch(c -> c.policy().equals("isolated")));
    }
}
