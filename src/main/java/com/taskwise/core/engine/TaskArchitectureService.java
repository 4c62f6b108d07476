package com.taskwise.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.taskwise.core.error.ErrorKind;
import com.taskwise.core.error.TaskGraphException;
import com.taskwise.core.extract.TaskExtractor;
import com.taskwise.core.graph.DependencyGraphBuilder;
import com.taskwise.core.graph.TaskGraph;
import com.taskwise.core.guidance.ArchitectureGuide;
import com.taskwise.core.guidance.ArchitectureRules;
import com.taskwise.core.logging.MdcContext;
import com.taskwise.core.model.ChainTrace;
import com.taskwise.core.model.ExtractionResult;
import com.taskwise.core.model.ProjectStructure;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.persistence.ConfigPersister;
import com.taskwise.core.persistence.RemovalResult;
import com.taskwise.core.planner.PlacementRequest;
import com.taskwise.core.planner.PlacementResult;
import com.taskwise.core.planner.TaskPlacementPlanner;
import com.taskwise.core.recommend.TaskRecommender;
import com.taskwise.core.redundancy.PruningCandidate;
import com.taskwise.core.redundancy.RedundancyDetector;
import com.taskwise.core.scanner.ProjectStructureAnalyzer;
import com.taskwise.core.scheduler.ChainTracer;
import com.taskwise.core.security.ProjectPathGuard;
import com.taskwise.core.validation.ArchitectureValidator;
import com.taskwise.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry point to the engine: one operation per component, each taking plain values
 * and returning an {@link OperationResult}.
 * <p>
 * Every call re-reads the project from disk. Analysis operations never throw; every
 * failure becomes a {@link TaskError}. Mutating operations turn anticipated failures
 * into errors the same way but let unexpected faults propagate.
 */
@Service
public class TaskArchitectureService {

    private static final Logger log = LoggerFactory.getLogger(TaskArchitectureService.class);

    @FunctionalInterface
    private interface ProjectOperation<T> {
        T apply(Path projectRoot) throws IOException;
    }

    private record Snapshot(ExtractionResult extraction, TaskGraph graph) {}

    private final ProjectPathGuard pathGuard;
    private final ProjectStructureAnalyzer structureAnalyzer;
    private final TaskExtractor taskExtractor;
    private final DependencyGraphBuilder graphBuilder;
    private final ChainTracer chainTracer;
    private final ArchitectureValidator validator;
    private final RedundancyDetector redundancyDetector;
    private final TaskPlacementPlanner placementPlanner;
    private final ConfigPersister persister;
    private final TaskRecommender recommender;
    private final ArchitectureGuide architectureGuide;

    public TaskArchitectureService(ProjectPathGuard pathGuard,
                                   ProjectStructureAnalyzer structureAnalyzer,
                                   TaskExtractor taskExtractor,
                                   DependencyGraphBuilder graphBuilder,
                                   ChainTracer chainTracer,
                                   ArchitectureValidator validator,
                                   RedundancyDetector redundancyDetector,
                                   TaskPlacementPlanner placementPlanner,
                                   ConfigPersister persister,
                                   TaskRecommender recommender,
                                   ArchitectureGuide architectureGuide) {
        this.pathGuard = pathGuard;
        this.structureAnalyzer = structureAnalyzer;
        this.taskExtractor = taskExtractor;
        this.graphBuilder = graphBuilder;
        this.chainTracer = chainTracer;
        this.validator = validator;
        this.redundancyDetector = redundancyDetector;
        this.placementPlanner = placementPlanner;
        this.persister = persister;
        this.recommender = recommender;
        this.architectureGuide = architectureGuide;
    }

    // ── Analysis ─────────────────────────────────────────────────────

    public OperationResult<ProjectAnalysis> analyzeProject(String projectPath) {
        return analyze("analyzeProject", projectPath, null, root -> {
            ProjectStructure structure = structureAnalyzer.analyze(root);
            ExtractionResult existing = taskExtractor.extract(root);
            return new ProjectAnalysis(structure, existing, recommender.recommend(structure, existing));
        });
    }

    public OperationResult<ExtractionResult> extractTasks(String projectPath) {
        return analyze("extractTasks", projectPath, null, taskExtractor::extract);
    }

    public OperationResult<ChainTrace> traceTaskChain(String projectPath, String taskName) {
        return analyze("traceTaskChain", projectPath, taskName, root -> {
            Snapshot snapshot = snapshot(root);
            TaskDefinition task = find(snapshot, taskName);
            return chainTracer.trace(snapshot.graph(), task.fullName());
        });
    }

    public OperationResult<ValidationReport> validateArchitecture(String projectPath) {
        return analyze("validateArchitecture", projectPath, null,
                root -> validator.validate(snapshot(root).graph()));
    }

    public OperationResult<List<PruningCandidate>> findPruningCandidates(String projectPath) {
        return analyze("findPruningCandidates", projectPath, null,
                root -> redundancyDetector.findCandidates(snapshot(root).graph()));
    }

    /** Domain hierarchy, complexity levels and practices; needs no project. */
    public OperationResult<ArchitectureRules> getArchitectureRules() {
        return OperationResult.success(architectureGuide.rules());
    }

    // ── Mutation ─────────────────────────────────────────────────────

    /**
     * Reports pruning candidates and, unless {@code dryRun}, removes them with a
     * single document rewrite.
     */
    public OperationResult<PruneResult> pruneTasks(String projectPath, boolean dryRun) {
        ProjectOperation<PruneResult> prune = root -> {
            Snapshot snapshot = snapshot(root);
            List<PruningCandidate> candidates = redundancyDetector.findCandidates(snapshot.graph());
            if (dryRun || candidates.isEmpty()) {
                return new PruneResult(dryRun, candidates, List.of(), List.of());
            }
            List<TaskDefinition> tasks = candidates.stream()
                    .map(c -> snapshot.graph().task(c.task()).orElseThrow(() -> TaskGraphException.taskNotFound(c.task())))
                    .toList();
            List<RemovalResult> removals = persister.removeAll(root, tasks, snapshot.graph());
            var affected = new LinkedHashSet<String>();
            removals.forEach(r -> affected.addAll(r.affectedDependents()));
            log.info("Pruned {} tasks", removals.size());
            return new PruneResult(false, candidates,
                    removals.stream().map(RemovalResult::removed).toList(), List.copyOf(affected));
        };
        return dryRun
                ? analyze("pruneTasks", projectPath, null, prune)
                : mutate("pruneTasks", projectPath, null, prune);
    }

    /**
     * Plans and writes a new task.
     *
     * @param forcedComplexity {@code simple}, {@code moderate}, {@code complex} or {@code null}
     * @param domainHint       a domain name or {@code null}
     */
    public OperationResult<PlacementResult> createTask(String projectPath, String description, String suggestedName,
                                                       String forcedComplexity, String domainHint) {
        return mutate("createTask", projectPath, suggestedName, root -> {
            ProjectStructure structure = structureAnalyzer.analyze(root);
            ExtractionResult existing = taskExtractor.extract(root);
            PlacementResult placement = placementPlanner.plan(
                    new PlacementRequest(description, suggestedName, forcedComplexity, domainHint),
                    structure, existing.fullNames());
            persister.save(root, placement.task());
            return placement;
        });
    }

    public OperationResult<RemovalResult> removeTask(String projectPath, String taskName) {
        return mutate("removeTask", projectPath, taskName, root -> {
            Snapshot snapshot = snapshot(root);
            TaskDefinition task = find(snapshot, taskName);
            return persister.remove(root, task, snapshot.graph());
        });
    }

    // ── Plumbing ─────────────────────────────────────────────────────

    private Snapshot snapshot(Path root) throws IOException {
        ExtractionResult extraction = taskExtractor.extract(root);
        return new Snapshot(extraction, graphBuilder.build(extraction.tasks()));
    }

    private static TaskDefinition find(Snapshot snapshot, String taskName) {
        return snapshot.extraction().find(taskName)
                .orElseThrow(() -> TaskGraphException.taskNotFound(taskName));
    }

    private <T> OperationResult<T> analyze(String operation, String projectPath, String taskName,
                                           ProjectOperation<T> body) {
        MdcContext.setOperation(operation, projectPath);
        if (taskName != null) {
            MdcContext.setTask(taskName);
        }
        try {
            return OperationResult.success(body.apply(pathGuard.resolve(projectPath)));
        } catch (TaskGraphException e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            return OperationResult.failure(TaskError.from(e));
        } catch (JsonProcessingException e) {
            log.warn("{} failed: unreadable task document: {}", operation, e.getOriginalMessage());
            return OperationResult.failure(malformedDocument(e));
        } catch (IOException e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            return OperationResult.failure(TaskError.of(ErrorKind.IO_ERROR, "Cannot read project: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            return OperationResult.failure(TaskError.of(ErrorKind.INTERNAL_ERROR, operation + " failed: " + e.getMessage()));
        } finally {
            MdcContext.clear();
        }
    }

    private <T> OperationResult<T> mutate(String operation, String projectPath, String taskName,
                                          ProjectOperation<T> body) {
        MdcContext.setOperation(operation, projectPath);
        if (taskName != null) {
            MdcContext.setTask(taskName);
        }
        try {
            return OperationResult.success(body.apply(pathGuard.resolve(projectPath)));
        } catch (TaskGraphException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return OperationResult.failure(TaskError.from(e));
        } catch (JsonProcessingException e) {
            log.warn("{} rejected: unreadable task document: {}", operation, e.getOriginalMessage());
            return OperationResult.failure(malformedDocument(e));
        } catch (IOException e) {
            throw new UncheckedIOException(operation + " failed: " + e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    private static TaskError malformedDocument(JsonProcessingException e) {
        return TaskError.of(ErrorKind.MALFORMED_TASK, "Task document could not be parsed: " + e.getOriginalMessage());
    }
}
