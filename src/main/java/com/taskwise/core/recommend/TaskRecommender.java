package com.taskwise.core.recommend;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.extract.ComplexityClassifier;
import com.taskwise.core.model.ExtractionResult;
import com.taskwise.core.model.ProjectStructure;
import com.taskwise.core.model.TaskComplexity;
import com.taskwise.core.model.TaskDefinition;
import com.taskwise.core.model.TaskDomain;
import com.taskwise.core.model.TaskRecommendation;
import com.taskwise.core.planner.DefaultCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Suggests the standard tasks a project of this shape usually has but does not
 * declare yet.
 */
@Service
public class TaskRecommender {

    private static final Logger log = LoggerFactory.getLogger(TaskRecommender.class);

    private record Template(
        String fullName,
        TaskDomain domain,
        String action,
        String description,
        String reasoning,
        List<String> depends,
        Predicate<ProjectStructure> applies
    ) {}

    private static final List<Template> TEMPLATES = List.of(
            new Template("setup:install", TaskDomain.SETUP, "install", "Install project dependencies",
                    "Every other task assumes dependencies are installed",
                    List.of(), s -> !s.packageManagers().isEmpty()),
            new Template("build:build", TaskDomain.BUILD, "build", "Build the project",
                    "A single build entry point makes incremental builds and CI simpler",
                    List.of("setup:install"), s -> !s.packageManagers().isEmpty()),
            new Template("test:test", TaskDomain.TEST, "test", "Run the test suite",
                    "The project has tests but no task to run them",
                    List.of("setup:install"), ProjectStructure::hasTests),
            new Template("lint:lint", TaskDomain.LINT, "lint", "Check code quality",
                    "Linting catches problems before review",
                    List.of("setup:install"), s -> !s.languages().isEmpty()),
            new Template("lint:format", TaskDomain.LINT, "format", "Format source files",
                    "Consistent formatting keeps diffs small",
                    List.of(), s -> !s.languages().isEmpty()),
            new Template("dev:dev", TaskDomain.DEV, "dev", "Start the development server",
                    "A detected framework has a development server",
                    List.of("setup:install"), s -> !s.frameworks().isEmpty()),
            new Template("docs:docs", TaskDomain.DOCS, "docs", "Build the documentation",
                    "The project has a documentation directory",
                    List.of(), ProjectStructure::hasDocs),
            new Template("db:migrate", TaskDomain.DB, null, "Apply database migrations",
                    "Database artifacts were found",
                    List.of("setup:install"), ProjectStructure::hasDatabase),
            new Template("ci:check", TaskDomain.CI, null, "Run every check CI runs",
                    "One task that mirrors CI lets contributors verify locally",
                    List.of("lint:lint", "test:test", "build:build"), s -> s.hasCi() || s.hasTests()),
            new Template("clean:clean", TaskDomain.CLEAN, "clean", "Remove build artifacts",
                    "Build artifacts were found",
                    List.of(), s -> !s.buildArtifacts().isEmpty())
    );

    private final ComplexityClassifier complexityClassifier;
    private final TaskwiseProperties properties;

    public TaskRecommender(ComplexityClassifier complexityClassifier, TaskwiseProperties properties) {
        this.complexityClassifier = complexityClassifier;
        this.properties = properties;
    }

    /**
     * @return recommendations, highest priority first
     */
    public List<TaskRecommendation> recommend(ProjectStructure structure, ExtractionResult existing) {
        var applicable = TEMPLATES.stream()
                .filter(t -> t.applies().test(structure))
                .toList();

        var recommendations = new ArrayList<TaskRecommendation>();
        for (Template template : applicable) {
            if (existing.find(template.fullName()).isPresent()) continue;
            var run = command(template, structure);
            if (run.isEmpty()) continue;

            // Keep only dependencies that exist or are recommended alongside.
            var depends = template.depends().stream()
                    .filter(dep -> existing.find(dep).isPresent() || isRecommended(dep, applicable, structure))
                    .toList();
            var needed = depends.stream()
                    .filter(dep -> existing.find(dep).isEmpty())
                    .toList();

            TaskDefinition task = TaskDefinition.builder(template.fullName(), template.domain())
                    .description(template.description())
                    .run(run.get())
                    .depends(depends)
                    .sources(DefaultCommands.sources(template.domain()))
                    .outputs(DefaultCommands.outputs(template.domain()))
                    .complexity(complexityClassifier.classify(List.of(run.get())))
                    .build();

            recommendations.add(new TaskRecommendation(task, template.reasoning(),
                    priority(template.domain()), effort(task.complexity()), needed));
        }

        recommendations.sort(Comparator.comparingInt(TaskRecommendation::priority).reversed());
        log.debug("{} recommendations for {}", recommendations.size(), structure.rootPath());
        return recommendations;
    }

    private boolean isRecommended(String fullName, List<Template> applicable, ProjectStructure structure) {
        return applicable.stream()
                .anyMatch(t -> t.fullName().equals(fullName) && command(t, structure).isPresent());
    }

    private Optional<String> command(Template template, ProjectStructure structure) {
        if (template.action() != null) {
            return DefaultCommands.forAction(template.action(), structure.packageManagers());
        }
        return switch (template.domain()) {
            case DB -> Optional.of(migrationCommand(structure));
            case CI -> Optional.of("echo 'All checks passed'");
            default -> Optional.empty();
        };
    }

    private static String migrationCommand(ProjectStructure structure) {
        if (structure.frameworks().contains("django")) return "python manage.py migrate";
        if (structure.frameworks().contains("prisma")) return "npx prisma migrate deploy";
        if (structure.uses("pip")) return "alembic upgrade head";
        return "echo 'Configure the migration command for this project'";
    }

    private int priority(TaskDomain domain) {
        int priority = properties.getRecommendations().priorityOf(domain.value());
        return Math.max(1, Math.min(10, priority));
    }

    private static String effort(TaskComplexity complexity) {
        return switch (complexity) {
            case SIMPLE -> "low";
            case MODERATE -> "medium";
            case COMPLEX -> "high";
        };
    }
}
