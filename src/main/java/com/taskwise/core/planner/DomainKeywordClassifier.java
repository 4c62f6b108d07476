package com.taskwise.core.planner;

import com.taskwise.core.model.TaskDomain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scores free text against a fixed keyword table to pick the domain of a new task.
 * <p>
 * Each matched keyword counts once. The highest score wins; ties go to the domain
 * listed first in the table.
 */
public final class DomainKeywordClassifier {

    /**
     * Score of one domain against a text.
     */
    public record DomainScore(
        TaskDomain domain,
        int score,
        List<String> matchedKeywords
    ) {}

    private record DomainKeywords(TaskDomain domain, List<String> keywords) {}

    private static final List<DomainKeywords> KEYWORD_TABLE = List.of(
            new DomainKeywords(TaskDomain.DEPLOY,
                    List.of("deploy", "deployment", "release", "publish", "production", "staging", "ship", "rollout")),
            new DomainKeywords(TaskDomain.TEST,
                    List.of("test", "tests", "testing", "unit", "integration", "e2e", "coverage", "pytest", "jest", "spec")),
            new DomainKeywords(TaskDomain.LINT,
                    List.of("lint", "linter", "linting", "format", "formatting", "prettier", "eslint", "clippy", "ruff",
                            "typecheck", "type check", "style")),
            new DomainKeywords(TaskDomain.BUILD,
                    List.of("build", "compile", "bundle", "transpile", "package", "assemble", "webpack", "vite", "tsc")),
            new DomainKeywords(TaskDomain.DB,
                    List.of("database", "db", "migrate", "migration", "migrations", "seed", "schema", "sql")),
            new DomainKeywords(TaskDomain.CI,
                    List.of("ci", "continuous integration", "pipeline", "github actions", "pre-commit", "check all")),
            new DomainKeywords(TaskDomain.DOCS,
                    List.of("docs", "documentation", "readme", "docstring", "mkdocs", "javadoc", "sphinx")),
            new DomainKeywords(TaskDomain.DEV,
                    List.of("dev", "develop", "development", "serve", "server", "watch", "hot reload", "start", "local")),
            new DomainKeywords(TaskDomain.CLEAN,
                    List.of("clean", "cleanup", "purge", "wipe", "clear cache")),
            new DomainKeywords(TaskDomain.SETUP,
                    List.of("setup", "set up", "install", "bootstrap", "init", "initialize", "dependencies", "configure"))
    );

    private DomainKeywordClassifier() {} // utility class

    /**
     * Picks the best-scoring domain, or empty when no keyword matches.
     */
    public static Optional<TaskDomain> classify(String text) {
        DomainScore best = null;
        for (DomainScore score : scores(text)) {
            if (best == null || score.score() > best.score()) {
                best = score;
            }
        }
        return Optional.ofNullable(best).map(DomainScore::domain);
    }

    /**
     * Scores for every domain with at least one match, in table order.
     */
    public static List<DomainScore> scores(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        var scores = new ArrayList<DomainScore>();
        for (var entry : KEYWORD_TABLE) {
            var matched = new ArrayList<String>();
            for (String keyword : entry.keywords()) {
                if (matchesKeyword(lowerText, keyword)) {
                    matched.add(keyword);
                }
            }
            if (!matched.isEmpty()) {
                scores.add(new DomainScore(entry.domain(), matched.size(), matched));
            }
        }
        return scores;
    }

    // Word boundaries keep "test" out of "latest" and "ci" out of "decide".
    private static boolean matchesKeyword(String lowerText, String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lowerText).find();
    }
}
