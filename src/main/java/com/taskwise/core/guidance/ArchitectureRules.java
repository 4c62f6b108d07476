package com.taskwise.core.guidance;

import com.taskwise.core.model.TaskComplexity;
import com.taskwise.core.model.TaskDomain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static guidance on how a project's tasks should be organized.
 *
 * @param principles         architecture principles, one sentence each
 * @param domains            one entry per {@link TaskDomain}, in enumeration order
 * @param complexityLevels   one entry per {@link TaskComplexity}
 * @param dependencyPatterns pattern name to shape, e.g. {@code diamond}
 * @param bestPractices      topic to practices
 * @param commonPipelines    pipeline name to its usual task order
 */
public record ArchitectureRules(
    List<String> principles,
    List<DomainGuide> domains,
    List<ComplexityGuide> complexityLevels,
    Map<String, String> dependencyPatterns,
    Map<String, List<String>> bestPractices,
    Map<String, String> commonPipelines
) {
    public ArchitectureRules {
        principles = List.copyOf(principles);
        domains = List.copyOf(domains);
        complexityLevels = List.copyOf(complexityLevels);
        dependencyPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(dependencyPatterns));
        bestPractices = Collections.unmodifiableMap(new LinkedHashMap<>(bestPractices));
        commonPipelines = Collections.unmodifiableMap(new LinkedHashMap<>(commonPipelines));
    }

    public record DomainGuide(
        TaskDomain domain,
        String purpose,
        List<String> subDomains,
        List<String> typicalSources,
        List<String> typicalOutputs
    ) {}

    /**
     * @param commands how many commands a task of this level has, from the configured thresholds
     */
    public record ComplexityGuide(
        TaskComplexity level,
        String description,
        String commands,
        String storage
    ) {}
}
