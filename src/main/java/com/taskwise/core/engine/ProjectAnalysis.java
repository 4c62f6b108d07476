package com.taskwise.core.engine;

import com.taskwise.core.model.ExtractionResult;
import com.taskwise.core.model.ProjectStructure;
import com.taskwise.core.model.TaskRecommendation;

import java.util.List;

/**
 * A project's layout, the tasks it already declares, and the tasks worth adding.
 */
public record ProjectAnalysis(
    ProjectStructure structure,
    ExtractionResult existing,
    List<TaskRecommendation> recommendations
) {
    public ProjectAnalysis {
        recommendations = List.copyOf(recommendations);
    }
}
