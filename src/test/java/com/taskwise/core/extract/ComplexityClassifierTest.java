package com.taskwise.core.extract;

import com.taskwise.core.config.TaskwiseProperties;
import com.taskwise.core.model.TaskComplexity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityClassifierTest {

    private final TaskwiseProperties properties = new TaskwiseProperties();
    private final ComplexityClassifier classifier = new ComplexityClassifier(properties);

    @Test
    @DisplayName("one command is simple")
    void singleCommandIsSimple() {
        assertEquals(TaskComplexity.SIMPLE, classifier.classify(List.of("npm run build")));
    }

    @Test
    @DisplayName("two to five commands are moderate")
    void fewCommandsAreModerate() {
        assertEquals(TaskComplexity.MODERATE, classifier.classify(List.of("npm ci", "npm run build")));
        assertEquals(TaskComplexity.MODERATE, classifier.classify(List.of("a && b && c && d && e")));
    }

    @Test
    @DisplayName("more than five commands are complex")
    void manyCommandsAreComplex() {
        assertEquals(TaskComplexity.COMPLEX, classifier.classify(List.of("a", "b", "c", "d", "e", "f")));
    }

    @Test
    @DisplayName("a single very long command is moderate")
    void longCommandIsModerate() {
        assertEquals(TaskComplexity.MODERATE, classifier.classify(List.of("x".repeat(201))));
    }

    @Test
    @DisplayName("blank and comment lines are not counted")
    void ignoresBlankAndComments() {
        assertEquals(1, classifier.countCommands(List.of("# build it\n\nmake\n")));
        assertEquals(3, classifier.countCommands(List.of("a && b || c")));
    }

    @Test
    @DisplayName("script bodies are never simple")
    void scriptsAreNeverSimple() {
        assertEquals(TaskComplexity.MODERATE, classifier.classifyScript(List.of("make")));
    }

    @Test
    @DisplayName("thresholds come from configuration")
    void thresholdsAreConfigurable() {
        properties.getComplexity().setSimpleMaxCommands(2);
        assertEquals(TaskComplexity.SIMPLE, classifier.classify(List.of("npm ci", "npm run build")));
    }

    @Test
    @DisplayName("descriptions are classified by step count and workflow phrases")
    void classifiesDescriptions() {
        assertEquals(TaskComplexity.SIMPLE, classifier.classifyDescription("deploy to production"));
        assertEquals(TaskComplexity.MODERATE, classifier.classifyDescription("install deps, then build the app"));
        assertEquals(TaskComplexity.COMPLEX, classifier.classifyDescription("orchestrate the release workflow"));
        assertEquals(TaskComplexity.SIMPLE, classifier.classifyDescription(""));
    }
}
