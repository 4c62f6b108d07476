package com.taskwise.core.config;

import com.taskwise.TaskwiseApplication;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = TaskwiseApplication.class, properties = {
        "taskwise.placement.auto-disambiguate=true",
        "taskwise.complexity.moderate-max-commands=8"
})
class TaskwisePropertiesTest {

    @Autowired
    TaskwiseProperties properties;

    @Test
    @DisplayName("application.yml defaults are bound")
    void defaults() {
        assertEquals(List.of(".mise.toml", "mise.toml"), properties.getConfigFileNames());
        assertEquals(List.of(".mise/tasks", "mise-tasks", ".mise-tasks"), properties.getTaskDirs());
        assertEquals("build", properties.getDefaultDomain());
        assertEquals(1, properties.getSimpleMaxCommands());
        assertEquals(200, properties.getLongCommandLength());
        assertTrue(properties.getSecurity().getDeniedRoots().contains("/etc"));
        assertEquals(9, properties.getRecommendations().priorityOf("build"));
    }

    @Test
    @DisplayName("overrides win over application.yml")
    void overrides() {
        assertTrue(properties.getPlacement().isAutoDisambiguate());
        assertEquals(8, properties.getModerateMaxCommands());
    }

    @Test
    @DisplayName("unknown domains get the middle priority")
    void unknownPriority() {
        assertEquals(5, properties.getRecommendations().priorityOf("frontend"));
    }
}
