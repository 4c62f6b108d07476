package com.taskwise.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskwise")
public class TaskwiseProperties {

    private Extraction extraction = new Extraction();
    private Complexity complexity = new Complexity();
    private Placement placement = new Placement();
    private Security security = new Security();
    private Recommendations recommendations = new Recommendations();

    // -- Shortcuts (delegate to nested) --
    public List<String> getConfigFileNames() { return extraction.configFileNames; }
    public List<String> getTaskDirs() { return extraction.taskDirs; }
    public String getDefaultDomain() { return extraction.defaultDomain; }
    public int getSimpleMaxCommands() { return complexity.simpleMaxCommands; }
    public int getModerateMaxCommands() { return complexity.moderateMaxCommands; }
    public int getLongCommandLength() { return complexity.longCommandLength; }

    public Extraction getExtraction() { return extraction; }
    public void setExtraction(Extraction extraction) { this.extraction = extraction; }
    public Complexity getComplexity() { return complexity; }
    public void setComplexity(Complexity complexity) { this.complexity = complexity; }
    public Placement getPlacement() { return placement; }
    public void setPlacement(Placement placement) { this.placement = placement; }
    public Security getSecurity() { return security; }
    public void setSecurity(Security security) { this.security = security; }
    public Recommendations getRecommendations() { return recommendations; }
    public void setRecommendations(Recommendations recommendations) { this.recommendations = recommendations; }

    public static class Extraction {
        /** Candidate document names, first existing one wins; the first is used when none exists. */
        private List<String> configFileNames = new ArrayList<>(List.of(".mise.toml", "mise.toml"));
        /** Directories (relative to the project root) scanned for script tasks. */
        private List<String> taskDirs = new ArrayList<>(List.of(".mise/tasks", "mise-tasks", ".mise-tasks"));
        private String defaultDomain = "build";

        public List<String> getConfigFileNames() { return configFileNames; }
        public void setConfigFileNames(List<String> configFileNames) { this.configFileNames = configFileNames; }
        public List<String> getTaskDirs() { return taskDirs; }
        public void setTaskDirs(List<String> taskDirs) { this.taskDirs = taskDirs; }
        public String getDefaultDomain() { return defaultDomain; }
        public void setDefaultDomain(String defaultDomain) { this.defaultDomain = defaultDomain; }
    }

    public static class Complexity {
        private int simpleMaxCommands = 1;
        private int moderateMaxCommands = 5;
        /** A single command longer than this counts as moderate. */
        private int longCommandLength = 200;

        public int getSimpleMaxCommands() { return simpleMaxCommands; }
        public void setSimpleMaxCommands(int simpleMaxCommands) { this.simpleMaxCommands = simpleMaxCommands; }
        public int getModerateMaxCommands() { return moderateMaxCommands; }
        public void setModerateMaxCommands(int moderateMaxCommands) { this.moderateMaxCommands = moderateMaxCommands; }
        public int getLongCommandLength() { return longCommandLength; }
        public void setLongCommandLength(int longCommandLength) { this.longCommandLength = longCommandLength; }
    }

    public static class Placement {
        /** Append a numeric suffix on name collision instead of failing. */
        private boolean autoDisambiguate = false;
        private int maxNameWords = 2;

        public boolean isAutoDisambiguate() { return autoDisambiguate; }
        public void setAutoDisambiguate(boolean autoDisambiguate) { this.autoDisambiguate = autoDisambiguate; }
        public int getMaxNameWords() { return maxNameWords; }
        public void setMaxNameWords(int maxNameWords) { this.maxNameWords = maxNameWords; }
    }

    public static class Security {
        private List<String> deniedRoots = new ArrayList<>(List.of(
                "/etc", "/proc", "/sys", "/dev", "/bin", "/sbin", "/usr/bin", "/usr/sbin"));

        public List<String> getDeniedRoots() { return deniedRoots; }
        public void setDeniedRoots(List<String> deniedRoots) { this.deniedRoots = deniedRoots; }
    }

    public static class Recommendations {
        private Map<String, Integer> domainPriorities = new LinkedHashMap<>(Map.of(
                "build", 9, "test", 8, "lint", 7, "ci", 8, "deploy", 6,
                "dev", 5, "db", 7, "docs", 4, "clean", 3, "setup", 8));

        public Map<String, Integer> getDomainPriorities() { return domainPriorities; }
        public void setDomainPriorities(Map<String, Integer> domainPriorities) { this.domainPriorities = domainPriorities; }

        public int priorityOf(String domain) {
            return domainPriorities.getOrDefault(domain, 5);
        }
    }
}
