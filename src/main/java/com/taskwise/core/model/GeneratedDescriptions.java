package com.taskwise.core.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Summaries used when a task declares no description, and the test for them.
 */
public final class GeneratedDescriptions {

    private static final Pattern GENERATED = Pattern.compile(
            "^(Runs: .*|Runs \\d+ commands starting with: .*|Runs script .*)$", Pattern.DOTALL);

    private GeneratedDescriptions() {} // utility class

    public static String forCommands(List<String> run) {
        if (run.size() == 1) {
            return "Runs: " + abbreviate(run.get(0));
        }
        return "Runs " + run.size() + " commands starting with: " + abbreviate(run.get(0));
    }

    public static String forScript(String relativePath) {
        return "Runs script " + relativePath;
    }

    /** Whether the description is blank or one of the generated summaries. */
    public static boolean isMissing(String description) {
        return description == null || description.isBlank() || GENERATED.matcher(description).matches();
    }

    private static String abbreviate(String command) {
        String firstLine = command.strip().lines().findFirst().orElse("");
        return firstLine.length() > 60 ? firstLine.substring(0, 57) + "..." : firstLine;
    }
}
