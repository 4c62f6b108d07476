package com.taskwise.core.planner;

/**
 * What the caller wants to add. Everything except the description is optional;
 * complexity and domain hint are given as their lowercase names.
 */
public record PlacementRequest(
    String description,
    String suggestedName,
    String forcedComplexity,
    String domainHint
) {
    public static PlacementRequest of(String description) {
        return new PlacementRequest(description, null, null, null);
    }
}
