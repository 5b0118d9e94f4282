package com.frameception.core.model;

import java.io.Serializable;

/**
 * Derived project status. Never stored; recomputed from its inputs on every snapshot.
 *
 * @param state normalized state
 * @param error human-readable error message, only set when {@code state} is ERROR
 */
public record ProjectStatus(
    ProjectState state,
    String error
) implements Serializable {

    public static final ProjectStatus CREATED = new ProjectStatus(ProjectState.CREATED, null);
    public static final ProjectStatus BUILDING = new ProjectStatus(ProjectState.BUILDING, null);
    public static final ProjectStatus DEPLOYED = new ProjectStatus(ProjectState.DEPLOYED, null);

    public static ProjectStatus error(String message) {
        return new ProjectStatus(ProjectState.ERROR, message);
    }
}
