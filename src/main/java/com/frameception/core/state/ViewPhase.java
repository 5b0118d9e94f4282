package com.frameception.core.state;

/**
 * What the rendering layer should show for the active project.
 */
public enum ViewPhase {
    IDLE,       // no project selected
    LOADING,    // first fetch still outstanding
    ERROR,      // last project fetch failed, content hidden until a later fetch succeeds
    NOT_FOUND,  // backend answered but knows no such project
    READY
}
