package com.flowline.coordinator.model;

/**
 * Paused flag applied to a pipeline when its config is saved for the first time.
 * Later saves keep whatever paused state the pipeline already has.
 */
public enum PipelinePauseState {
    PAUSED,
    UNPAUSED;

    public boolean isPaused() {
        return this == PAUSED;
    }
}
