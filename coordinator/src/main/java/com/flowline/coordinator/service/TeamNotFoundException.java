package com.flowline.coordinator.service;

public class TeamNotFoundException extends RuntimeException {

    public TeamNotFoundException(long teamId) {
        super("Team not found: " + teamId);
    }

    public TeamNotFoundException(String teamName) {
        super("Team not found: '" + teamName + "'");
    }
}
