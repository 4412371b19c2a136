package com.optura.core.store;

public class ProjectNotFoundException extends RuntimeException {

    private final long projectId;

    public ProjectNotFoundException(long projectId) {
        super("Project not found: " + projectId);
        this.projectId = projectId;
    }

    public long projectId() {
        return projectId;
    }
}
