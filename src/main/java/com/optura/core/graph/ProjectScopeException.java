package com.optura.core.graph;

/**
 * Thrown when graph input mixes records of different projects.
 */
public class ProjectScopeException extends RuntimeException {

    public ProjectScopeException(String message) {
        super(message);
    }
}
