package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Risk classification of a project, usually proposed by the planner.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Lenient parse used for planner output ("medium", "HIGH", ...).
     * Unknown or blank values map to {@link #MEDIUM}.
     */
    @JsonCreator
    public static RiskLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
