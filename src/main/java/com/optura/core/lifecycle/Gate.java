package com.optura.core.lifecycle;

/**
 * Preconditions guarding lifecycle transitions, each with the guidance shown to the user.
 */
public enum Gate {
    SPEC_MISSING("Task cannot be approved without a machine-readable specification. Generate spec first."),
    TEST_RESULTS_MISSING("Task cannot be completed without test results. Run tests first."),
    TESTS_FAILED("Task cannot be completed with failed tests."),
    APPROVAL_REQUIRED("Task requires human approval before completion.");

    private final String guidance;

    Gate(String guidance) {
        this.guidance = guidance;
    }

    public String guidance() {
        return guidance;
    }
}
