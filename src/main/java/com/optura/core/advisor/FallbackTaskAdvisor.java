package com.optura.core.advisor;

import com.optura.core.model.ProjectBrief;
import com.optura.core.model.RiskLevel;
import com.optura.core.model.Task;
import com.optura.core.model.TaskPlan;
import com.optura.core.model.TaskProposal;
import com.optura.core.model.TaskSpecification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic advisor used when no model is configured or a model call fails.
 */
public class FallbackTaskAdvisor implements TaskAdvisor {

    static final double FALLBACK_CONFIDENCE = 0.5;

    /**
     * Three sequential tasks: research (approval required), implementation, and
     * testing (approval required).
     */
    @Override
    public TaskPlan generatePlan(ProjectBrief brief) {
        var research = new TaskProposal(
                "Research and Requirements",
                "Analyze requirements for: " + brief.goal(),
                Map.of("requirements", nullToEmpty(brief.description())),
                Map.of("specification", "Detailed requirements document"),
                List.of(test("review", "Stakeholder review of requirements")),
                2.0, 0, true, 0.7, List.of());
        var implementation = new TaskProposal(
                "Implementation",
                "Implement solution for: " + brief.goal(),
                Map.of("specification", "Requirements document"),
                Map.of("code", "Working implementation"),
                List.of(test("unit", "Unit tests for core functionality"),
                        test("integration", "Integration tests")),
                4.0, 1, false, 0.6, List.of(0));
        var validation = new TaskProposal(
                "Testing and Validation",
                "Run comprehensive tests and validation",
                Map.of("code", "Implementation"),
                Map.of("test_results", "Test reports"),
                List.of(test("e2e", "End-to-end testing"),
                        test("integration", "Full system integration test")),
                2.0, 2, true, 0.8, List.of(1));
        return new TaskPlan(List.of(research, implementation, validation), RiskLevel.MEDIUM, 8.0);
    }

    /**
     * Spec derived from the task's own inputs, outputs and test descriptors.
     */
    @Override
    public TaskSpecification generateSpec(Task task, String projectContext) {
        var inputs = new LinkedHashMap<String, Object>();
        if (task.inputs() != null) {
            task.inputs().forEach((key, value) -> inputs.put(key, Map.of(
                    "type", "any",
                    "description", String.valueOf(value),
                    "validation", List.of(),
                    "example", "")));
        }

        var outputs = new LinkedHashMap<String, Object>();
        if (task.outputs() != null) {
            task.outputs().forEach((key, value) -> outputs.put(key, Map.of(
                    "type", "any",
                    "description", String.valueOf(value),
                    "example", "")));
        }

        var testCases = new ArrayList<Map<String, Object>>();
        List<Map<String, Object>> tests = task.tests() != null ? task.tests() : List.of();
        for (int i = 0; i < tests.size(); i++) {
            Map<String, Object> test = tests.get(i);
            testCases.add(Map.of(
                    "name", "Test " + (i + 1),
                    "type", String.valueOf(test.getOrDefault("type", "unit")),
                    "inputs", Map.of(),
                    "expected_output", Map.of(),
                    "expected_behavior", String.valueOf(test.getOrDefault("description", test))));
        }

        return new TaskSpecification(
                task.name(),
                task.description(),
                inputs,
                outputs,
                testCases,
                List.of(),
                List.of(),
                List.of("This is a fallback specification generated without LLM assistance",
                        "Please review and enhance with specific implementation details"),
                FALLBACK_CONFIDENCE);
    }

    private static Map<String, Object> test(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
