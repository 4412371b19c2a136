package com.optura.core.advisor;

import com.optura.core.model.ProjectBrief;
import com.optura.core.model.RiskLevel;
import com.optura.core.model.Task;
import com.optura.core.model.TaskProposal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FallbackTaskAdvisorTest {

    private final FallbackTaskAdvisor advisor = new FallbackTaskAdvisor();

    @Test
    @DisplayName("Plan is a research, implementation, testing chain totalling 8h")
    void plan() {
        var plan = advisor.generatePlan(new ProjectBrief("Shop", "Sell things", null, List.of(), ""));

        assertEquals(List.of("Research and Requirements", "Implementation", "Testing and Validation"),
                plan.tasks().stream().map(TaskProposal::name).toList());
        assertEquals(List.of(List.of(), List.of(0), List.of(1)),
                plan.tasks().stream().map(TaskProposal::dependencies).toList());
        assertEquals(List.of(true, false, true),
                plan.tasks().stream().map(TaskProposal::requiresApproval).toList());
        assertEquals(RiskLevel.MEDIUM, plan.riskLevel());
        assertEquals(8.0, plan.estimatedTotalHours());
        assertEquals(8.0, plan.tasks().stream().mapToDouble(TaskProposal::estimateHours).sum());
        assertTrue(plan.tasks().get(0).description().contains("Sell things"));
    }

    @Test
    @DisplayName("Spec is derived from the task's inputs, outputs and tests")
    void spec() {
        Task task = Task.newTask(1L, "Checkout", "Take payment",
                Map.of("cart", "Cart contents"), Map.of("receipt", "Order receipt"),
                List.of(Map.of("type", "integration", "description", "Charges the card")),
                2.0, true, 0, null, null);

        var spec = advisor.generateSpec(task, "Project ID: 1");

        assertEquals("Checkout", spec.taskName());
        assertEquals("Take payment", spec.objective());
        assertTrue(spec.inputs().containsKey("cart"));
        assertTrue(spec.outputs().containsKey("receipt"));
        assertEquals(1, spec.testCases().size());
        assertEquals("integration", spec.testCases().get(0).get("type"));
        assertEquals("Charges the card", spec.testCases().get(0).get("expected_behavior"));
        assertEquals(FallbackTaskAdvisor.FALLBACK_CONFIDENCE, spec.confidenceScore());
        assertTrue(LlmTaskAdvisor.isValid(spec));
    }
}
