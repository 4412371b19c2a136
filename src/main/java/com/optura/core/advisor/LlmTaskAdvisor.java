package com.optura.core.advisor;

import com.optura.core.llm.LlmService;
import com.optura.core.metrics.OpturaMetrics;
import com.optura.core.model.ProjectBrief;
import com.optura.core.model.Task;
import com.optura.core.model.TaskPlan;
import com.optura.core.model.TaskSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * Model-backed advisor. Any failure of the model call, and any answer missing a
 * required field, is answered by the wrapped {@link FallbackTaskAdvisor} instead.
 */
public class LlmTaskAdvisor implements TaskAdvisor {

    private static final Logger log = LoggerFactory.getLogger(LlmTaskAdvisor.class);

    private static final String PLANNER_SYSTEM_PROMPT =
            "You are an expert AI development planner. Break down high-level project goals into " +
            "concrete, testable tasks with clear dependencies.\n\n" +
            "1. Break work into small, atomic tasks (1-4 hours each)\n" +
            "2. Define clear inputs, outputs, and test criteria for each task\n" +
            "3. Identify task dependencies as indices into the task list to enable parallel work\n" +
            "4. Flag risky tasks that require human approval\n" +
            "5. Assign confidence scores (0.0-1.0) based on clarity and feasibility\n" +
            "6. Set risk_level to one of low, medium, high, critical\n\n" +
            "Dependencies must not form a cycle.";

    private static final String SPEC_SYSTEM_PROMPT =
            "You are an expert at creating detailed, machine-readable specifications for development tasks.\n\n" +
            "Specifications must be precise and unambiguous, list all required inputs and expected outputs, " +
            "define test cases with expected results, cover edge cases and error conditions, and state " +
            "security requirements and validation rules.";

    private final LlmService llmService;
    private final FallbackTaskAdvisor fallback;
    private final OpturaMetrics metrics;

    public LlmTaskAdvisor(LlmService llmService, FallbackTaskAdvisor fallback, OpturaMetrics metrics) {
        this.llmService = llmService;
        this.fallback = fallback;
        this.metrics = metrics;
    }

    @Override
    public TaskPlan generatePlan(ProjectBrief brief) {
        String criteria = brief.acceptanceCriteria().isEmpty()
                ? "N/A"
                : brief.acceptanceCriteria().stream().map(c -> "- " + c).collect(Collectors.joining("\n"));
        String userPrompt = "Project: " + brief.projectName() + "\n\n" +
                "Goal: " + brief.goal() + "\n\n" +
                "Description: " + brief.description() + "\n\n" +
                "Acceptance Criteria:\n" + criteria + "\n\n" +
                "Environment: " + (brief.environment().isBlank() ? "Not specified" : brief.environment()) + "\n\n" +
                "Create a detailed task breakdown for this project.";
        try {
            TaskPlan plan = llmService.structuredCall(PLANNER_SYSTEM_PROMPT, userPrompt, TaskPlan.class);
            if (!isValid(plan)) {
                log.warn("Invalid plan structure from model for project '{}', using fallback", brief.projectName());
                return fallbackPlan(brief);
            }
            return plan;
        } catch (Exception e) {
            log.error("Plan generation failed for project '{}': {}, using fallback", brief.projectName(), e.getMessage());
            return fallbackPlan(brief);
        }
    }

    @Override
    public TaskSpecification generateSpec(Task task, String projectContext) {
        String userPrompt = "Task: " + task.name() + "\n\n" +
                "Description: " + task.description() + "\n\n" +
                "Project Context:\n" + projectContext + "\n\n" +
                "Inputs: " + task.inputs() + "\n" +
                "Outputs: " + task.outputs() + "\n" +
                "Tests: " + task.tests() + "\n\n" +
                "Create a detailed, machine-readable specification for this task.";
        try {
            TaskSpecification spec = llmService.structuredCall(SPEC_SYSTEM_PROMPT, userPrompt, TaskSpecification.class);
            if (!isValid(spec)) {
                log.warn("Invalid spec structure from model for task {}, using fallback", task.id());
                return fallbackSpec(task, projectContext);
            }
            return spec;
        } catch (Exception e) {
            log.error("Spec generation failed for task {}: {}, using fallback", task.id(), e.getMessage());
            return fallbackSpec(task, projectContext);
        }
    }

    /** Required: tasks, risk_level, and a name on every task. */
    static boolean isValid(TaskPlan plan) {
        return plan != null && plan.tasks() != null && plan.riskLevel() != null
                && plan.tasks().stream().allMatch(t -> t != null && t.name() != null && !t.name().isBlank());
    }

    /** Required: task_name, objective, inputs, outputs, test_cases. */
    static boolean isValid(TaskSpecification spec) {
        return spec != null
                && spec.taskName() != null
                && spec.objective() != null
                && spec.inputs() != null
                && spec.outputs() != null
                && spec.testCases() != null;
    }

    private TaskPlan fallbackPlan(ProjectBrief brief) {
        metrics.recordAdvisorFallback("plan");
        return fallback.generatePlan(brief);
    }

    private TaskSpecification fallbackSpec(Task task, String projectContext) {
        metrics.recordAdvisorFallback("spec");
        return fallback.generateSpec(task, projectContext);
    }
}
