package com.optura.core.advisor;

import com.optura.core.model.ProjectBrief;
import com.optura.core.model.Task;
import com.optura.core.model.TaskPlan;
import com.optura.core.model.TaskSpecification;

/**
 * Produces task plans and task specifications.
 * <p>
 * Implementations always return a structurally valid result; callers never learn
 * whether it came from a model or from the deterministic fallback.
 */
public interface TaskAdvisor {

    TaskPlan generatePlan(ProjectBrief brief);

    TaskSpecification generateSpec(Task task, String projectContext);
}
