package com.optura.core.engine;

import com.optura.core.advisor.TaskAdvisor;
import com.optura.core.events.EventBus;
import com.optura.core.events.OpturaEvent;
import com.optura.core.logging.MdcContext;
import com.optura.core.model.PlanSummary;
import com.optura.core.model.Project;
import com.optura.core.model.ProjectBrief;
import com.optura.core.model.ProjectStatus;
import com.optura.core.model.RiskLevel;
import com.optura.core.model.Task;
import com.optura.core.model.TaskPlan;
import com.optura.core.model.TaskProposal;
import com.optura.core.store.ProjectNotFoundException;
import com.optura.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Project creation and plan bootstrap.
 * <p>
 * A generated plan is applied as ordinary task creation: tasks first, then each
 * proposal's dependency indices are resolved to the ids of the created tasks.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final TaskStore store;
    private final TaskAdvisor advisor;
    private final TaskActionService taskActions;
    private final EventBus eventBus;

    public ProjectService(TaskStore store, TaskAdvisor advisor, TaskActionService taskActions, EventBus eventBus) {
        this.store = store;
        this.advisor = advisor;
        this.taskActions = taskActions;
        this.eventBus = eventBus;
    }

    public Project createProject(Project draft) {
        String creator = draft.createdBy() != null && !draft.createdBy().isBlank() ? draft.createdBy() : "system";
        Project created = store.saveProject(new Project(null, draft.name(), draft.description(), draft.goal(),
                draft.acceptanceCriteria() != null ? draft.acceptanceCriteria() : List.of(),
                draft.environment(),
                draft.riskLevel() != null ? draft.riskLevel() : RiskLevel.LOW,
                ProjectStatus.DRAFT,
                creator));
        log.info("Created project {} '{}'", created.id(), created.name());
        eventBus.publish(OpturaEvent.of("project.created", created.id(), null, creator,
                Map.of("name", String.valueOf(created.name()), "goal", String.valueOf(created.goal()))));
        return created;
    }

    public Project getProject(long projectId) {
        return store.findProject(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    public List<Project> listProjects() {
        return store.listProjects();
    }

    /**
     * Asks the advisor for a plan and materialises it. Unknown or self-referencing
     * dependency indices are skipped; the project moves to {@link ProjectStatus#PLANNING}.
     */
    public PlanSummary generatePlan(long projectId) {
        MdcContext.setProject(projectId);
        MdcContext.setAction("generate_plan");
        try {
            Project project = getProject(projectId);
            TaskPlan plan = advisor.generatePlan(ProjectBrief.of(project));
            List<TaskProposal> proposals = plan.tasks() != null ? plan.tasks() : List.of();

            Map<Integer, Long> taskIdByIndex = new HashMap<>();
            List<Long> taskIds = new ArrayList<>();
            for (int idx = 0; idx < proposals.size(); idx++) {
                TaskProposal proposal = proposals.get(idx);
                Task created = taskActions.createTask(Task.newTask(projectId,
                        proposal.name(),
                        proposal.description(),
                        proposal.inputs(),
                        proposal.outputs(),
                        proposal.tests(),
                        proposal.estimateHours(),
                        proposal.requiresApproval(),
                        proposal.order() != null ? proposal.order() : idx,
                        null,
                        proposal.confidenceScore()));
                taskIdByIndex.put(idx, created.id());
                taskIds.add(created.id());
            }

            int dependencyCount = 0;
            for (int idx = 0; idx < proposals.size(); idx++) {
                List<Integer> dependencies = proposals.get(idx).dependencies();
                if (dependencies == null) continue;
                for (Integer depIdx : dependencies) {
                    if (depIdx == null || depIdx == idx || !taskIdByIndex.containsKey(depIdx)) {
                        log.warn("Skipping unresolvable dependency index {} of planned task {}", depIdx, idx);
                        continue;
                    }
                    try {
                        taskActions.addDependency(taskIdByIndex.get(idx), taskIdByIndex.get(depIdx));
                        dependencyCount++;
                    } catch (InvalidDependencyException e) {
                        log.warn("Skipping planned dependency {} -> {}: {}", idx, depIdx, e.getMessage());
                    }
                }
            }

            RiskLevel riskLevel = plan.riskLevel() != null ? plan.riskLevel() : RiskLevel.MEDIUM;
            store.saveProject(project.withPlanning(riskLevel));

            double estimatedTotal = plan.estimatedTotalHours() != null ? plan.estimatedTotalHours() : 0.0;
            log.info("Applied plan to project {}: {} tasks, {} dependencies, risk {}",
                    projectId, taskIds.size(), dependencyCount, riskLevel);
            eventBus.publish(OpturaEvent.of("plan.generated", projectId, null, "planner_agent",
                    Map.of("task_count", taskIds.size(), "estimated_total_hours", estimatedTotal)));
            return new PlanSummary(projectId, taskIds.size(), taskIds, dependencyCount, estimatedTotal, riskLevel);
        } finally {
            MdcContext.clear();
        }
    }
}
