package com.optura.dispatch.api;

import com.optura.core.engine.ProjectService;
import com.optura.core.engine.TaskActionService;
import com.optura.core.model.PlanSummary;
import com.optura.core.model.Project;
import com.optura.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for projects and plan bootstrap.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectService projectService;
    private final TaskActionService taskActions;

    public ProjectController(ProjectService projectService, TaskActionService taskActions) {
        this.projectService = projectService;
        this.taskActions = taskActions;
    }

    @PostMapping
    public ResponseEntity<Project> createProject(@RequestBody ProjectRequest request) {
        Project created = projectService.createProject(request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<Project> listProjects() {
        return projectService.listProjects();
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<Project> getProject(@PathVariable long projectId) {
        return ResponseEntity.ok(projectService.getProject(projectId));
    }

    @GetMapping("/{projectId}/tasks")
    public List<Task> listTasks(@PathVariable long projectId) {
        return taskActions.listTasks(projectId);
    }

    /**
     * POST /api/v1/projects/{id}/generate-plan: synchronous, falls back to the
     * deterministic plan when no model is configured.
     */
    @PostMapping("/{projectId}/generate-plan")
    public ResponseEntity<PlanSummary> generatePlan(@PathVariable long projectId) {
        log.info("Plan generation requested for project {}", projectId);
        return ResponseEntity.ok(projectService.generatePlan(projectId));
    }
}
