package com.optura.dispatch.api;

import com.optura.core.engine.OrchestrationService;
import com.optura.core.model.CriticalPathResult;
import com.optura.core.model.DependencyGraphView;
import com.optura.core.model.NextActions;
import com.optura.core.model.ReprioritizeResult;
import com.optura.core.model.StatusSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for project-level orchestration views.
 */
@RestController
@RequestMapping("/api/v1/orchestrator/projects/{projectId}")
public class OrchestratorController {

    private final OrchestrationService orchestrationService;

    public OrchestratorController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    /**
     * GET .../critical-path: a cycle is reported in the body, not as an error status.
     */
    @GetMapping("/critical-path")
    public ResponseEntity<CriticalPathResult> criticalPath(@PathVariable long projectId) {
        return ResponseEntity.ok(orchestrationService.criticalPath(projectId));
    }

    @GetMapping("/dependency-graph")
    public ResponseEntity<DependencyGraphView> dependencyGraph(@PathVariable long projectId) {
        return ResponseEntity.ok(orchestrationService.dependencyGraph(projectId));
    }

    @GetMapping("/next-actions")
    public ResponseEntity<NextActions> nextActions(@PathVariable long projectId) {
        return ResponseEntity.ok(orchestrationService.nextActions(projectId));
    }

    @GetMapping("/status-summary")
    public ResponseEntity<StatusSummary> statusSummary(@PathVariable long projectId) {
        return ResponseEntity.ok(orchestrationService.statusSummary(projectId));
    }

    @PostMapping("/reprioritize")
    public ResponseEntity<ReprioritizeResult> reprioritize(@PathVariable long projectId) {
        return ResponseEntity.ok(orchestrationService.reprioritize(projectId));
    }
}
