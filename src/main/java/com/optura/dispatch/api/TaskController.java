package com.optura.dispatch.api;

import com.optura.core.engine.TaskActionService;
import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;
import com.optura.core.model.TaskUpdate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for task CRUD, lifecycle transitions and dependencies.
 * Gate violations surface as 400 through {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskActionService taskActions;

    public TaskController(TaskActionService taskActions) {
        this.taskActions = taskActions;
    }

    @PostMapping
    public ResponseEntity<Task> createTask(@RequestBody TaskRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskActions.createTask(request.toDraft()));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<Task> getTask(@PathVariable long taskId) {
        return ResponseEntity.ok(taskActions.getTask(taskId));
    }

    @PatchMapping("/{taskId}")
    public ResponseEntity<Task> updateTask(@PathVariable long taskId, @RequestBody TaskUpdate update) {
        return ResponseEntity.ok(taskActions.updateTask(taskId, update));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable long taskId) {
        taskActions.deleteTask(taskId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{taskId}/approve")
    public ResponseEntity<Task> approve(@PathVariable long taskId, @RequestBody ApprovalRequest request) {
        return ResponseEntity.ok(taskActions.approve(taskId, request.approvedBy()));
    }

    @PostMapping("/{taskId}/reject")
    public ResponseEntity<Task> reject(@PathVariable long taskId, @RequestBody RejectionRequest request) {
        return ResponseEntity.ok(taskActions.reject(taskId, request.rejectedBy(), request.rejectionReason()));
    }

    @PostMapping("/{taskId}/complete")
    public ResponseEntity<Task> complete(@PathVariable long taskId) {
        return ResponseEntity.ok(taskActions.complete(taskId));
    }

    @PostMapping("/{taskId}/generate-spec")
    public ResponseEntity<Task> generateSpec(@PathVariable long taskId) {
        return ResponseEntity.ok(taskActions.generateSpec(taskId));
    }

    @PostMapping("/dependencies")
    public ResponseEntity<TaskDependency> addDependency(@RequestBody DependencyRequest request) {
        if (request.taskId() == null || request.dependsOnTaskId() == null) {
            throw new IllegalArgumentException("task_id and depends_on_task_id are required");
        }
        TaskDependency created = taskActions.addDependency(request.taskId(), request.dependsOnTaskId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
