package com.optura.core.store;

import com.optura.core.model.Project;
import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;

import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator for projects, tasks and dependency edges.
 * <p>
 * Implementations must make {@link #snapshot} consistent: no edge may reference a
 * task missing from the returned task list. Failures of the underlying storage
 * propagate to callers unchanged.
 */
public interface TaskStore {

    Optional<Project> findProject(long projectId);

    List<Project> listProjects();

    /** Inserts when {@code project.id()} is null, otherwise replaces. */
    Project saveProject(Project project);

    Optional<Task> findTask(long taskId);

    /** Tasks of the project ordered by {@code order}, then id. */
    List<Task> listTasks(long projectId);

    /** Edges whose dependent task belongs to the project. */
    List<TaskDependency> listDependencies(long projectId);

    default ProjectSnapshot snapshot(long projectId) {
        return new ProjectSnapshot(projectId, listTasks(projectId), listDependencies(projectId));
    }

    /**
     * Inserts when {@code task.id()} is null; otherwise a compare-and-set on
     * {@link Task#version()}.
     *
     * @return the stored task with its new version
     * @throws StaleTaskException    if the stored version differs from the given one
     * @throws TaskNotFoundException if the task was deleted
     */
    Task saveTask(Task task);

    /**
     * @return {@code false} when the edge already existed
     */
    boolean saveDependency(TaskDependency dependency);

    /**
     * Removes the task and every edge that touches it.
     *
     * @return {@code false} when no such task existed
     */
    boolean deleteTask(long taskId);
}
