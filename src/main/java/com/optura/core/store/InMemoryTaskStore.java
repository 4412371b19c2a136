package com.optura.core.store;

import com.optura.core.model.Project;
import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory {@link TaskStore}.
 * <p>
 * Writes take the write lock so that a {@link #snapshot} read under the read lock
 * never sees an edge without its tasks.
 */
@Repository
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private static final Comparator<Task> BY_ORDER =
            Comparator.comparingInt(Task::order).thenComparing(Task::id);

    private final ConcurrentHashMap<Long, Project> projects = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Task> tasks = new ConcurrentHashMap<>();
    private final Set<TaskDependency> dependencies = new LinkedHashSet<>();

    private final AtomicLong projectSequence = new AtomicLong();
    private final AtomicLong taskSequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<Project> findProject(long projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public List<Project> listProjects() {
        return projects.values().stream()
                .sorted(Comparator.comparing(Project::id))
                .toList();
    }

    @Override
    public Project saveProject(Project project) {
        Project stored = project.id() == null
                ? project.withId(projectSequence.incrementAndGet())
                : project;
        projects.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Task> findTask(long taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> listTasks(long projectId) {
        lock.readLock().lock();
        try {
            return tasksOf(projectId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TaskDependency> listDependencies(long projectId) {
        lock.readLock().lock();
        try {
            return dependenciesOf(projectId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ProjectSnapshot snapshot(long projectId) {
        lock.readLock().lock();
        try {
            return new ProjectSnapshot(projectId, tasksOf(projectId), dependenciesOf(projectId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Task saveTask(Task task) {
        lock.writeLock().lock();
        try {
            if (task.id() == null) {
                Task inserted = task.withId(taskSequence.incrementAndGet()).withVersion(1L);
                tasks.put(inserted.id(), inserted);
                return inserted;
            }
            Task current = tasks.get(task.id());
            if (current == null) {
                throw new TaskNotFoundException(task.id());
            }
            if (current.version() != task.version()) {
                throw new StaleTaskException(task.id(), task.version(), current.version());
            }
            Task updated = task.withVersion(task.version() + 1);
            tasks.put(updated.id(), updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean saveDependency(TaskDependency dependency) {
        lock.writeLock().lock();
        try {
            if (!tasks.containsKey(dependency.taskId()) || !tasks.containsKey(dependency.dependsOnTaskId())) {
                throw new TaskNotFoundException(tasks.containsKey(dependency.taskId())
                        ? dependency.dependsOnTaskId() : dependency.taskId());
            }
            return dependencies.add(dependency);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean deleteTask(long taskId) {
        lock.writeLock().lock();
        try {
            if (tasks.remove(taskId) == null) {
                return false;
            }
            int before = dependencies.size();
            dependencies.removeIf(d -> d.taskId() == taskId || d.dependsOnTaskId() == taskId);
            log.debug("Deleted task {} and {} dependency edge(s)", taskId, before - dependencies.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<Task> tasksOf(long projectId) {
        return tasks.values().stream()
                .filter(t -> t.projectId() == projectId)
                .sorted(BY_ORDER)
                .toList();
    }

    private List<TaskDependency> dependenciesOf(long projectId) {
        var result = new ArrayList<TaskDependency>();
        for (TaskDependency dep : dependencies) {
            Task dependent = tasks.get(dep.taskId());
            if (dependent != null && dependent.projectId() == projectId) {
                result.add(dep);
            }
        }
        return result;
    }
}
