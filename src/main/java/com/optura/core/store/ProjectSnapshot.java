package com.optura.core.store;

import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;

import java.util.List;

/**
 * Tasks and dependency edges of one project read as a single consistent view.
 */
public record ProjectSnapshot(long projectId, List<Task> tasks, List<TaskDependency> dependencies) {}
