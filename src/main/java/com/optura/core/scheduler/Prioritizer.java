package com.optura.core.scheduler;

import com.optura.core.model.PriorityChange;
import com.optura.core.model.Task;
import com.optura.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reorders a project's tasks so that work already in flight comes first.
 * <p>
 * Tasks are ranked by status; within a rank the existing order is kept. The
 * result only lists tasks whose position actually moves, so running it twice
 * in a row yields no changes the second time.
 */
@Service
public class Prioritizer {

    private static final Logger log = LoggerFactory.getLogger(Prioritizer.class);

    private static final Comparator<Task> CURRENT_ORDER =
            Comparator.comparingInt(Task::order).thenComparing(Task::id);

    /**
     * Compute the order changes for the given tasks. Does not mutate anything.
     *
     * @param tasks all tasks of one project
     * @return changes needed to realise the new order; empty when already ordered
     */
    public List<PriorityChange> reprioritize(List<Task> tasks) {
        var sorted = new ArrayList<>(tasks);
        sorted.sort(CURRENT_ORDER);
        // List.sort is stable, so equal ranks keep the order established above
        sorted.sort(Comparator.comparingInt(task -> rank(task.status())));

        var changes = new ArrayList<PriorityChange>();
        for (int newOrder = 0; newOrder < sorted.size(); newOrder++) {
            Task task = sorted.get(newOrder);
            if (task.order() != newOrder) {
                changes.add(new PriorityChange(task.id(), task.name(), task.order(), newOrder));
            }
        }

        log.info("Reprioritized {} tasks: {} order change(s)", tasks.size(), changes.size());
        return changes;
    }

    static int rank(TaskStatus status) {
        return switch (status) {
            case IN_PROGRESS -> 0;
            case REVIEW -> 1;
            case APPROVED -> 2;
            case PENDING -> 3;
            case BLOCKED -> 4;
            case COMPLETED -> 5;
            case FAILED -> 6;
        };
    }
}
