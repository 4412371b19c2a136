package com.optura.core.scheduler;

import com.optura.core.graph.DependencyGraph;
import com.optura.core.model.BlockedTask;
import com.optura.core.model.NextActions;
import com.optura.core.model.TaskRef;
import com.optura.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a project's open tasks into actionable, needs-approval and blocked.
 * <p>
 * Tasks that are {@link TaskStatus#COMPLETED}, {@link TaskStatus#FAILED} or already
 * {@link TaskStatus#IN_PROGRESS} are not offered again. A task is ready when every
 * prerequisite is COMPLETED; a ready task in REVIEW that requires approval waits
 * for sign-off instead of being actionable.
 */
@Service
public class ReadinessClassifier {

    private static final Logger log = LoggerFactory.getLogger(ReadinessClassifier.class);

    public NextActions classify(DependencyGraph graph) {
        var actionable = new ArrayList<TaskRef>();
        var needsApproval = new ArrayList<TaskRef>();
        var blocked = new ArrayList<BlockedTask>();

        for (int i = 0; i < graph.size(); i++) {
            var node = graph.node(i);
            if (!isOpen(node.status())) {
                log.debug("  {} [{}] — not offered ({})", node.taskId(), node.name(), node.status());
                continue;
            }

            List<String> unmet = unmetPrerequisites(graph, i);
            if (!unmet.isEmpty()) {
                log.debug("  {} [{}] — blocked by {}", node.taskId(), node.name(), unmet);
                blocked.add(new BlockedTask(node.taskId(), node.name(), unmet));
                continue;
            }

            var ref = new TaskRef(node.taskId(), node.name(), node.estimateHours(), node.status());
            if (node.status() == TaskStatus.REVIEW && node.requiresApproval()) {
                needsApproval.add(ref);
            } else {
                actionable.add(ref);
            }
        }

        log.info("Readiness for project {}: {} actionable, {} awaiting approval, {} blocked",
                graph.projectId(), actionable.size(), needsApproval.size(), blocked.size());
        return new NextActions(graph.projectId(), actionable, needsApproval, blocked);
    }

    private boolean isOpen(TaskStatus status) {
        return switch (status) {
            case PENDING, BLOCKED, REVIEW, APPROVED -> true;
            case IN_PROGRESS, COMPLETED, FAILED -> false;
        };
    }

    private List<String> unmetPrerequisites(DependencyGraph graph, int index) {
        var unmet = new ArrayList<String>();
        for (int prerequisite : graph.predecessors(index)) {
            var node = graph.node(prerequisite);
            if (node.status() != TaskStatus.COMPLETED) {
                unmet.add(node.name());
            }
        }
        return unmet;
    }
}
