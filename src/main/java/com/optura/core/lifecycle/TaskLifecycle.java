package com.optura.core.lifecycle;

import com.optura.core.model.Task;
import com.optura.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Gated state machine for a single task.
 * <p>
 * Each method checks its gates against the given snapshot and returns the next
 * snapshot; persisting it is the caller's job. Gates:
 * <ul>
 *   <li>approve: the task has a non-empty spec</li>
 *   <li>reject: none</li>
 *   <li>complete: test results present, their status is not {@code "failed"}, and
 *       tasks that require approval are already {@link TaskStatus#APPROVED}</li>
 * </ul>
 * REVIEW and BLOCKED are never entered from here.
 */
@Service
public class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);

    static final String FAILED_TEST_STATUS = "failed";

    private final Clock clock;

    public TaskLifecycle(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws GateViolationException with {@link Gate#SPEC_MISSING} when the spec is absent or empty
     */
    public Task approve(Task task, String approverId) {
        if (!task.hasSpec()) {
            throw violation(Gate.SPEC_MISSING, task);
        }
        Instant now = clock.instant();
        log.info("Task {} approved by {} ({} → APPROVED)", task.id(), approverId, task.status());
        return task.withApproval(approverId, now);
    }

    public Task reject(Task task, String rejectorId, String reason) {
        log.info("Task {} rejected by {} ({} → PENDING): {}", task.id(), rejectorId, task.status(), reason);
        return task.withRejection(reason);
    }

    /**
     * @throws GateViolationException with {@link Gate#TEST_RESULTS_MISSING}, {@link Gate#TESTS_FAILED}
     *                                or {@link Gate#APPROVAL_REQUIRED}, checked in that order
     */
    public Task complete(Task task) {
        if (!task.hasTestResults()) {
            throw violation(Gate.TEST_RESULTS_MISSING, task);
        }
        if (FAILED_TEST_STATUS.equals(task.testResults().get("status"))) {
            throw violation(Gate.TESTS_FAILED, task);
        }
        if (task.requiresApproval() && task.status() != TaskStatus.APPROVED) {
            throw violation(Gate.APPROVAL_REQUIRED, task);
        }
        log.info("Task {} completed ({} → COMPLETED)", task.id(), task.status());
        return task.withStatus(TaskStatus.COMPLETED);
    }

    private GateViolationException violation(Gate gate, Task task) {
        log.info("Gate {} blocked transition for task {} (status {})", gate, task.id(), task.status());
        return new GateViolationException(gate, task.id() != null ? task.id() : -1L);
    }
}
