package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single unit of work within a project.
 *
 * @param id               store-assigned identifier; {@code null} before the first save
 * @param projectId        owning project
 * @param name             short display name
 * @param description      what the task should accomplish
 * @param inputs           named inputs the task consumes
 * @param outputs          named outputs the task produces
 * @param tests            test descriptors ({@code type}, {@code description})
 * @param estimateHours    estimated effort; {@code null} means unestimated
 * @param status           current lifecycle status
 * @param requiresApproval whether completion needs a prior human approval
 * @param approvedBy       approver identity, set by the approve transition
 * @param approvedAt       approval timestamp, set by the approve transition
 * @param rejectionReason  reason given by the last rejection
 * @param order            display order, also used for tie-breaking
 * @param spec             machine-readable specification; required before approval
 * @param testResults      latest test report; its {@code status} field gates completion
 * @param confidenceScore  advisor confidence in the current spec
 * @param version          optimistic-concurrency version managed by the store
 */
public record Task(
    Long id,
    @JsonProperty("project_id") long projectId,
    String name,
    String description,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    List<Map<String, Object>> tests,
    @JsonProperty("estimate_hours") Double estimateHours,
    TaskStatus status,
    @JsonProperty("requires_approval") boolean requiresApproval,
    @JsonProperty("approved_by") String approvedBy,
    @JsonProperty("approved_at") Instant approvedAt,
    @JsonProperty("rejection_reason") String rejectionReason,
    int order,
    Map<String, Object> spec,
    @JsonProperty("test_results") Map<String, Object> testResults,
    @JsonProperty("confidence_score") Double confidenceScore,
    long version
) {

    public Task {
        inputs = copyOf(inputs);
        outputs = copyOf(outputs);
        if (tests != null) {
            List<Map<String, Object>> copied = new ArrayList<>(tests.size());
            for (Map<String, Object> test : tests) {
                copied.add(copyOf(test));
            }
            tests = Collections.unmodifiableList(copied);
        }
        spec = copyOf(spec);
        testResults = copyOf(testResults);
    }

    // JSON documents may carry null values, which Map.copyOf rejects.
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * A fresh {@link TaskStatus#PENDING} task that has not been stored yet.
     */
    public static Task newTask(long projectId, String name, String description,
                               Map<String, Object> inputs, Map<String, Object> outputs,
                               List<Map<String, Object>> tests, Double estimateHours,
                               boolean requiresApproval, int order, Map<String, Object> spec,
                               Double confidenceScore) {
        return new Task(null, projectId, name, description,
                inputs != null ? inputs : Map.of(),
                outputs != null ? outputs : Map.of(),
                tests != null ? tests : List.of(),
                estimateHours, TaskStatus.PENDING, requiresApproval,
                null, null, null, order, spec, null, confidenceScore, 0L);
    }

    public boolean hasSpec() {
        return spec != null && !spec.isEmpty();
    }

    public boolean hasTestResults() {
        return testResults != null && !testResults.isEmpty();
    }

    public Task withId(Long newId) {
        return new Task(newId, projectId, name, description, inputs, outputs, tests, estimateHours,
                status, requiresApproval, approvedBy, approvedAt, rejectionReason, order, spec,
                testResults, confidenceScore, version);
    }

    public Task withVersion(long newVersion) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                status, requiresApproval, approvedBy, approvedAt, rejectionReason, order, spec,
                testResults, confidenceScore, newVersion);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                newStatus, requiresApproval, approvedBy, approvedAt, rejectionReason, order, spec,
                testResults, confidenceScore, version);
    }

    public Task withOrder(int newOrder) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                status, requiresApproval, approvedBy, approvedAt, rejectionReason, newOrder, spec,
                testResults, confidenceScore, version);
    }

    public Task withSpec(Map<String, Object> newSpec, Double newConfidenceScore) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                status, requiresApproval, approvedBy, approvedAt, rejectionReason, order, newSpec,
                testResults, newConfidenceScore, version);
    }

    public Task withTestResults(Map<String, Object> newTestResults) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                status, requiresApproval, approvedBy, approvedAt, rejectionReason, order, spec,
                newTestResults, confidenceScore, version);
    }

    public Task withApproval(String approver, Instant at) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                TaskStatus.APPROVED, requiresApproval, approver, at, null, order, spec,
                testResults, confidenceScore, version);
    }

    public Task withRejection(String reason) {
        return new Task(id, projectId, name, description, inputs, outputs, tests, estimateHours,
                TaskStatus.PENDING, requiresApproval, null, null, reason, order, spec,
                testResults, confidenceScore, version);
    }
}
