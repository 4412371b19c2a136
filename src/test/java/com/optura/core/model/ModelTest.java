package com.optura.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("Only COMPLETED and FAILED are terminal")
    void terminalStatuses() {
        assertEquals(List.of(TaskStatus.COMPLETED, TaskStatus.FAILED),
                Arrays.stream(TaskStatus.values()).filter(TaskStatus::isTerminal).toList());
    }

    @Test
    @DisplayName("Risk level parsing is lenient")
    void riskLevelParsing() {
        assertEquals(RiskLevel.HIGH, RiskLevel.fromString("high"));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromString(" Critical "));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromString("extreme"));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromString(null));
    }

    @Test
    @DisplayName("New tasks are PENDING with empty collections")
    void newTaskDefaults() {
        Task task = Task.newTask(1L, "A", "", null, null, null, null, false, 0, null, null);

        assertNull(task.id());
        assertEquals(TaskStatus.PENDING, task.status());
        assertTrue(task.inputs().isEmpty());
        assertTrue(task.tests().isEmpty());
        assertFalse(task.hasSpec());
        assertFalse(task.hasTestResults());
    }

    @Test
    @DisplayName("Partial update only touches the given fields and keeps approval data")
    void partialUpdate() {
        Task task = Task.newTask(1L, "A", "desc", null, null, null, 1.0, true, 2, null, null)
                .withId(3L).withApproval("alice", java.time.Instant.EPOCH).withVersion(4L);

        Task updated = new TaskUpdate("B", null, null, null, null, null, null, null, null, null,
                Map.of("status", "passed"), null).applyTo(task);

        assertEquals("B", updated.name());
        assertEquals("desc", updated.description());
        assertEquals(2, updated.order());
        assertEquals("alice", updated.approvedBy());
        assertEquals(TaskStatus.APPROVED, updated.status());
        assertEquals(4L, updated.version());
        assertTrue(updated.hasTestResults());
    }

    @Test
    @DisplayName("Critical path result serialises with snake_case and omits a null error")
    void criticalPathJson() throws Exception {
        var mapper = new ObjectMapper();
        String json = mapper.writeValueAsString(new CriticalPathResult(7L,
                List.of(new TaskRef(1L, "A", 2.0, TaskStatus.PENDING)), 2.0, null));

        assertTrue(json.contains("\"critical_path\""));
        assertTrue(json.contains("\"total_hours\":2.0"));
        assertFalse(json.contains("error"));
        assertTrue(mapper.writeValueAsString(CriticalPathResult.circular(7L)).contains("\"error\":\"circular_dependency\""));
    }

    @Test
    @DisplayName("Project brief tolerates missing criteria and environment")
    void projectBrief() {
        var brief = ProjectBrief.of(new Project(1L, "Shop", null, "Sell", null, null,
                RiskLevel.LOW, ProjectStatus.DRAFT, "system"));

        assertEquals(List.of(), brief.acceptanceCriteria());
        assertEquals("", brief.environment());
    }
}
