package com.optura.dispatch.api;

import com.optura.core.engine.ProjectService;
import com.optura.core.engine.TaskActionService;
import com.optura.core.model.PlanSummary;
import com.optura.core.model.Project;
import com.optura.core.model.ProjectStatus;
import com.optura.core.model.RiskLevel;
import com.optura.core.model.Task;
import com.optura.core.store.ProjectNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProjectController.class)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectService projectService;

    @MockitoBean
    private TaskActionService taskActions;

    private static Project project(long id) {
        return new Project(id, "Shop", "Online store", "Sell things", List.of("Orders can be placed"),
                null, RiskLevel.LOW, ProjectStatus.DRAFT, "system");
    }

    @Test
    @DisplayName("POST /projects returns 201 with the created project")
    void createProject() throws Exception {
        when(projectService.createProject(any(Project.class))).thenReturn(project(1L));

        mockMvc.perform(post("/api/v1/projects").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Shop\",\"goal\":\"Sell things\",\"acceptance_criteria\":[\"Orders can be placed\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.acceptance_criteria[0]").value("Orders can be placed"));

        ArgumentCaptor<Project> captor = ArgumentCaptor.forClass(Project.class);
        verify(projectService).createProject(captor.capture());
        assertEquals("Sell things", captor.getValue().goal());
    }

    @Test
    @DisplayName("POST /projects without a name returns 400")
    void createWithoutName() throws Exception {
        mockMvc.perform(post("/api/v1/projects").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    @DisplayName("GET /projects lists projects")
    void listProjects() throws Exception {
        when(projectService.listProjects()).thenReturn(List.of(project(1L), project(2L)));

        mockMvc.perform(get("/api/v1/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    @DisplayName("GET unknown project returns 404")
    void unknownProject() throws Exception {
        when(projectService.getProject(9L)).thenThrow(new ProjectNotFoundException(9L));

        mockMvc.perform(get("/api/v1/projects/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /projects/{id}/tasks lists the project's tasks")
    void listTasks() throws Exception {
        when(taskActions.listTasks(1L)).thenReturn(List.of(
                Task.newTask(1L, "A", "", null, null, null, 1.0, false, 0, null, null).withId(3L)));

        mockMvc.perform(get("/api/v1/projects/1/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(3));
    }

    @Test
    @DisplayName("POST generate-plan returns the plan summary")
    void generatePlan() throws Exception {
        when(projectService.generatePlan(1L))
                .thenReturn(new PlanSummary(1L, 3, List.of(1L, 2L, 3L), 2, 8.0, RiskLevel.MEDIUM));

        mockMvc.perform(post("/api/v1/projects/1/generate-plan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_count").value(3))
                .andExpect(jsonPath("$.dependency_count").value(2))
                .andExpect(jsonPath("$.risk_level").value("MEDIUM"));
    }
}
