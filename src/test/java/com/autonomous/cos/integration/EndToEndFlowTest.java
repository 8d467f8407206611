package com.autonomous.cos.integration;

import com.autonomous.cos.model.AgentRun;
import com.autonomous.cos.model.AgentRunStatus;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskStatus;
import com.autonomous.cos.service.AgentSpawnerService;
import com.autonomous.cos.service.ProcessLauncher;
import com.autonomous.cos.service.ProcessMetricsSource;
import com.autonomous.cos.service.SlackService;
import com.autonomous.cos.service.TaskEvaluatorService;
import com.autonomous.cos.service.TaskStoreService;
import com.autonomous.cos.service.TickSource;
import com.autonomous.cos.support.FakeAgentProcess;
import com.autonomous.cos.support.ManualTickSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class EndToEndFlowTest {

    private static final Path DATA_PATH = Path.of("target", "test-data", "e2e-" + UUID.randomUUID());

    @DynamicPropertySource
    static void dataPath(DynamicPropertyRegistry registry) {
        registry.add("cos.data-path", DATA_PATH::toString);
    }

    @TestConfiguration
    static class ManualTicks {
        @Bean
        @Primary
        TickSource manualTickSource() {
            return new ManualTickSource();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TaskStoreService taskStore;

    @Autowired
    private AgentSpawnerService spawner;

    @Autowired
    private TaskEvaluatorService evaluator;

    @MockBean
    private ProcessLauncher launcher;

    @MockBean
    private ProcessMetricsSource metricsSource;

    @MockBean
    private SlackService slackService;

    private final List<FakeAgentProcess> launched = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        when(launcher.launch(any(), any())).thenAnswer(inv -> {
            FakeAgentProcess process = new FakeAgentProcess(4000L + launched.size());
            launched.add(process);
            return process;
        });
    }

    @AfterEach
    void tearDown() {
        launched.forEach(p -> p.exit(0));
        evaluator.stop();
    }

    @Test
    void shouldRunUserTaskToCompletion() throws Exception {
        String taskId = addTask("{\"description\":\"Fix the checkout total rounding\",\"priority\":\"HIGH\"}");

        mockMvc.perform(post("/api/cos/start")).andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true));
        mockMvc.perform(post("/api/cos/evaluate")).andExpect(status().isAccepted());

        Task running = taskStore.get(taskId);
        assertEquals(TaskStatus.IN_PROGRESS, running.getStatus());
        assertEquals(1, launched.size());

        launched.get(0).exit(0);

        mockMvc.perform(get("/api/cos/tasks/" + taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed"));
        AgentRun run = spawner.get(running.getAgentId());
        assertEquals(AgentRunStatus.COMPLETED, run.getStatus());
        assertTrue(run.getResult().isSuccess());
        assertTrue(Files.readString(DATA_PATH.resolve("TASKS.md")).contains("#" + taskId));
    }

    @Test
    void shouldHoldSystemTaskUntilApproved() throws Exception {
        String taskId = addTask("{\"queue\":\"system\",\"description\":\"Rotate API keys\",\"approvalRequired\":true}");

        mockMvc.perform(post("/api/cos/evaluate")).andExpect(status().isAccepted());

        assertEquals(TaskStatus.PENDING, taskStore.get(taskId).getStatus());
        assertTrue(launched.isEmpty());
        mockMvc.perform(get("/api/cos/tasks/awaiting-approval"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + taskId + "')]").exists());

        mockMvc.perform(post("/api/cos/tasks/" + taskId + "/approve")).andExpect(status().isOk());
        mockMvc.perform(post("/api/cos/evaluate")).andExpect(status().isAccepted());

        assertEquals(TaskStatus.IN_PROGRESS, taskStore.get(taskId).getStatus());
        assertEquals(1, launched.size());
    }

    @Test
    void shouldBlockTaskWhenAgentFails() throws Exception {
        String taskId = addTask("{\"description\":\"Migrate the search index\"}");

        mockMvc.perform(post("/api/cos/evaluate")).andExpect(status().isAccepted());
        launched.get(0).exit(1);

        Task blocked = taskStore.get(taskId);
        assertEquals(TaskStatus.BLOCKED, blocked.getStatus());
        assertNotNull(blocked.getBlocker());
        verify(slackService, never()).postMessage(any(), any());
    }

    private String addTask(String json) throws Exception {
        String body = mockMvc.perform(post("/api/cos/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(body);
        return node.get("id").asText();
    }
}
