package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.KnowledgeRecord;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskExecutionServiceTest {

    @Mock
    private ModelCallService modelCalls;

    @Mock
    private VerificationService verification;

    @Mock
    private KnowledgeStore knowledgeStore;

    @Mock
    private TaskLifecycleService lifecycle;

    private OrchestratorProperties properties;
    private TaskExecutionService executionService;
    private AgentDescriptor agent;
    private Task task;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.setPersistenceEnabled(false);
        CostLedger ledger = new CostLedger(properties, event -> { });
        executionService = new TaskExecutionService(new CapabilityRegistry(), modelCalls, verification,
            knowledgeStore, ledger, lifecycle, properties);

        agent = new AgentDescriptor();
        agent.setType(AgentType.MARKETING);
        agent.setSystemPrompt("You are a marketing expert.");
        task = Task.pending("task-9", TaskSpec.builder()
            .type(AgentType.MARKETING)
            .title("Spring campaign")
            .prompt("Write three taglines for the spring sale")
            .build());
    }

    @Test
    void shouldPrefixSystemPromptAndRelatedWork() {
        when(knowledgeStore.query(task.getPrompt(), 3)).thenReturn(List.of(
            KnowledgeRecord.builder().id("old-1").taskId("old-1").text("Winter sale taglines: ...").build()));

        String prompt = executionService.buildPrompt(task, agent);

        assertTrue(prompt.startsWith("System: You are a marketing expert."));
        assertTrue(prompt.contains("Previous related work:\n- [old-1] Winter sale taglines: ..."));
        assertTrue(prompt.indexOf("Spring campaign") < prompt.indexOf("Write three taglines"));
        assertTrue(prompt.endsWith("Write three taglines for the spring sale"));
    }

    @Test
    void shouldContinueWithoutContextWhenKnowledgeStoreFails() {
        when(knowledgeStore.query(anyString(), anyInt())).thenThrow(new IllegalStateException("store offline"));

        String prompt = executionService.buildPrompt(task, agent);

        assertFalse(prompt.contains("Previous related work"));
        assertTrue(prompt.contains("Write three taglines"));
    }

    @Test
    void shouldSkipKnowledgeQueryWhenContextDisabled() {
        properties.setKnowledgeContextSize(0);

        executionService.buildPrompt(task, agent);

        verifyNoInteractions(knowledgeStore);
    }
}
