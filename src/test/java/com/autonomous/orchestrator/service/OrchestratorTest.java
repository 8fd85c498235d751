package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.AgentNotFoundException;
import com.autonomous.orchestrator.exception.QueueFullException;
import com.autonomous.orchestrator.exception.TaskNotFoundException;
import com.autonomous.orchestrator.exception.TaskValidationException;
import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.KnowledgeRecord;
import com.autonomous.orchestrator.model.SystemStatus;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskEvent;
import com.autonomous.orchestrator.model.TaskFilter;
import com.autonomous.orchestrator.model.TaskSpec;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.TaskView;
import com.autonomous.orchestrator.support.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OrchestratorTest {

    private EngineHarness engine;

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void shouldRejectInvalidSpecs() {
        engine = new EngineHarness(EngineHarness.defaultProperties());
        Orchestrator orchestrator = engine.orchestrator;

        assertThrows(TaskValidationException.class, () -> orchestrator.submit(null));
        assertThrows(TaskValidationException.class,
            () -> orchestrator.submit(TaskSpec.builder().prompt("no type").build()));
        assertThrows(TaskValidationException.class,
            () -> orchestrator.submit(TaskSpec.builder().type(AgentType.CODING).prompt("   ").build()));
        assertThrows(TaskValidationException.class,
            () -> orchestrator.submit(TaskSpec.builder().type(AgentType.CODING).prompt("p")
                .title("x".repeat(201)).build()));
        assertTrue(orchestrator.list(null).isEmpty());
    }

    @Test
    void shouldRejectOverlongPrompt() {
        OrchestratorProperties properties = EngineHarness.defaultProperties();
        properties.setMaxPromptLength(10);
        engine = new EngineHarness(properties);

        TaskValidationException ex = assertThrows(TaskValidationException.class,
            () -> engine.orchestrator.submit(TaskSpec.builder().type(AgentType.CODING).prompt("a".repeat(11)).build()));

        assertEquals("VALIDATION_ERROR", ex.getCode());
    }

    @Test
    void shouldRejectUnregisteredAgentType() {
        CapabilityRegistry emptyRegistry = new CapabilityRegistry();
        Orchestrator orchestrator = new Orchestrator(emptyRegistry, mock(TaskDispatcher.class),
            mock(TaskLifecycleService.class), new InMemoryTaskRepository(), mock(CostLedger.class),
            new InMemoryKnowledgeStore(), List.of(), EngineHarness.defaultProperties());

        assertThrows(AgentNotFoundException.class, () -> orchestrator.submit(
            TaskSpec.builder().type(AgentType.DESIGN).prompt("draw a logo").build()));
    }

    @Test
    void shouldRejectSubmissionWhenQueueFull() {
        OrchestratorProperties properties = EngineHarness.defaultProperties();
        properties.setQueueCapacity(1);
        engine = new EngineHarness(properties);
        engine.submit("fits");

        assertThrows(QueueFullException.class, () -> engine.submit("does not fit"));
        assertEquals(1, engine.orchestrator.list(null).size());
        assertEquals(1, engine.repository.findAll().size());
    }

    @Test
    void shouldThrowForUnknownTaskId() {
        engine = new EngineHarness(EngineHarness.defaultProperties());

        assertThrows(TaskNotFoundException.class, () -> engine.orchestrator.getStatus("nope"));
        assertThrows(TaskNotFoundException.class, () -> engine.orchestrator.cancel("nope"));
    }

    @Test
    void shouldFilterAndPageTaskList() {
        engine = new EngineHarness(EngineHarness.defaultProperties());
        String first = engine.submit("one");
        String second = engine.submit("two");
        String marketing = engine.orchestrator.submit(TaskSpec.builder()
            .type(AgentType.MARKETING).prompt("three").build());
        engine.orchestrator.cancel(second);

        List<TaskView> queued = engine.orchestrator.list(TaskFilter.builder().status(TaskStatus.QUEUED).build());
        List<TaskView> coding = engine.orchestrator.list(TaskFilter.builder().type(AgentType.CODING).build());
        List<TaskView> paged = engine.orchestrator.list(TaskFilter.builder().offset(1).limit(1).build());

        assertEquals(List.of(first, marketing), ids(queued));
        assertEquals(List.of(first, second), ids(coding));
        assertEquals(1, paged.size());
    }

    @Test
    void shouldStoreCompletedResultInKnowledgeStore() {
        engine = new EngineHarness(EngineHarness.defaultProperties());
        engine.start();

        String id = engine.submit("summarize release notes");
        engine.awaitStatus(id, TaskStatus.COMPLETED);

        List<KnowledgeRecord> related = engine.knowledgeStore.query("generated output", 5);
        assertEquals(1, related.size());
        assertEquals(id, related.get(0).getTaskId());
        assertEquals(AgentType.CODING, related.get(0).getAgentType());
    }

    @Test
    void shouldReportSystemStatus() {
        engine = new EngineHarness(EngineHarness.defaultProperties());
        engine.submit("waiting");

        SystemStatus status = engine.orchestrator.systemStatus();

        assertEquals(1L, status.getTasksByStatus().get(TaskStatus.QUEUED));
        assertEquals(0L, status.getTasksByStatus().get(TaskStatus.COMPLETED));
        assertEquals(1, status.getQueuedTasks());
        assertEquals(3, status.getMaxParallelTasks());
        assertEquals(AgentType.values().length, status.getAgents().size());
        assertNotNull(status.getCosts());
    }

    @Test
    void shouldRecoverTasksAfterRestart() {
        JsonFileTaskRepository repository = new JsonFileTaskRepository(tempDir.toString());
        Task interrupted = stored("interrupted", TaskStatus.RUNNING, "2024-01-01T10:00:00Z");
        Task queued = stored("queued", TaskStatus.QUEUED, "2024-01-01T10:01:00Z");
        Task pending = stored("pending", TaskStatus.PENDING, "2024-01-01T10:02:00Z");
        Task done = stored("done", TaskStatus.COMPLETED, "2024-01-01T09:00:00Z");
        List.of(interrupted, queued, pending, done).forEach(repository::save);

        engine = new EngineHarness(EngineHarness.defaultProperties(), repository);
        engine.start();

        engine.awaitStatus("queued", TaskStatus.COMPLETED);
        engine.awaitStatus("pending", TaskStatus.COMPLETED);
        assertEquals(TaskStatus.FAILED, engine.statusOf("interrupted"));
        assertEquals("interrupted by restart", engine.orchestrator.getStatus("interrupted").getError());
        assertEquals(TaskStatus.COMPLETED, engine.statusOf("done"));
        assertEquals(List.of("queued", "pending"), engine.dispatchOrder());
        assertEquals(TaskStatus.FAILED, repository.findById("interrupted").get().getStatus());
    }

    @Test
    void shouldForwardOutcomesToNotifiers() {
        TaskNotifier notifier = mock(TaskNotifier.class);
        TaskNotifier broken = mock(TaskNotifier.class);
        doThrow(new IllegalStateException("slack down")).when(broken).taskFailed(any());
        KnowledgeStore knowledgeStore = mock(KnowledgeStore.class);
        Orchestrator orchestrator = new Orchestrator(new CapabilityRegistry(), mock(TaskDispatcher.class),
            mock(TaskLifecycleService.class), new InMemoryTaskRepository(), mock(CostLedger.class),
            knowledgeStore, List.of(broken, notifier), EngineHarness.defaultProperties());

        TaskView failed = TaskView.builder().id("f").status(TaskStatus.FAILED).error("boom").build();
        orchestrator.onTaskEvent(new TaskEvent(failed, TaskStatus.RUNNING));
        orchestrator.onCostThreshold(new CostThresholdReachedEvent(5.2, 5.0));
        TaskView running = TaskView.builder().id("r").status(TaskStatus.RUNNING).build();
        orchestrator.onTaskEvent(new TaskEvent(running, TaskStatus.QUEUED));

        verify(notifier).taskFailed(failed);
        verify(notifier).costPaused(any(CostThresholdReachedEvent.class));
        verify(notifier, never()).taskCompleted(any());
        verifyNoInteractions(knowledgeStore);
    }

    private static Task stored(String id, TaskStatus status, String createdAt) {
        Task task = Task.pending(id, TaskSpec.builder().type(AgentType.CODING).prompt("recover " + id).build());
        task.setStatus(status);
        task.setCreatedAt(Instant.parse(createdAt));
        return task;
    }

    private static List<String> ids(List<TaskView> views) {
        return views.stream().map(TaskView::getId).collect(Collectors.toList());
    }
}
