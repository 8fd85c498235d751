package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.AgentNotFoundException;
import com.autonomous.orchestrator.exception.DuplicateTaskException;
import com.autonomous.orchestrator.exception.TaskNotFoundException;
import com.autonomous.orchestrator.exception.TaskValidationException;
import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.CostEntry;
import com.autonomous.orchestrator.model.CostHistoryFilter;
import com.autonomous.orchestrator.model.CostSummary;
import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.KnowledgeRecord;
import com.autonomous.orchestrator.model.SystemStatus;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskEvent;
import com.autonomous.orchestrator.model.TaskFilter;
import com.autonomous.orchestrator.model.TaskSpec;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.TaskView;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Entry point for submitting, inspecting and cancelling tasks, and for the operator's
 * cost controls. Owns the table of live tasks; everything else is delegated.
 */
@Slf4j
@Service
public class Orchestrator {

    static final int MAX_TITLE_LENGTH = 200;

    private final CapabilityRegistry registry;
    private final TaskDispatcher scheduler;
    private final TaskLifecycleService lifecycle;
    private final TaskRepository repository;
    private final CostLedger ledger;
    private final KnowledgeStore knowledgeStore;
    private final List<TaskNotifier> notifiers;
    private final OrchestratorProperties properties;

    // insertion order is submission order
    private final Map<String, Task> tasks = Collections.synchronizedMap(new LinkedHashMap<>());

    public Orchestrator(CapabilityRegistry registry, TaskDispatcher scheduler, TaskLifecycleService lifecycle,
                        TaskRepository repository, CostLedger ledger, KnowledgeStore knowledgeStore,
                        List<TaskNotifier> notifiers, OrchestratorProperties properties) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.lifecycle = lifecycle;
        this.repository = repository;
        this.ledger = ledger;
        this.knowledgeStore = knowledgeStore;
        this.notifiers = notifiers;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        recover();
        scheduler.start();
    }

    @PreDestroy
    public void stop() {
        scheduler.stop();
    }

    /**
     * Validates and enqueues a new task.
     *
     * @return the new task id
     * @throws TaskValidationException if the submission is malformed
     * @throws AgentNotFoundException if no agent is registered for the type
     */
    public String submit(TaskSpec spec) {
        validate(spec);
        registry.resolve(spec.getType());

        Task task = Task.pending(UUID.randomUUID().toString(), spec);
        if (tasks.putIfAbsent(task.getId(), task) != null) {
            throw new DuplicateTaskException(task.getId());
        }
        lifecycle.save(task);
        try {
            scheduler.enqueue(task);
        } catch (RuntimeException e) {
            tasks.remove(task.getId());
            repository.delete(task.getId());
            throw e;
        }
        log.info("Task submitted. taskId={}, type={}, title={}", task.getId(), task.getType(), task.getTitle());
        return task.getId();
    }

    /**
     * @return false if the task already reached a terminal state
     */
    public boolean cancel(String taskId) {
        return scheduler.cancel(find(taskId));
    }

    public TaskView getStatus(String taskId) {
        return find(taskId).toView();
    }

    public List<TaskView> list(TaskFilter filter) {
        TaskFilter effective = filter != null ? filter : TaskFilter.builder().build();
        return snapshot().stream()
            .map(Task::toView)
            .filter(effective::matches)
            .skip(Math.max(effective.getOffset(), 0))
            .limit(Math.max(effective.getLimit(), 0))
            .collect(Collectors.toList());
    }

    /**
     * Operator acknowledgement of a cost pause. Queued tasks resume in order.
     *
     * @return true if the ledger was paused
     */
    public boolean confirmContinue() {
        boolean resumed = ledger.confirmContinue();
        scheduler.signal();
        return resumed;
    }

    public CostSummary costSummary() {
        return ledger.summary();
    }

    public List<CostEntry> costHistory(CostHistoryFilter filter) {
        return ledger.history(filter);
    }

    public void resetCosts() {
        ledger.reset();
        scheduler.signal();
    }

    public List<AgentDescriptor> agents() {
        return registry.list();
    }

    public Optional<AgentDescriptor> agent(AgentType type) {
        return registry.find(type);
    }

    public SystemStatus systemStatus() {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (Task task : snapshot()) {
            byStatus.merge(task.getStatus(), 1L, Long::sum);
        }
        Map<AgentType, String> agents = new LinkedHashMap<>();
        for (AgentDescriptor descriptor : registry.list()) {
            agents.put(descriptor.getType(), descriptor.getName());
        }
        return SystemStatus.builder()
            .tasksByStatus(byStatus)
            .runningTasks(scheduler.runningCount())
            .queuedTasks(scheduler.queuedCount())
            .maxParallelTasks(scheduler.getMaxParallel())
            .costs(ledger.summary())
            .agents(agents)
            .build();
    }

    @EventListener
    public void onTaskEvent(TaskEvent event) {
        TaskView view = event.getTask();
        if (view.getStatus() == TaskStatus.COMPLETED) {
            remember(view);
            notifiers.forEach(notifier -> notifySafely(notifier, n -> n.taskCompleted(view)));
        } else if (view.getStatus() == TaskStatus.FAILED) {
            notifiers.forEach(notifier -> notifySafely(notifier, n -> n.taskFailed(view)));
        }
    }

    @EventListener
    public void onCostThreshold(CostThresholdReachedEvent event) {
        notifiers.forEach(notifier -> notifySafely(notifier, n -> n.costPaused(event)));
    }

    private void remember(TaskView view) {
        if (view.getResult() == null || view.getResult().isBlank()) {
            return;
        }
        try {
            knowledgeStore.put(KnowledgeRecord.builder()
                .id(view.getId())
                .text(view.getResult())
                .taskId(view.getId())
                .agentType(view.getType())
                .createdAt(Instant.now())
                .build());
        } catch (RuntimeException e) {
            log.warn("Failed to store task result in knowledge store. taskId={}, error={}",
                view.getId(), e.getMessage());
        }
    }

    private void notifySafely(TaskNotifier notifier, Consumer<TaskNotifier> call) {
        try {
            call.accept(notifier);
        } catch (RuntimeException e) {
            log.warn("Notifier failed. notifier={}, error={}", notifier.getClass().getSimpleName(), e.getMessage());
        }
    }

    private List<Task> snapshot() {
        synchronized (tasks) {
            return new ArrayList<>(tasks.values());
        }
    }

    private Task find(String taskId) {
        Task task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private void validate(TaskSpec spec) {
        if (spec == null) {
            throw new TaskValidationException("Task spec is required");
        }
        if (spec.getType() == null) {
            throw new TaskValidationException("Task type is required");
        }
        if (spec.getPrompt() == null || spec.getPrompt().isBlank()) {
            throw new TaskValidationException("Prompt must not be empty");
        }
        if (spec.getPrompt().length() > properties.getMaxPromptLength()) {
            throw new TaskValidationException("Prompt exceeds " + properties.getMaxPromptLength() + " characters");
        }
        if (spec.getTitle() != null && spec.getTitle().length() > MAX_TITLE_LENGTH) {
            throw new TaskValidationException("Title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
    }

    // Tasks interrupted mid-execution cannot be resumed; anything not yet admitted is re-queued in order.
    private void recover() {
        List<Task> stored = repository.findAll();
        int requeued = 0;
        int interrupted = 0;
        for (Task task : stored) {
            tasks.put(task.getId(), task);
            switch (task.getStatus()) {
                case PENDING -> {
                    scheduler.enqueue(task);
                    requeued++;
                }
                case QUEUED -> {
                    scheduler.restore(task);
                    requeued++;
                }
                case RUNNING, AWAITING_VERIFICATION -> {
                    lifecycle.move(task, TaskStatus.FAILED, t -> t.setError("interrupted by restart"));
                    interrupted++;
                }
                default -> {
                }
            }
        }
        if (!stored.isEmpty()) {
            log.info("Recovered tasks from storage. total={}, requeued={}, interrupted={}",
                stored.size(), requeued, interrupted);
        }
    }
}
