package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.IllegalTransitionException;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.exception.TaskCancelledException;
import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.CostEntry;
import com.autonomous.orchestrator.model.CostOperation;
import com.autonomous.orchestrator.model.KnowledgeRecord;
import com.autonomous.orchestrator.model.ModelResponse;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.Verdict;
import com.autonomous.orchestrator.model.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Runs one admitted task on a worker thread: generation with retries, cost recording,
 * verification and bounded regeneration.
 */
@Slf4j
@Service
public class TaskExecutionService {

    private static final int CONTEXT_SNIPPET_LENGTH = 1000;

    private final CapabilityRegistry registry;
    private final ModelCallService modelCalls;
    private final VerificationService verification;
    private final KnowledgeStore knowledgeStore;
    private final CostLedger ledger;
    private final TaskLifecycleService lifecycle;
    private final OrchestratorProperties properties;

    public TaskExecutionService(CapabilityRegistry registry, ModelCallService modelCalls,
                                VerificationService verification, KnowledgeStore knowledgeStore,
                                CostLedger ledger, TaskLifecycleService lifecycle,
                                OrchestratorProperties properties) {
        this.registry = registry;
        this.modelCalls = modelCalls;
        this.verification = verification;
        this.knowledgeStore = knowledgeStore;
        this.ledger = ledger;
        this.lifecycle = lifecycle;
        this.properties = properties;
    }

    public void execute(TaskHandle handle) {
        Task task = handle.getTask();
        try {
            AgentDescriptor agent = registry.resolve(task.getType());
            String model = agent.resolveModel(properties.getDefaultModel());
            synchronized (task) {
                task.setModel(model);
            }
            String basePrompt = buildPrompt(task, agent);
            String prompt = basePrompt;
            int regenerations = 0;

            while (true) {
                ModelResponse response = generate(handle, agent, model, prompt);
                String output = response.getText();
                if (!lifecycle.advance(task, TaskStatus.AWAITING_VERIFICATION, t -> {
                    t.setResult(output);
                    t.setProgress(80);
                })) {
                    return;
                }

                if (!properties.isEnableResultVerification()) {
                    complete(task, null);
                    return;
                }

                VerificationResult result = verification.verify(handle, agent, output);
                if (result.isApproved()) {
                    complete(task, result);
                    return;
                }
                if (regenerations >= properties.getVerificationRetryLimit()) {
                    lifecycle.advance(task, TaskStatus.FAILED, t -> {
                        t.setVerdict(result.getVerdict());
                        t.setVerificationFeedback(result.getFeedback());
                        t.setError("Output not approved after " + t.getAttempts() + " attempts");
                    });
                    log.info("Task failed verification. taskId={}, verdict={}, attempts={}",
                        task.getId(), result.getVerdict(), task.getAttempts());
                    return;
                }

                regenerations++;
                if (!lifecycle.advance(task, TaskStatus.RUNNING, t -> {
                    t.setVerdict(result.getVerdict());
                    t.setVerificationFeedback(result.getFeedback());
                    t.setProgress(20);
                })) {
                    return;
                }
                log.info("Regenerating after verification. taskId={}, verdict={}, regeneration={}",
                    task.getId(), result.getVerdict(), regenerations);
                prompt = regenerationPrompt(basePrompt, output, result);
            }
        } catch (TaskCancelledException e) {
            log.info("Worker stopped, task was cancelled. taskId={}", task.getId());
        } catch (IllegalTransitionException e) {
            throw e;
        } catch (OrchestratorException e) {
            fail(task, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error executing task. taskId={}, error={}", task.getId(), e.getMessage(), e);
            fail(task, "Unexpected error: " + e.getMessage());
        }
    }

    private ModelResponse generate(TaskHandle handle, AgentDescriptor agent, String model, String prompt) {
        Task task = handle.getTask();
        int maxTokens = agent.getMaxTokens() > 0 ? agent.getMaxTokens() : properties.getMaxTokens();
        ModelResponse response = modelCalls.call(prompt, model, maxTokens, handle, () -> {
            int attempt = task.incrementAttempts();
            log.debug("Generating. taskId={}, model={}, attempt={}", task.getId(), model, attempt);
        });

        ledger.recordUsage(CostEntry.builder()
            .timestamp(Instant.now())
            .taskId(task.getId())
            .agentType(task.getType())
            .model(model)
            .tokensUsed(response.getTokensUsed())
            .costUsd(response.getCostUsd())
            .operation(CostOperation.GENERATION)
            .build());
        task.addCost(response.getCostUsd());
        return response;
    }

    private void complete(Task task, VerificationResult result) {
        boolean completed = lifecycle.advance(task, TaskStatus.COMPLETED, t -> {
            if (result != null) {
                t.setVerdict(Verdict.APPROVED);
                t.setVerificationFeedback(result.getFeedback());
            }
            t.setProgress(100);
            t.setError(null);
        });
        if (completed) {
            log.info("Task completed. taskId={}, attempts={}, cost={}", task.getId(), task.getAttempts(), task.getCost());
        }
    }

    private void fail(Task task, String error) {
        TaskStatus status = task.getStatus();
        if (status != TaskStatus.RUNNING && status != TaskStatus.AWAITING_VERIFICATION) {
            log.warn("Not failing task outside execution. taskId={}, status={}, error={}", task.getId(), status, error);
            return;
        }
        if (lifecycle.advance(task, TaskStatus.FAILED, t -> t.setError(error))) {
            log.warn("Task failed. taskId={}, attempts={}, error={}", task.getId(), task.getAttempts(), error);
        }
    }

    String buildPrompt(Task task, AgentDescriptor agent) {
        StringBuilder prompt = new StringBuilder();
        if (agent.getSystemPrompt() != null) {
            prompt.append("System: ").append(agent.getSystemPrompt()).append("\n\n");
        }
        List<KnowledgeRecord> related = relatedWork(task);
        if (!related.isEmpty()) {
            prompt.append("Previous related work:\n");
            for (KnowledgeRecord record : related) {
                prompt.append("- [").append(record.getTaskId()).append("] ")
                    .append(abbreviate(record.getText())).append('\n');
            }
            prompt.append('\n');
        }
        if (task.getTitle() != null && !task.getTitle().isBlank()) {
            prompt.append(task.getTitle()).append("\n\n");
        }
        prompt.append(task.getPrompt());
        return prompt.toString();
    }

    private List<KnowledgeRecord> relatedWork(Task task) {
        if (properties.getKnowledgeContextSize() <= 0) {
            return List.of();
        }
        try {
            return knowledgeStore.query(task.getPrompt(), properties.getKnowledgeContextSize());
        } catch (RuntimeException e) {
            log.warn("Knowledge store query failed, continuing without context. taskId={}, error={}",
                task.getId(), e.getMessage());
            return List.of();
        }
    }

    private String regenerationPrompt(String basePrompt, String previousOutput, VerificationResult result) {
        StringBuilder prompt = new StringBuilder(basePrompt);
        prompt.append("\n\nA reviewer did not approve your previous answer (verdict: ")
            .append(result.getVerdict()).append(").");
        if (result.getFeedback() != null) {
            prompt.append("\nReviewer feedback:\n").append(result.getFeedback());
        }
        prompt.append("\n\nPrevious answer:\n").append(abbreviate(previousOutput))
            .append("\n\nProduce a corrected, complete answer.");
        return prompt.toString();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= CONTEXT_SNIPPET_LENGTH ? text : text.substring(0, CONTEXT_SNIPPET_LENGTH) + "...";
    }
}
