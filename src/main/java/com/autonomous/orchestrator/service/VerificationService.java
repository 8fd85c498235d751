package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.ProviderException;
import com.autonomous.orchestrator.exception.TaskCancelledException;
import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.CostEntry;
import com.autonomous.orchestrator.model.CostOperation;
import com.autonomous.orchestrator.model.ModelResponse;
import com.autonomous.orchestrator.model.Task;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.Verdict;
import com.autonomous.orchestrator.model.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks a second, stronger model to approve or reject an agent's output.
 */
@Slf4j
@Service
public class VerificationService {

    private static final Pattern VERDICT_PATTERN = Pattern.compile("\\b(APPROVED|REJECTED|NEEDS_RETRY)\\b",
        Pattern.CASE_INSENSITIVE);

    private static final String REVIEW_INSTRUCTIONS =
        "You are a strict reviewer checking the work of a %s agent for correctness, completeness, "
            + "safety and whether it answers the request.\n"
            + "Reply with exactly one verdict word on the first line: APPROVED, REJECTED or NEEDS_RETRY. "
            + "On the following lines explain what must change if it is not approved.\n\n"
            + "Request:\n%s\n\nOutput to review:\n%s";

    private final ModelCallService modelCalls;
    private final CostLedger ledger;
    private final String verificationModel;
    private final int maxTokens;

    public VerificationService(ModelCallService modelCalls, CostLedger ledger, OrchestratorProperties properties) {
        this.modelCalls = modelCalls;
        this.ledger = ledger;
        this.verificationModel = properties.getVerificationModel();
        this.maxTokens = properties.getMaxTokens();
    }

    /**
     * Reviews the output of a task that is awaiting verification. Provider failures become a
     * {@link Verdict#NEEDS_RETRY} verdict rather than an exception.
     */
    public VerificationResult verify(TaskHandle handle, AgentDescriptor agent, String output) {
        Task task = handle.getTask();
        if (task.getStatus() == TaskStatus.CANCELLED) {
            throw new TaskCancelledException(task.getId());
        }
        if (task.getStatus() != TaskStatus.AWAITING_VERIFICATION) {
            throw new IllegalStateException("Task " + task.getId() + " is not awaiting verification: "
                + task.getStatus());
        }

        String prompt = String.format(REVIEW_INSTRUCTIONS,
            agent.getType().name().toLowerCase(Locale.ROOT), task.getPrompt(), output);
        ModelResponse response;
        try {
            response = modelCalls.call(prompt, verificationModel, maxTokens, handle, () -> { });
        } catch (ProviderException e) {
            log.warn("Verification call failed. taskId={}, error={}", task.getId(), e.getMessage());
            return new VerificationResult(Verdict.NEEDS_RETRY, "Verification unavailable: " + e.getMessage());
        }

        ledger.recordUsage(CostEntry.builder()
            .timestamp(Instant.now())
            .taskId(task.getId())
            .agentType(task.getType())
            .model(verificationModel)
            .tokensUsed(response.getTokensUsed())
            .costUsd(response.getCostUsd())
            .operation(CostOperation.VERIFICATION)
            .build());
        task.addCost(response.getCostUsd());

        VerificationResult result = parse(response.getText());
        log.info("Verification finished. taskId={}, verdict={}", task.getId(), result.getVerdict());
        return result;
    }

    VerificationResult parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return new VerificationResult(Verdict.NEEDS_RETRY, "Empty verification reply");
        }
        Matcher matcher = VERDICT_PATTERN.matcher(reply);
        if (!matcher.find()) {
            return new VerificationResult(Verdict.NEEDS_RETRY, reply.trim());
        }
        Verdict verdict = Verdict.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
        String feedback = reply.substring(matcher.end()).trim();
        return new VerificationResult(verdict, feedback.isEmpty() ? null : feedback);
    }
}
