package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.SystemStatus;
import com.autonomous.orchestrator.model.TaskSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Periodic maintenance beat. Each tick submits an ordinary MAINTENANCE task that goes through
 * the same queue, cost ledger and verification as any other work.
 */
@Slf4j
@Component
public class MaintenanceScheduler {

    private final Orchestrator orchestrator;
    private final OrchestratorProperties properties;

    public MaintenanceScheduler(Orchestrator orchestrator, OrchestratorProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Scheduled(initialDelayString = "${orchestrator.maintenance.interval:PT5M}",
        fixedDelayString = "${orchestrator.maintenance.interval:PT5M}")
    public void tick() {
        if (!properties.getMaintenance().isEnabled()) {
            return;
        }
        SystemStatus status = orchestrator.systemStatus();
        if (status.getCosts().isPaused()) {
            log.info("Skipping maintenance tick, cost ledger is paused");
            return;
        }
        try {
            String id = orchestrator.submit(TaskSpec.builder()
                .type(AgentType.MAINTENANCE)
                .title("Scheduled maintenance check")
                .prompt(buildPrompt(status))
                .build());
            log.info("Submitted maintenance task. taskId={}", id);
        } catch (OrchestratorException e) {
            log.warn("Maintenance task not submitted. code={}, error={}", e.getCode(), e.getMessage());
        }
    }

    String buildPrompt(SystemStatus status) {
        return properties.getMaintenance().getPrompt() + "\n\n"
            + String.format(Locale.ROOT, "Cost: $%.2f spent, next pause at $%.2f (%s)%n",
                status.getCosts().getTotalCost(), status.getCosts().getNextPauseAt(), status.getCosts().getStatus())
            + String.format(Locale.ROOT, "Tasks: running=%d/%d, queued=%d%n",
                status.getRunningTasks(), status.getMaxParallelTasks(), status.getQueuedTasks())
            + "By status: " + status.getTasksByStatus();
    }
}
