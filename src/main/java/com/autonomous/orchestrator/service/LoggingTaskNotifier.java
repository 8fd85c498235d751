package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.TaskView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingTaskNotifier implements TaskNotifier {

    @Override
    public void taskCompleted(TaskView task) {
        log.info("Task complete. taskId={}, type={}, attempts={}, cost=${}",
            task.getId(), task.getType(), task.getAttempts(), String.format("%.4f", task.getCost()));
    }

    @Override
    public void taskFailed(TaskView task) {
        log.warn("Task failed. taskId={}, type={}, attempts={}, error={}",
            task.getId(), task.getType(), task.getAttempts(), task.getError());
    }

    @Override
    public void costPaused(CostThresholdReachedEvent event) {
        log.warn("Admission paused at ${} (ceiling ${}). Confirm via POST /api/costs/confirm to continue.",
            String.format("%.2f", event.getTotalCost()), String.format("%.2f", event.getPausedAt()));
    }
}
