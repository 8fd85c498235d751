package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.TaskView;

/**
 * Outbound notifications about finished tasks and cost pauses.
 */
public interface TaskNotifier {

    void taskCompleted(TaskView task);

    void taskFailed(TaskView task);

    void costPaused(CostThresholdReachedEvent event);
}
