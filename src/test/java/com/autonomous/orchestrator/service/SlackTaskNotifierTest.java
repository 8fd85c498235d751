package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.TaskView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlackTaskNotifierTest {

    @Mock
    private SlackService slackService;

    private SlackTaskNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new SlackTaskNotifier(slackService, "C123");
    }

    @Test
    void shouldPostCompletionSummary() {
        TaskView task = TaskView.builder()
            .id("t-1")
            .type(AgentType.CODING)
            .title("Add login form")
            .status(TaskStatus.COMPLETED)
            .cost(0.1234)
            .attempts(2)
            .result("Implemented the form.")
            .build();

        notifier.taskCompleted(task);

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(slackService).postMessage(eq("C123"), message.capture());
        assertTrue(message.getValue().contains("*Task complete!*"));
        assertTrue(message.getValue().contains("Add login form"));
        assertTrue(message.getValue().contains("$0.1234"));
        assertTrue(message.getValue().contains("Implemented the form."));
    }

    @Test
    void shouldPostFailureWithReviewerFeedback() {
        TaskView task = TaskView.builder()
            .id("t-2")
            .status(TaskStatus.FAILED)
            .error("Output not approved after 3 attempts")
            .verificationFeedback("Missing validation")
            .build();

        when(slackService.postMessage(eq("C123"), anyString())).thenReturn("1700000000.000100");

        notifier.taskFailed(task);

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(slackService).postMessage(eq("C123"), message.capture());
        assertTrue(message.getValue().contains("*Task failed*"));
        assertTrue(message.getValue().contains("t-2"));
        verify(slackService).postMessageInThread(eq("C123"), eq("1700000000.000100"), contains("Missing validation"));
    }

    @Test
    void shouldSkipThreadReplyWhenPostFails() {
        TaskView task = TaskView.builder()
            .id("t-3")
            .status(TaskStatus.FAILED)
            .error("Output not approved after 3 attempts")
            .verificationFeedback("Missing validation")
            .build();

        notifier.taskFailed(task);

        verify(slackService, never()).postMessageInThread(anyString(), anyString(), anyString());
    }

    @Test
    void shouldAnnounceCostPause() {
        notifier.costPaused(new CostThresholdReachedEvent(5.5, 5.0));

        verify(slackService).postMessage(eq("C123"), contains("$5.50 of $5.00"));
    }
}
