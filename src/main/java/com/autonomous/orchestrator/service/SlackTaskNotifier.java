package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.TaskView;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Posts task outcomes and cost pauses to a Slack channel. Only active when a bot token is configured.
 */
@Component
@ConditionalOnProperty(name = "slack.bot.token")
public class SlackTaskNotifier implements TaskNotifier {

    private static final int SUMMARY_LENGTH = 500;

    private final SlackService slackService;
    private final String channel;

    @Autowired
    public SlackTaskNotifier(@Value("${slack.bot.token}") String botToken,
                             @Value("${slack.channel:#orchestrator}") String channel) {
        this(new SlackService(botToken), channel);
    }

    SlackTaskNotifier(SlackService slackService, String channel) {
        this.slackService = slackService;
        this.channel = channel;
    }

    @Override
    public void taskCompleted(TaskView task) {
        StringBuilder message = new StringBuilder();
        message.append("*Task complete!*\n\n");
        message.append("*Task:* ").append(describe(task)).append("\n");
        message.append("*Agent:* ").append(task.getType()).append("\n");
        message.append("*Cost:* ").append(String.format(Locale.ROOT, "$%.4f", task.getCost())).append("\n");
        message.append("*Attempts:* ").append(task.getAttempts()).append("\n\n");
        message.append("*Summary:* ").append(summarize(task.getResult()));
        slackService.postMessage(channel, message.toString());
    }

    @Override
    public void taskFailed(TaskView task) {
        StringBuilder message = new StringBuilder();
        message.append("*Task failed*\n\n");
        message.append("*Task:* ").append(describe(task)).append("\n");
        message.append("*Error:* ").append(task.getError());
        String ts = slackService.postMessage(channel, message.toString());
        // reviewer notes go in a thread to keep the channel readable
        if (ts != null && task.getVerificationFeedback() != null) {
            slackService.postMessageInThread(channel, ts, "*Reviewer:* " + summarize(task.getVerificationFeedback()));
        }
    }

    @Override
    public void costPaused(CostThresholdReachedEvent event) {
        String message = String.format(Locale.ROOT, "*Cost ceiling reached*\nSpent $%.2f of $%.2f. New tasks are paused until "
            + "an operator confirms.", event.getTotalCost(), event.getPausedAt());
        slackService.postMessage(channel, message);
    }

    private static String describe(TaskView task) {
        return task.getTitle() != null && !task.getTitle().isBlank() ? task.getTitle() : task.getId();
    }

    private static String summarize(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= SUMMARY_LENGTH ? text : text.substring(0, SUMMARY_LENGTH) + "...";
    }
}
