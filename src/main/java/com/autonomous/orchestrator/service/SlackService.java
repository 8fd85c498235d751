package com.autonomous.orchestrator.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Thin wrapper over the Slack Web API's chat.postMessage.
 */
@Slf4j
public class SlackService {

    private final MethodsClient methods;

    public SlackService(String botToken) {
        this(Slack.getInstance().methods(botToken));
    }

    SlackService(MethodsClient methods) {
        this.methods = methods;
    }

    /**
     * Posts a message to a channel and returns the message timestamp, or null if Slack refused it.
     * The timestamp can be used to start a thread.
     */
    public String postMessage(String channel, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .text(message)
            .build());
    }

    /**
     * Posts a message as a reply in an existing thread.
     */
    public String postMessageInThread(String channel, String threadTs, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadTs)
            .text(message)
            .build());
    }

    private String post(ChatPostMessageRequest request) {
        try {
            ChatPostMessageResponse response = methods.chatPostMessage(request);
            if (response.isOk()) {
                return response.getTs();
            }
            log.warn("Slack rejected message. channel={}, error={}", request.getChannel(), response.getError());
            return null;
        } catch (IOException | SlackApiException e) {
            log.warn("Failed to post Slack message. channel={}, error={}", request.getChannel(), e.getMessage());
            return null;
        }
    }
}
