package com.proof2pay.orchestrator.client;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Slf4j
@Component
public class SlackChatTransport implements ChatTransport {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack;

    public SlackChatTransport() {
        this(Slack.getInstance());
    }

    SlackChatTransport(Slack slack) {
        this.slack = slack;
    }

    public void setSlackBotToken(String token) {
        this.slackBotToken = token;
    }

    @Override
    public void post(String channel, String text) {
        if (slackBotToken == null || slackBotToken.isBlank()) {
            log.warn("[Slack] No bot token configured, dropping post to {}: {}", channel, abbreviate(text));
            return;
        }

        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(channel)
                .text(text)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (!response.isOk()) {
                log.error("[Slack] Failed to post to {}: {}", channel, response.getError());
            }
        } catch (IOException | SlackApiException e) {
            log.error("[Slack] Failed to post to {}: {}", channel, e.getMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
