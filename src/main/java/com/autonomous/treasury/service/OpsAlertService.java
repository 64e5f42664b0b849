package com.autonomous.treasury.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Escalates operationally significant events (audit degradation, freezes) to a Slack channel.
 * Without a bot token and channel it only logs.
 */
@Slf4j
@Service
public class OpsAlertService {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    @Value("${slack.ops.channel:}")
    private String opsChannel;

    private final Slack slack;
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    public OpsAlertService() {
        this(Slack.getInstance());
    }

    OpsAlertService(Slack slack) {
        this.slack = slack;
    }

    public void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    public void setOpsChannel(String opsChannel) {
        this.opsChannel = opsChannel;
    }

    public boolean isEnabled() {
        return slackBotToken != null && !slackBotToken.isBlank()
            && opsChannel != null && !opsChannel.isBlank();
    }

    /**
     * Fire-and-forget; never blocks the caller on Slack.
     */
    public CompletableFuture<Boolean> alert(String message) {
        if (!isEnabled()) {
            log.info("Ops alert (Slack disabled): {}", message);
            return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.supplyAsync(() -> postMessage(":rotating_light: *Treasury* " + message), executor);
    }

    boolean postMessage(String message) {
        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(opsChannel)
                .text(message)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (!response.isOk()) {
                log.error("Failed to post ops alert: {}", response.getError());
                return false;
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to post ops alert", e);
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
