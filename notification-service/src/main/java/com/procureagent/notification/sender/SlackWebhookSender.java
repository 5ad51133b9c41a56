package com.procureagent.notification.sender;

import com.procureagent.common.model.Decision;
import com.procureagent.common.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Best-effort delivery of escalated decisions to a Slack incoming webhook.
 * Falls back to log output when Slack is disabled or no URL is configured.
 */
@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private static final DateTimeFormatter DEADLINE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final String slackWebhookUrl;
    private final boolean slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder,
                              @Value("${notification.slack.webhook-url:}") String slackWebhookUrl,
                              @Value("${notification.slack.enabled:false}") boolean slackEnabled) {
        this.webClient       = builder.build();
        this.slackWebhookUrl = slackWebhookUrl == null ? "" : slackWebhookUrl;
        this.slackEnabled    = slackEnabled;
    }

    public boolean isDeliveryEnabled() {
        return slackEnabled && !slackWebhookUrl.isBlank();
    }

    public void sendDecisions(List<Decision> decisions) {
        if (decisions.isEmpty()) {
            return;
        }
        if (!isDeliveryEnabled()) {
            log.info("Slack disabled or no webhook URL configured. Logging decisions instead.");
            logDecisions(decisions);
            return;
        }

        String message = buildDecisionMessage(decisions);

        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Slack decision notification sent. count={} status={}",
                                decisions.size(), r.getStatusCode()),
                err -> log.error("Slack decision notification failed. count={}", decisions.size(), err)
            );
    }

    String buildDecisionMessage(List<Decision> decisions) {
        long critical = decisions.stream().filter(d -> d.priority() == Priority.CRITICAL).count();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("*📦 Procurement Alert* | %d decision(s), %d critical%n",
                                decisions.size(), critical));
        sb.append("---\n");

        for (Decision d : decisions) {
            sb.append(String.format("%s *%s* → `%s` (conf: %.0f%%)",
                priorityEmoji(d.priority()), d.itemSku(), d.actionType(), d.confidence() * 100));
            if (d.recommendedQuantity() != null) {
                sb.append(String.format(" | qty: %d", d.recommendedQuantity()));
            }
            if (d.estimatedCost() != null) {
                sb.append(String.format(" | cost: ₹%.2f", d.estimatedCost()));
            }
            if (d.deadline() != null) {
                sb.append(" | by ").append(DEADLINE_FORMAT.format(d.deadline()));
            }
            sb.append('\n');
            sb.append(String.format("   _%s_%n", d.reasoning()));
        }
        return sb.toString();
    }

    private String priorityEmoji(Priority priority) {
        return switch (priority) {
            case CRITICAL -> "🔴";
            case HIGH     -> "🟠";
            case MEDIUM   -> "🟡";
            default       -> "⚪";
        };
    }

    private void logDecisions(List<Decision> decisions) {
        decisions.forEach(d -> log.info("  [{}] sku={} action={} confidence={} | {}",
            d.priority(), d.itemSku(), d.actionType(), String.format("%.2f", d.confidence()), d.reasoning()));
    }
}
