package com.procureagent.orchestrator.publisher;

import com.procureagent.common.decision.DecisionEventPublisher;
import com.procureagent.common.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * REST-based implementation of {@link DecisionEventPublisher}.
 *
 * <p>Sends HIGH and CRITICAL decisions to notification-service via HTTP POST
 * (fire-and-forget). Nothing is sent when a run has no escalated decisions.
 */
@Component
public class RestDecisionEventPublisher implements DecisionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestDecisionEventPublisher.class);

    private final WebClient notificationClient;

    public RestDecisionEventPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publish(List<Decision> decisions) {
        List<Decision> escalated = decisions.stream()
            .filter(d -> d.priority().isEscalated())
            .toList();
        if (escalated.isEmpty()) {
            log.debug("No escalated decisions to publish. total={}", decisions.size());
            return;
        }
        notificationClient.post()
            .uri("/api/v1/notify/decisions")
            .bodyValue(escalated)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Decision events published. escalated={} status={}",
                                escalated.size(), r.getStatusCode()),
                err -> log.warn("Decision event publish failed (non-critical). escalated={}",
                                escalated.size(), err)
            );
    }
}
