package com.procureagent.negotiation.client;

import com.procureagent.common.negotiation.NegotiationSessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based implementation of {@link NegotiationArchive}.
 *
 * <p>Posts the finished session to history-service (fire-and-forget).
 * Delivery failures are logged and dropped.
 */
public class HistoryNegotiationArchive implements NegotiationArchive {

    private static final Logger log = LoggerFactory.getLogger(HistoryNegotiationArchive.class);

    private final WebClient historyClient;

    public HistoryNegotiationArchive(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public void archive(NegotiationSessionView session) {
        historyClient.post()
            .uri("/api/v1/history/negotiations")
            .bodyValue(session)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Negotiation archived. sessionId={} phase={} status={}",
                                session.sessionId(), session.phase(), r.getStatusCode()),
                err -> log.warn("Negotiation archive failed (non-critical). sessionId={}",
                                session.sessionId(), err)
            );
    }
}
