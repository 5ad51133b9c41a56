package com.procureagent.orchestrator.client;

import com.procureagent.common.decision.DecisionArchive;
import com.procureagent.common.decision.DecisionBatch;
import com.procureagent.common.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Posts the decisions of a run to history-service (fire-and-forget).
 */
@Component
public class HistoryDecisionArchive implements DecisionArchive {

    private static final Logger log = LoggerFactory.getLogger(HistoryDecisionArchive.class);

    private final WebClient historyClient;

    public HistoryDecisionArchive(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public void archive(String runId, List<Decision> decisions) {
        historyClient.post()
            .uri("/api/v1/history/decisions")
            .bodyValue(new DecisionBatch(runId, decisions))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Decisions archived. runId={} count={} status={}",
                                runId, decisions.size(), r.getStatusCode()),
                err -> log.warn("Decision archive failed (non-critical). runId={}", runId, err)
            );
    }
}
