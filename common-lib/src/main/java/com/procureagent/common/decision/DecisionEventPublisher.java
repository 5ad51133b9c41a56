package com.procureagent.common.decision;

import com.procureagent.common.model.Decision;

import java.util.List;

/**
 * Hands escalated decisions to the notification dispatcher after an analysis run.
 *
 * <p>Current implementation: {@code RestDecisionEventPublisher} posts to
 * notification-service (fire-and-forget WebClient call).
 */
public interface DecisionEventPublisher {

    /**
     * Publish decisions for best-effort delivery.
     * Implementations MUST be non-blocking and MUST NOT propagate delivery failures.
     *
     * @param decisions decisions of one run; implementations filter on priority
     */
    void publish(List<Decision> decisions);
}
