package com.procureagent.common.decision;

import com.procureagent.common.model.Decision;

import java.util.List;

/**
 * Decisions of one analysis run, as exchanged between the orchestrator and the history store.
 */
public record DecisionBatch(String runId, List<Decision> decisions) {

    public DecisionBatch {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }
}
