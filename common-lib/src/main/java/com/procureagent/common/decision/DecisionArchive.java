package com.procureagent.common.decision;

import com.procureagent.common.model.Decision;

import java.util.List;

/**
 * Durable storage for the decisions of an analysis run. Fire-and-forget: failures are
 * logged by the implementation and never reach the caller.
 */
public interface DecisionArchive {

    void archive(String runId, List<Decision> decisions);
}
