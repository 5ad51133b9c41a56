package com.procureagent.orchestrator.logger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Logs each stage of an analysis run without touching pipeline behaviour.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #RUN_STARTED}          request accepted, run id assigned</li>
 *   <li>{@link #ITEMS_CLASSIFIED}     urgency assigned to every item</li>
 *   <li>{@link #TEXT_GENERATED}       recommendation text received (or replaced by the failure description)</li>
 *   <li>{@link #DECISIONS_VALIDATED}  text turned into structured decisions</li>
 *   <li>{@link #EVENTS_DISPATCHED}    decisions archived and escalations published</li>
 * </ol>
 *
 * <p>The run id is bridged into MDC only for the duration of each log call, since the
 * reactive pipeline may hop threads between stages.
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String RUN_ID_KEY = "runId";

    public static final String RUN_STARTED         = "RUN_STARTED";
    public static final String ITEMS_CLASSIFIED    = "ITEMS_CLASSIFIED";
    public static final String TEXT_GENERATED      = "TEXT_GENERATED";
    public static final String DECISIONS_VALIDATED = "DECISIONS_VALIDATED";
    public static final String EVENTS_DISPATCHED   = "EVENTS_DISPATCHED";

    public void stage(String stageName, String runId, String detail) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(RUN_ID_KEY, runId)) {
            log.info("[AnalysisFlow] stage={} runId={} {}", stageName, runId, detail);
        }
    }
}
