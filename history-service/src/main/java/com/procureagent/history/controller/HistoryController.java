package com.procureagent.history.controller;

import com.procureagent.common.decision.DecisionBatch;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.history.dto.ArchiveReceipt;
import com.procureagent.history.dto.StoredDecision;
import com.procureagent.history.service.HistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final HistoryService historyService;

    public HistoryController(HistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping("/decisions")
    public Mono<ResponseEntity<ArchiveReceipt>> saveDecisions(@RequestBody DecisionBatch batch) {
        log.info("Received decisions for persistence. runId={} count={}", batch.runId(), batch.decisions().size());
        return historyService.saveDecisions(batch)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Save decisions endpoint error. runId={}", batch.runId(), e));
    }

    @GetMapping("/decisions/{id}")
    public Mono<ResponseEntity<StoredDecision>> decision(@PathVariable Long id) {
        return historyService.findDecision(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /** Decisions for one item (newest first) or one analysis run. */
    @GetMapping("/decisions")
    public Flux<StoredDecision> decisions(@RequestParam(required = false) String sku,
                                          @RequestParam(required = false) String runId) {
        log.info("Decision history query received. sku={} runId={}", sku, runId);
        if (sku != null) {
            return historyService.findDecisionsBySku(sku);
        }
        if (runId != null) {
            return historyService.findDecisionsByRun(runId);
        }
        return Flux.error(new IllegalArgumentException("Query needs either sku or runId"));
    }

    @PostMapping("/negotiations")
    public Mono<ResponseEntity<Void>> saveNegotiation(@RequestBody NegotiationSessionView session) {
        log.info("Received negotiation for persistence. sessionId={} phase={}", session.sessionId(), session.phase());
        return historyService.saveNegotiation(session)
            .then(Mono.just(ResponseEntity.ok().<Void>build()))
            .doOnError(e -> log.error("Save negotiation endpoint error. sessionId={}", session.sessionId(), e));
    }

    @GetMapping("/negotiations/{sessionId}")
    public Mono<ResponseEntity<NegotiationSessionView>> negotiation(@PathVariable String sessionId) {
        return historyService.findNegotiation(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
