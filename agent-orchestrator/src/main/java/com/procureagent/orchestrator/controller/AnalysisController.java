package com.procureagent.orchestrator.controller;

import com.procureagent.orchestrator.model.AnalysisReport;
import com.procureagent.orchestrator.model.AnalysisRequest;
import com.procureagent.orchestrator.model.ItemPriority;
import com.procureagent.orchestrator.service.AnalysisOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisOrchestratorService orchestratorService;

    public AnalysisController(AnalysisOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<AnalysisReport>> run(@RequestBody AnalysisRequest request) {
        log.info("Analysis run requested. role={} items={}",
                 request.role(), request.items() == null ? 0 : request.items().size());
        return orchestratorService.analyze(request)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Analysis run endpoint error. role={}", request.role(), e));
    }

    /** Urgency classification only; no text generation, nothing archived. */
    @PostMapping("/classify")
    public Mono<List<ItemPriority>> classify(@RequestBody AnalysisRequest request) {
        return Mono.fromCallable(() -> {
            if (request.items() == null || request.items().isEmpty()) {
                throw new IllegalArgumentException("At least one inventory item is required");
            }
            return orchestratorService.classify(request.items(), request.sales());
        });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
