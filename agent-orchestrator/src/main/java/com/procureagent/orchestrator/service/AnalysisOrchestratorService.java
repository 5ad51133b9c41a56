package com.procureagent.orchestrator.service;

import com.procureagent.common.decision.DecisionArchive;
import com.procureagent.common.decision.DecisionEventPublisher;
import com.procureagent.common.decision.DecisionValidator;
import com.procureagent.common.inventory.InventoryInsights;
import com.procureagent.common.inventory.InventorySnapshot;
import com.procureagent.common.inventory.ReorderQuantityCalculator;
import com.procureagent.common.inventory.ReorderSuggestion;
import com.procureagent.common.inventory.UrgencyClassifier;
import com.procureagent.common.llm.TextGenerationClient;
import com.procureagent.common.model.ActionType;
import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.Decision;
import com.procureagent.common.model.InventoryItem;
import com.procureagent.common.model.Priority;
import com.procureagent.common.model.SalesRecord;
import com.procureagent.orchestrator.logger.AnalysisFlowLogger;
import com.procureagent.orchestrator.model.AnalysisReport;
import com.procureagent.orchestrator.model.AnalysisRequest;
import com.procureagent.orchestrator.model.ItemPriority;
import com.procureagent.orchestrator.prompt.RecommendationPromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Composition root of a batch analysis pass:
 * classify → build role prompt → generate text → validate → enrich → archive → notify.
 *
 * <p>The run never fails because of the text-generation collaborator: its error
 * description is handed to the validator as raw text, which yields the fallback decision.
 * Archiving and notification are fire-and-forget.
 */
@Service
public class AnalysisOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestratorService.class);

    private final RecommendationPromptBuilder promptBuilder;
    private final TextGenerationClient textGeneration;
    private final DecisionValidator validator;
    private final DecisionArchive decisionArchive;
    private final DecisionEventPublisher eventPublisher;
    private final AnalysisFlowLogger flowLogger;
    private final Clock clock;

    public AnalysisOrchestratorService(RecommendationPromptBuilder promptBuilder,
                                       TextGenerationClient textGeneration,
                                       DecisionValidator validator,
                                       DecisionArchive decisionArchive,
                                       DecisionEventPublisher eventPublisher,
                                       AnalysisFlowLogger flowLogger,
                                       Clock clock) {
        this.promptBuilder   = promptBuilder;
        this.textGeneration  = textGeneration;
        this.validator       = validator;
        this.decisionArchive = decisionArchive;
        this.eventPublisher  = eventPublisher;
        this.flowLogger      = flowLogger;
        this.clock           = clock;
    }

    public Mono<AnalysisReport> analyze(AnalysisRequest request) {
        return Mono.defer(() -> {
            requireItems(request);
            String runId = "run-" + UUID.randomUUID();
            AgentRole role = request.role() == null ? AgentRole.SUPPLY_CHAIN_MANAGER : request.role();
            flowLogger.stage(AnalysisFlowLogger.RUN_STARTED, runId,
                "role=" + role + " items=" + request.items().size() + " salesRecords=" + request.sales().size());

            List<ItemPriority> priorities = classify(request.items(), request.sales());
            InventorySnapshot snapshot = InventoryInsights.snapshot(request.items());
            flowLogger.stage(AnalysisFlowLogger.ITEMS_CLASSIFIED, runId,
                "critical=" + priorities.stream().filter(p -> p.priority() == Priority.CRITICAL).count()
                + " outOfStock=" + snapshot.outOfStockCount()
                + " lowStock=" + snapshot.lowStockCount());

            String system = promptBuilder.systemInstruction(role);
            String prompt = promptBuilder.prompt(role, priorities, request.items(), request.sales(), request.context());

            return textGeneration.generate(prompt, system)
                .onErrorResume(e -> {
                    log.warn("Text generation failed, validator will fall back. runId={} reason={}",
                             runId, e.getMessage());
                    return Mono.just("Text generation failed: " + e.getMessage());
                })
                .defaultIfEmpty("")
                .doOnNext(raw -> flowLogger.stage(AnalysisFlowLogger.TEXT_GENERATED, runId, "chars=" + raw.length()))
                .map(raw -> validator.parse(raw, role))
                .map(decisions -> withReorderSuggestions(decisions, request.items(), request.sales()))
                .doOnNext(decisions -> flowLogger.stage(AnalysisFlowLogger.DECISIONS_VALIDATED, runId,
                    "decisions=" + decisions.size()))
                .map(decisions -> new AnalysisReport(runId, role, priorities, snapshot, decisions, clock.instant()))
                .doOnNext(report -> {
                    decisionArchive.archive(runId, report.decisions());
                    eventPublisher.publish(report.decisions());
                    flowLogger.stage(AnalysisFlowLogger.EVENTS_DISPATCHED, runId,
                        "escalated=" + report.decisions().stream().filter(d -> d.priority().isEscalated()).count());
                });
        });
    }

    /**
     * Tags every item with its urgency, most urgent first. Items of equal urgency keep
     * their input order.
     */
    public List<ItemPriority> classify(List<InventoryItem> items, List<SalesRecord> sales) {
        List<ItemPriority> priorities = new ArrayList<>(items.size());
        for (InventoryItem item : items) {
            priorities.add(new ItemPriority(item.sku(), item.name(), item.currentStock(), item.minThreshold(),
                item.leadTimeDays(), UrgencyClassifier.classify(item, sales)));
        }
        priorities.sort(Comparator.comparing(ItemPriority::priority).reversed());
        return priorities;
    }

    /** RESTOCK decisions without a quantity get the calculator's suggestion. */
    List<Decision> withReorderSuggestions(List<Decision> decisions, List<InventoryItem> items,
                                          List<SalesRecord> sales) {
        Map<String, InventoryItem> bySku = new LinkedHashMap<>();
        items.forEach(item -> bySku.putIfAbsent(item.sku(), item));

        List<Decision> enriched = new ArrayList<>(decisions.size());
        for (Decision decision : decisions) {
            InventoryItem item = bySku.get(decision.itemSku());
            if (decision.actionType() != ActionType.RESTOCK || decision.recommendedQuantity() != null || item == null) {
                enriched.add(decision);
                continue;
            }
            ReorderSuggestion suggestion = ReorderQuantityCalculator.suggest(item, sales);
            log.debug("Reorder suggestion attached. sku={} quantity={} confidence={}",
                      item.sku(), suggestion.quantity(), suggestion.confidence());
            enriched.add(suggestion.quantity() > 0 ? decision.withRecommendedQuantity(suggestion.quantity()) : decision);
        }
        return enriched;
    }

    private static void requireItems(AnalysisRequest request) {
        if (request == null || request.items() == null || request.items().isEmpty()) {
            throw new IllegalArgumentException("At least one inventory item is required");
        }
    }
}
