package com.procureagent.history.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureagent.common.decision.DecisionBatch;
import com.procureagent.common.model.ActionType;
import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.Decision;
import com.procureagent.common.model.Priority;
import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationPhase;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.history.dto.ArchiveReceipt;
import com.procureagent.history.dto.StoredDecision;
import com.procureagent.history.model.DecisionRecord;
import com.procureagent.history.model.NegotiationRecord;
import com.procureagent.history.repository.DecisionRecordRepository;
import com.procureagent.history.repository.NegotiationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Persistence store for analysis decisions and finished negotiation sessions.
 * Structured fields are stored as columns; nested maps and message lists as JSON text.
 */
@Service
public class HistoryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<NegotiationMessage>> MESSAGES_TYPE = new TypeReference<>() {};

    private final DecisionRecordRepository decisionRepository;
    private final NegotiationRecordRepository negotiationRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HistoryService(DecisionRecordRepository decisionRepository,
                          NegotiationRecordRepository negotiationRepository,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.decisionRepository    = decisionRepository;
        this.negotiationRepository = negotiationRepository;
        this.objectMapper          = objectMapper;
        this.clock                 = clock;
    }

    // ── decisions ────────────────────────────────────────────────────────────

    public Mono<ArchiveReceipt> saveDecisions(DecisionBatch batch) {
        if (batch == null || batch.runId() == null || batch.runId().isBlank()) {
            return Mono.error(new IllegalArgumentException("Decision batch needs a run id"));
        }
        LocalDateTime savedAt = LocalDateTime.now(clock);
        return Flux.fromIterable(batch.decisions())
            .map(decision -> toEntity(batch.runId(), decision, savedAt))
            .concatMap(decisionRepository::save)
            .map(DecisionRecord::getId)
            .collectList()
            .map(ids -> new ArchiveReceipt(batch.runId(), ids))
            .doOnSuccess(r -> log.info("Decisions persisted. runId={} count={}", r.runId(), r.ids().size()))
            .doOnError(e -> log.error("Failed to persist decisions. runId={}", batch.runId(), e));
    }

    public Mono<StoredDecision> findDecision(Long id) {
        return decisionRepository.findById(id).map(this::toStored);
    }

    public Flux<StoredDecision> findDecisionsBySku(String itemSku) {
        return decisionRepository.findByItemSkuOrderBySavedAtDesc(itemSku).map(this::toStored);
    }

    public Flux<StoredDecision> findDecisionsByRun(String runId) {
        return decisionRepository.findByRunId(runId).map(this::toStored);
    }

    // ── negotiations ─────────────────────────────────────────────────────────

    public Mono<NegotiationRecord> saveNegotiation(NegotiationSessionView session) {
        if (session == null || session.sessionId() == null) {
            return Mono.error(new IllegalArgumentException("Negotiation session id is required"));
        }
        return Mono.fromCallable(() -> toEntity(session))
            .flatMap(negotiationRepository::save)
            .doOnSuccess(r -> log.info("Negotiation persisted. id={} sessionId={} phase={} currentOffer={}",
                                       r.getId(), r.getSessionId(), r.getPhase(), r.getCurrentOffer()))
            .doOnError(e -> log.error("Failed to persist negotiation. sessionId={}", session.sessionId(), e));
    }

    public Mono<NegotiationSessionView> findNegotiation(String sessionId) {
        return negotiationRepository.findFirstBySessionIdOrderBySavedAtDesc(sessionId).map(this::toView);
    }

    // ── mapping ──────────────────────────────────────────────────────────────

    private DecisionRecord toEntity(String runId, Decision decision, LocalDateTime savedAt) {
        DecisionRecord entity = new DecisionRecord();
        entity.setRunId(runId);
        entity.setRole(decision.role().name());
        entity.setItemSku(decision.itemSku());
        entity.setActionType(decision.actionType().name());
        entity.setPriority(decision.priority().name());
        entity.setConfidence(decision.confidence());
        entity.setReasoning(decision.reasoning());
        entity.setRecommendedQuantity(decision.recommendedQuantity());
        entity.setEstimatedCost(decision.estimatedCost());
        entity.setDeadline(toUtc(decision.deadline()));
        entity.setMetadata(write(decision.metadata()));
        entity.setSavedAt(savedAt);
        return entity;
    }

    private StoredDecision toStored(DecisionRecord r) {
        Decision decision = new Decision(
            AgentRole.valueOf(r.getRole()),
            r.getItemSku(),
            ActionType.valueOf(r.getActionType()),
            Priority.valueOf(r.getPriority()),
            r.getConfidence(),
            r.getReasoning(),
            r.getRecommendedQuantity(),
            r.getEstimatedCost(),
            r.getDeadline() == null ? null : r.getDeadline().toInstant(ZoneOffset.UTC),
            read(r.getMetadata(), METADATA_TYPE));
        return new StoredDecision(r.getId(), r.getRunId(), decision, r.getSavedAt());
    }

    private NegotiationRecord toEntity(NegotiationSessionView s) {
        NegotiationRecord entity = new NegotiationRecord();
        entity.setSessionId(s.sessionId());
        entity.setItemSku(s.itemSku());
        entity.setVendorId(s.vendorId());
        entity.setVendorName(s.vendorName());
        entity.setQuantity(s.quantity());
        entity.setInitialPrice(s.initialPrice());
        entity.setTargetPrice(s.targetPrice());
        entity.setCurrentOffer(s.currentOffer());
        entity.setSavings(s.savings());
        entity.setPhase(s.phase().name());
        entity.setRoundCount(s.roundCount());
        entity.setFailedRounds(s.failedRounds());
        entity.setLastFailure(s.lastFailure());
        entity.setMessages(write(s.messages()));
        entity.setCreatedAt(toUtc(s.createdAt()));
        entity.setUpdatedAt(toUtc(s.updatedAt()));
        entity.setSavedAt(LocalDateTime.now(clock));
        return entity;
    }

    private NegotiationSessionView toView(NegotiationRecord r) {
        return new NegotiationSessionView(
            r.getSessionId(), r.getItemSku(), r.getVendorId(), r.getVendorName(), r.getQuantity(),
            r.getInitialPrice(), r.getTargetPrice(), r.getCurrentOffer(), r.getSavings(),
            NegotiationPhase.valueOf(r.getPhase()), r.getRoundCount(), r.getFailedRounds(), r.getLastFailure(),
            read(r.getMessages(), MESSAGES_TYPE),
            r.getCreatedAt() == null ? null : r.getCreatedAt().toInstant(ZoneOffset.UTC),
            r.getUpdatedAt() == null ? null : r.getUpdatedAt().toInstant(ZoneOffset.UTC));
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise value for persistence", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored JSON column is unreadable", e);
        }
    }
}
