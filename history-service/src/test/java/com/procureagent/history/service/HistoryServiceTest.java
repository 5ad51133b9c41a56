package com.procureagent.history.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.procureagent.common.decision.DecisionBatch;
import com.procureagent.common.model.ActionType;
import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.Decision;
import com.procureagent.common.model.Priority;
import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationPhase;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.common.negotiation.SenderKind;
import com.procureagent.history.model.DecisionRecord;
import com.procureagent.history.model.NegotiationRecord;
import com.procureagent.history.repository.DecisionRecordRepository;
import com.procureagent.history.repository.NegotiationRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HistoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-20T12:00:00Z");

    private final DecisionRecordRepository decisionRepository = mock(DecisionRecordRepository.class);
    private final NegotiationRecordRepository negotiationRepository = mock(NegotiationRecordRepository.class);
    private final HistoryService service = new HistoryService(decisionRepository, negotiationRepository,
        objectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static Decision decision(String sku) {
        return new Decision(AgentRole.PROCUREMENT_SPECIALIST, sku, ActionType.RESTOCK, Priority.HIGH, 0.82,
            "Below threshold", 120, 1440.0, Instant.parse("2026-05-25T00:00:00Z"), Map.of("summary", "Restock pens"));
    }

    @Test
    @DisplayName("saving a batch persists one row per decision and returns their ids")
    void saveDecisions() {
        AtomicLong ids = new AtomicLong();
        when(decisionRepository.save(any(DecisionRecord.class))).thenAnswer(invocation -> {
            DecisionRecord record = invocation.getArgument(0);
            record.setId(ids.incrementAndGet());
            return Mono.just(record);
        });

        StepVerifier.create(service.saveDecisions(new DecisionBatch("run-1", List.of(decision("PEN-1"), decision("PEN-2")))))
            .assertNext(receipt -> {
                assertEquals("run-1", receipt.runId());
                assertEquals(List.of(1L, 2L), receipt.ids());
            })
            .verifyComplete();

        ArgumentCaptor<DecisionRecord> captor = ArgumentCaptor.forClass(DecisionRecord.class);
        verify(decisionRepository, times(2)).save(captor.capture());
        DecisionRecord first = captor.getAllValues().get(0);
        assertEquals("PROCUREMENT_SPECIALIST", first.getRole());
        assertEquals("RESTOCK", first.getActionType());
        assertEquals(LocalDateTime.of(2026, 5, 25, 0, 0), first.getDeadline());
        assertEquals(LocalDateTime.of(2026, 5, 20, 12, 0), first.getSavedAt());
        assertTrue(first.getMetadata().contains("Restock pens"));
    }

    @Test
    @DisplayName("a batch without run id is rejected before touching the repository")
    void saveDecisionsWithoutRunId() {
        StepVerifier.create(service.saveDecisions(new DecisionBatch(" ", List.of(decision("PEN-1")))))
            .expectError(IllegalArgumentException.class)
            .verify();
        verify(decisionRepository, never()).save(any(DecisionRecord.class));
    }

    @Test
    @DisplayName("a stored row maps back to the original decision")
    void findDecision() {
        DecisionRecord record = new DecisionRecord();
        record.setId(7L);
        record.setRunId("run-9");
        record.setRole("INVENTORY_ANALYST");
        record.setItemSku("NB-A4-200");
        record.setActionType("HOLD");
        record.setPriority("LOW");
        record.setConfidence(0.6);
        record.setReasoning("Enough cover");
        record.setMetadata("{\"summary\":\"fine\"}");
        record.setSavedAt(LocalDateTime.of(2026, 5, 20, 12, 0));
        when(decisionRepository.findById(7L)).thenReturn(Mono.just(record));

        StepVerifier.create(service.findDecision(7L))
            .assertNext(stored -> {
                assertEquals("run-9", stored.runId());
                assertEquals(ActionType.HOLD, stored.decision().actionType());
                assertEquals(AgentRole.INVENTORY_ANALYST, stored.decision().role());
                assertNull(stored.decision().deadline());
                assertEquals("fine", stored.decision().metadata().get("summary"));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("negotiation snapshot keeps its message history")
    void negotiationRoundTripThroughEntity() {
        Instant t0 = Instant.parse("2026-05-20T11:00:00Z");
        NegotiationSessionView view = new NegotiationSessionView("neg-42", "PEN-BLUE-001", "modern_office",
            "Modern Office Solutions", 100, 12.0, 10.0, 10.4, 1.6, NegotiationPhase.AGREED, 3, 1, "HTTP 503",
            List.of(new NegotiationMessage("neg-42", SenderKind.BUYER, "₹10 please", t0, 10.0),
                    new NegotiationMessage("neg-42", SenderKind.VENDOR, "₹10.40 and we have a deal", t0, 10.4)),
            t0, t0.plusSeconds(600));
        ArgumentCaptor<NegotiationRecord> captor = ArgumentCaptor.forClass(NegotiationRecord.class);
        when(negotiationRepository.save(captor.capture())).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(service.saveNegotiation(view))
            .assertNext(saved -> assertEquals("AGREED", saved.getPhase()))
            .verifyComplete();

        when(negotiationRepository.findFirstBySessionIdOrderBySavedAtDesc("neg-42"))
            .thenReturn(Mono.just(captor.getValue()));
        StepVerifier.create(service.findNegotiation("neg-42"))
            .assertNext(restored -> assertEquals(view, restored))
            .verifyComplete();
    }
}
