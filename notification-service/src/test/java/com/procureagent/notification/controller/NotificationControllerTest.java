package com.procureagent.notification.controller;

import com.procureagent.common.model.ActionType;
import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.Decision;
import com.procureagent.common.model.Priority;
import com.procureagent.notification.sender.SlackWebhookSender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class NotificationControllerTest {

    private final SlackWebhookSender sender = mock(SlackWebhookSender.class);
    private final WebTestClient client = WebTestClient.bindToController(new NotificationController(sender)).build();

    private static Decision decision(String sku, Priority priority) {
        return new Decision(AgentRole.SUPPLY_CHAIN_MANAGER, sku, ActionType.RESTOCK, priority, 0.7,
                            "Low cover", 40, null, null, null);
    }

    @Test
    @DisplayName("only HIGH and CRITICAL decisions reach the sender")
    @SuppressWarnings("unchecked")
    void filtersRoutineDecisions() {
        client.post().uri("/api/v1/notify/decisions")
            .bodyValue(List.of(decision("A", Priority.LOW), decision("B", Priority.HIGH),
                               decision("C", Priority.MEDIUM), decision("D", Priority.CRITICAL)))
            .exchange()
            .expectStatus().isAccepted();

        ArgumentCaptor<List<Decision>> captor = ArgumentCaptor.forClass(List.class);
        verify(sender).sendDecisions(captor.capture());
        assertEquals(List.of("B", "D"), captor.getValue().stream().map(Decision::itemSku).toList());
    }
}
