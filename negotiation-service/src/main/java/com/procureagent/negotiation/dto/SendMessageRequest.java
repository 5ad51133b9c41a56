package com.procureagent.negotiation.dto;

import com.procureagent.common.negotiation.SenderKind;

/**
 * Request body for POST /api/v1/negotiations/{id}/messages. {@code sender} defaults to BUYER.
 */
public record SendMessageRequest(SenderKind sender, String content) {

    public SenderKind senderOrDefault() {
        return sender == null ? SenderKind.BUYER : sender;
    }
}
