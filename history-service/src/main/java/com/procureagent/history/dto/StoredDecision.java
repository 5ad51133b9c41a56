package com.procureagent.history.dto;

import com.procureagent.common.model.Decision;

import java.time.LocalDateTime;

public record StoredDecision(
    Long id,
    String runId,
    Decision decision,
    LocalDateTime savedAt
) {}
