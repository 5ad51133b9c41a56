package com.procureagent.common.decision;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one structural parse attempt: either a payload whose {@code decisions}
 * field is an array, or the reason the attempt failed.
 */
record ParseAttempt(String stage, JsonNode payload, String error) {

    static ParseAttempt success(String stage, JsonNode payload) {
        return new ParseAttempt(stage, payload, null);
    }

    static ParseAttempt failure(String stage, String error) {
        return new ParseAttempt(stage, null, error);
    }

    boolean succeeded() {
        return payload != null;
    }

    JsonNode entries() {
        return payload.path("decisions");
    }

    String summary() {
        JsonNode summary = payload.path("summary");
        return summary.isValueNode() ? summary.asText() : null;
    }
}
