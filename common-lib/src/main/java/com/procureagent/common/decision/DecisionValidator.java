package com.procureagent.common.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureagent.common.model.ActionType;
import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.Decision;
import com.procureagent.common.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns free-form recommendation text into validated {@link Decision} records.
 *
 * <p>Expected payload: {@code {"decisions": [...], "summary": "..."}}. Parsing runs as an
 * ordered sequence of attempts:
 * <ol>
 *   <li>strict parse of the text with Markdown code fences removed</li>
 *   <li>strict parse of the outermost balanced {@code {...}} block found in the text</li>
 *   <li>a single synthetic ALERT/MEDIUM decision for sku {@code SYSTEM}</li>
 * </ol>
 *
 * <p>Entries that fail coercion are skipped and logged; the rest of the batch survives.
 * {@link #parse(String)} never throws and never returns an empty list.
 */
public class DecisionValidator {

    private static final Logger log = LoggerFactory.getLogger(DecisionValidator.class);

    static final String FALLBACK_SKU        = "SYSTEM";
    static final double FALLBACK_CONFIDENCE = 0.3;
    static final double DEFAULT_CONFIDENCE  = 0.5;
    static final int    RAW_EXCERPT_LENGTH  = 200;

    private static final Set<String> KNOWN_FIELDS = Set.of(
        "item_sku", "action_type", "priority", "confidence_score", "reasoning",
        "recommended_quantity", "estimated_cost", "deadline");

    // Tried in order; local values are read as UTC
    private static final List<Function<String, Instant>> DEADLINE_FORMATS = List.of(
        Instant::parse,
        s -> OffsetDateTime.parse(s).toInstant(),
        s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
        s -> LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC));

    private final ObjectMapper objectMapper;

    public DecisionValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Decision> parse(String rawText) {
        return parse(rawText, AgentRole.SUPPLY_CHAIN_MANAGER);
    }

    public List<Decision> parse(String rawText, AgentRole role) {
        String raw = rawText == null ? "" : rawText;
        AgentRole effectiveRole = role == null ? AgentRole.SUPPLY_CHAIN_MANAGER : role;

        String cleaned = stripCodeFences(raw);
        ParseAttempt attempt = strictParse("strict", cleaned);
        if (!attempt.succeeded()) {
            log.debug("[DecisionValidator] Strict parse failed, trying brace extraction. reason={}", attempt.error());
            attempt = extractBraces(cleaned)
                .map(block -> strictParse("extracted", block))
                .orElseGet(() -> ParseAttempt.failure("extracted", "No JSON object found in response"));
        }
        if (!attempt.succeeded()) {
            log.warn("[DecisionValidator] Unparseable response, using fallback decision. role={} reason={}",
                     effectiveRole, attempt.error());
            return List.of(fallback(effectiveRole, raw, attempt.error()));
        }

        List<Decision> decisions = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : attempt.entries()) {
            try {
                decisions.add(coerce(entry, attempt.summary(), effectiveRole));
            } catch (DecisionParseException | IllegalArgumentException e) {
                log.warn("[DecisionValidator] Skipping malformed decision entry. index={} reason={}",
                         index, e.getMessage());
            }
            index++;
        }

        if (decisions.isEmpty()) {
            log.warn("[DecisionValidator] No usable decision entries, using fallback decision. role={} entries={}",
                     effectiveRole, index);
            return List.of(fallback(effectiveRole, raw, "No valid decisions in response"));
        }
        log.info("[DecisionValidator] Parsed decisions. role={} count={} skipped={} stage={}",
                 effectiveRole, decisions.size(), index - decisions.size(), attempt.stage());
        return decisions;
    }

    // ── parse attempts ────────────────────────────────────────────────────

    private ParseAttempt strictParse(String stage, String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return ParseAttempt.failure(stage, "Invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ParseAttempt.failure(stage, "Payload is not a JSON object");
        }
        if (!root.path("decisions").isArray()) {
            return ParseAttempt.failure(stage, "Payload has no 'decisions' array");
        }
        return ParseAttempt.success(stage, root);
    }

    static String stripCodeFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline < 0 ? cleaned.substring(3) : cleaned.substring(firstNewline + 1);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    /**
     * Outermost balanced {@code {...}} block starting at the first opening brace, ignoring
     * braces inside string literals. An unbalanced text falls back to the span between the
     * first {@code '{'} and the last {@code '}'}.
     */
    static Optional<String> extractBraces(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped  = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped)          escaped = false;
                else if (c == '\\')   escaped = true;
                else if (c == '"')    inString = false;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        int end = text.lastIndexOf('}');
        return end > start ? Optional.of(text.substring(start, end + 1)) : Optional.empty();
    }

    // ── entry coercion ────────────────────────────────────────────────────

    private Decision coerce(JsonNode entry, String summary, AgentRole role) {
        if (entry == null || !entry.isObject()) {
            throw new DecisionParseException("Entry is not a JSON object");
        }

        String sku = entry.hasNonNull("item_sku") ? entry.get("item_sku").asText() : "UNKNOWN";
        String reasoning = entry.hasNonNull("reasoning") ? entry.get("reasoning").asText() : "No reasoning provided";

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (summary != null) {
            metadata.put("summary", summary);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                metadata.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }

        Double quantity = nonNegativeNumber(entry, "recommended_quantity");
        if (quantity != null && Math.round(quantity) > Integer.MAX_VALUE) {
            throw new DecisionParseException("Field 'recommended_quantity' is out of range: " + quantity);
        }
        return new Decision(
            role,
            sku,
            actionType(entry.path("action_type")),
            priority(entry.path("priority")),
            confidence(entry.path("confidence_score")),
            reasoning,
            quantity == null ? null : (int) Math.round(quantity),
            nonNegativeNumber(entry, "estimated_cost"),
            deadline(entry.path("deadline")),
            metadata);
    }

    static ActionType actionType(JsonNode node) {
        String key = normalise(node);
        if (key != null) {
            for (ActionType type : ActionType.values()) {
                if (type.name().equals(key)) {
                    return type;
                }
            }
        }
        return ActionType.ALERT;
    }

    static Priority priority(JsonNode node) {
        String key = normalise(node);
        if (key != null) {
            for (Priority p : Priority.values()) {
                if (p.name().equals(key)) {
                    return p;
                }
            }
        }
        return Priority.MEDIUM;
    }

    static double confidence(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** Null when absent or negative; a non-numeric value fails the whole entry. */
    static Double nonNegativeNumber(JsonNode entry, String field) {
        JsonNode node = entry.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new DecisionParseException("Field '" + field + "' is not numeric: " + node.asText());
            }
        } else {
            throw new DecisionParseException("Field '" + field + "' is not numeric: " + node);
        }
        if (!Double.isFinite(value)) {
            throw new DecisionParseException("Field '" + field + "' is not finite: " + value);
        }
        return value < 0 ? null : value;
    }

    static Instant deadline(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        String text = node.asText().trim();
        for (Function<String, Instant> format : DEADLINE_FORMATS) {
            try {
                return format.apply(text);
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return null;
    }

    private static String normalise(JsonNode node) {
        if (!node.isValueNode() || node.isNull()) {
            return null;
        }
        return node.asText().trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    // ── fallback ──────────────────────────────────────────────────────────

    private static Decision fallback(AgentRole role, String raw, String error) {
        String excerpt = raw.length() <= RAW_EXCERPT_LENGTH ? raw : raw.substring(0, RAW_EXCERPT_LENGTH);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error", error);
        metadata.put("raw_response", raw);
        return new Decision(
            role,
            FALLBACK_SKU,
            ActionType.ALERT,
            Priority.MEDIUM,
            FALLBACK_CONFIDENCE,
            "Failed to parse agent response. Raw response: " + excerpt + "...",
            null,
            null,
            null,
            metadata);
    }
}
