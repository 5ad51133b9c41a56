package com.procureagent.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted decision from an analysis run.
 *
 * Column mapping (R2DBC snake_case convention):
 *   runId               → run_id
 *   itemSku             → item_sku
 *   actionType          → action_type
 *   recommendedQuantity → recommended_quantity
 *   estimatedCost       → estimated_cost
 *   savedAt             → saved_at
 *
 * metadata: JSON-serialised Map<String, Object>
 * All timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("decision_record")
public class DecisionRecord {

    @Id
    private Long id;

    private String runId;

    private String role;

    private String itemSku;

    private String actionType;

    private String priority;

    private double confidence;

    private String reasoning;

    private Integer recommendedQuantity;

    private Double estimatedCost;

    private LocalDateTime deadline;

    /** JSON-serialised {@code Map<String, Object>} */
    private String metadata;

    private LocalDateTime savedAt;
}
