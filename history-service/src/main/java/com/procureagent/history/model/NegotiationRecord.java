package com.procureagent.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted snapshot of a finished negotiation session.
 *
 * messages: JSON-serialised List<NegotiationMessage>
 * All timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("negotiation_record")
public class NegotiationRecord {

    @Id
    private Long id;

    private String sessionId;

    private String itemSku;

    private String vendorId;

    private String vendorName;

    private int quantity;

    private double initialPrice;

    private double targetPrice;

    private Double currentOffer;

    private Double savings;

    private String phase;

    private int roundCount;

    private int failedRounds;

    private String lastFailure;

    /** JSON-serialised {@code List<NegotiationMessage>} */
    private String messages;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime savedAt;
}
