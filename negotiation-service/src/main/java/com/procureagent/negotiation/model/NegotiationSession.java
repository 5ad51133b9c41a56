package com.procureagent.negotiation.model;

import com.procureagent.common.model.Offer;
import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationPhase;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.common.negotiation.SenderKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one buyer/vendor negotiation.
 *
 * <p>Every mutation must happen while holding {@link #lock()}. {@code phase} and
 * {@code lastActivity} are volatile so the session store can read them for the
 * active-index check without taking the session lock.
 */
public class NegotiationSession {

    private final String id;
    private final String itemSku;
    private final Vendor vendor;
    private final int quantity;
    private final double initialPrice;
    private final double targetPrice;
    private final Offer baselineOffer;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<NegotiationMessage> messages = new ArrayList<>();

    private volatile NegotiationPhase phase = NegotiationPhase.INITIATED;
    private volatile Instant lastActivity;
    private Double currentOffer;
    private int roundCount;
    private int failedRounds;
    private String lastFailure;

    public NegotiationSession(String id, String itemSku, Vendor vendor, int quantity,
                              double initialPrice, double targetPrice, Offer baselineOffer, Instant createdAt) {
        this.id            = id;
        this.itemSku       = itemSku;
        this.vendor        = vendor;
        this.quantity      = quantity;
        this.initialPrice  = initialPrice;
        this.targetPrice   = targetPrice;
        this.baselineOffer = baselineOffer;
        this.createdAt     = createdAt;
        this.lastActivity  = createdAt;
    }

    public NegotiationMessage append(SenderKind sender, String content, Double extractedPrice, Instant at) {
        NegotiationMessage message = new NegotiationMessage(id, sender, content, at, extractedPrice);
        messages.add(message);
        lastActivity = at;
        return message;
    }

    public int incrementRound() {
        return ++roundCount;
    }

    public void recordFailure(String reason) {
        failedRounds++;
        lastFailure = reason;
    }

    /** True when the newest buyer/vendor message came from the buyer and is still unanswered. */
    public boolean awaitingVendorReply() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            SenderKind sender = messages.get(i).sender();
            if (sender != SenderKind.SYSTEM) {
                return sender == SenderKind.BUYER;
            }
        }
        return false;
    }

    public Double savings() {
        return currentOffer == null ? null : initialPrice - currentOffer;
    }

    public String indexKey() {
        return indexKey(itemSku, vendor.vendorId());
    }

    public static String indexKey(String itemSku, String vendorId) {
        return itemSku + "::" + vendorId;
    }

    public NegotiationSessionView view() {
        return new NegotiationSessionView(id, itemSku, vendor.vendorId(), vendor.company(), quantity,
            initialPrice, targetPrice, currentOffer, savings(), phase, roundCount, failedRounds,
            lastFailure, messages, createdAt, lastActivity);
    }

    public ReentrantLock lock()             { return lock; }
    public String getId()                   { return id; }
    public String getItemSku()              { return itemSku; }
    public Vendor getVendor()               { return vendor; }
    public int getQuantity()                { return quantity; }
    public double getInitialPrice()         { return initialPrice; }
    public double getTargetPrice()          { return targetPrice; }
    public Offer getBaselineOffer()         { return baselineOffer; }
    public Instant getCreatedAt()           { return createdAt; }
    public Instant getLastActivity()        { return lastActivity; }
    public NegotiationPhase getPhase()      { return phase; }
    public void setPhase(NegotiationPhase phase) { this.phase = phase; }
    public Double getCurrentOffer()         { return currentOffer; }
    public void setCurrentOffer(Double currentOffer) { this.currentOffer = currentOffer; }
    public int getRoundCount()              { return roundCount; }
    public int getFailedRounds()            { return failedRounds; }
    public String getLastFailure()          { return lastFailure; }
    public List<NegotiationMessage> getMessages() { return List.copyOf(messages); }
    public int getMessageCount()            { return messages.size(); }
}
