package com.procureagent.negotiation.service;

import com.procureagent.common.evaluation.EvaluationSettings;
import com.procureagent.common.evaluation.OfferEvaluator;
import com.procureagent.common.exception.InvalidOfferException;
import com.procureagent.common.exception.SessionClosedException;
import com.procureagent.common.model.Offer;
import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationPhase;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.common.negotiation.SenderKind;
import com.procureagent.negotiation.client.NegotiationArchive;
import com.procureagent.negotiation.config.NegotiationSettings;
import com.procureagent.negotiation.model.NegotiationSession;
import com.procureagent.negotiation.model.NegotiationStats;
import com.procureagent.negotiation.model.NegotiationSummary;
import com.procureagent.negotiation.model.RoundResult;
import com.procureagent.negotiation.model.RoundStatus;
import com.procureagent.negotiation.model.Vendor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Drives buyer/vendor negotiation sessions through
 * {@code INITIATED → ACTIVE → {AGREED | FAILED | EXPIRED}}.
 *
 * <p><strong>Concurrency</strong>: every operation on a session runs under that session's
 * lock, so rounds on one session never interleave while different sessions proceed in
 * parallel. The vendor reply is awaited inside the lock; callers on reactive threads
 * must hop to a blocking-friendly scheduler first.
 *
 * <p><strong>Failure semantics</strong>: state-machine violations throw. A failed vendor
 * reply is recorded on the session and reported as {@link RoundStatus#COLLABORATOR_FAILED};
 * the session stays open and the round can be retried with {@link #retryRound(String)}.
 *
 * <p>Idle sessions expire lazily on access and through {@link #sweepExpired()}.
 */
public class NegotiationSessionManager {

    private static final Logger log = LoggerFactory.getLogger(NegotiationSessionManager.class);

    private final NegotiationSessionStore store;
    private final VendorDirectory vendors;
    private final VendorResponder responder;
    private final NegotiationArchive archive;
    private final NegotiationSettings settings;
    private final EvaluationSettings evaluationSettings;
    private final Clock clock;

    public NegotiationSessionManager(NegotiationSessionStore store,
                                     VendorDirectory vendors,
                                     VendorResponder responder,
                                     NegotiationArchive archive,
                                     NegotiationSettings settings,
                                     EvaluationSettings evaluationSettings,
                                     Clock clock) {
        this.store              = store;
        this.vendors            = vendors;
        this.responder          = responder;
        this.archive            = archive;
        this.settings           = settings;
        this.evaluationSettings = evaluationSettings;
        this.clock              = clock;
    }

    // ── lifecycle ─────────────────────────────────────────────────────────

    /**
     * Opens a session in {@code INITIATED}.
     *
     * @throws com.procureagent.common.exception.UnknownVendorException    vendor not in the directory
     * @throws com.procureagent.common.exception.DuplicateSessionException the pair already has an open session
     */
    public String start(String itemSku, String vendorId, double initialPrice, double targetPrice, int quantity) {
        return open(itemSku, vendorId, initialPrice, targetPrice, quantity, null);
    }

    /**
     * Opens a session seeded from an evaluated offer. The offer's price is the opening
     * quote and its ratings are used to score later counter-offers.
     */
    public String startFromOffer(String itemSku, Offer baseline, double targetPrice, int quantity) {
        if (baseline == null) {
            throw new IllegalArgumentException("Baseline offer is required");
        }
        return open(itemSku, baseline.vendorId(), baseline.price(), targetPrice, quantity, baseline);
    }

    private String open(String itemSku, String vendorId, double initialPrice, double targetPrice,
                        int quantity, Offer baseline) {
        if (itemSku == null || itemSku.isBlank()) {
            throw new IllegalArgumentException("Item sku is required");
        }
        if (!(initialPrice > 0.0) || !(targetPrice > 0.0)) {
            throw new IllegalArgumentException(String.format(
                "Prices must be positive. initialPrice=%s targetPrice=%s", initialPrice, targetPrice));
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive, was " + quantity);
        }
        Vendor vendor = vendors.require(vendorId);
        Instant now = clock.instant();

        NegotiationSession session = new NegotiationSession(
            "neg-" + UUID.randomUUID(), itemSku, vendor, quantity, initialPrice, targetPrice, baseline, now);
        session.append(SenderKind.SYSTEM, String.format(Locale.ROOT,
            "Negotiation started for %s with %s. Initial quote: ₹%.2f, Target: ₹%.2f, Quantity: %d",
            itemSku, vendor.company(), initialPrice, targetPrice, quantity), null, now);

        store.register(session, holder -> !holder.getPhase().isTerminal() && !isIdle(holder, now))
            .ifPresent(this::expireDisplaced);

        log.info("[Negotiation] Session started. sessionId={} sku={} vendor={} persona={} initialPrice={} targetPrice={}",
                 session.getId(), itemSku, vendorId, vendor.persona(), initialPrice, targetPrice);
        return session.getId();
    }

    /**
     * Records a message and, for buyer messages, obtains the vendor's reply.
     *
     * @throws SessionClosedException when the session is terminal or has just expired
     */
    public RoundResult sendMessage(String sessionId, SenderKind sender, String text) {
        if (sender == null || sender == SenderKind.SYSTEM) {
            throw new IllegalArgumentException("Messages must come from BUYER or VENDOR");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text is required");
        }
        NegotiationSession session = store.get(sessionId);
        session.lock().lock();
        try {
            ensureOpen(session);
            if (session.getPhase() == NegotiationPhase.INITIATED) {
                session.setPhase(NegotiationPhase.ACTIVE);
            }

            Instant now = clock.instant();
            Double price = PriceExtractor.extract(text);
            NegotiationMessage message = session.append(sender, text, price, now);
            if (price != null) {
                session.setCurrentOffer(price);
            }

            if (sender == SenderKind.VENDOR) {
                applyTransitions(session, text, price);
                return result(session, message, null, null);
            }

            int round = session.incrementRound();
            if (round > settings.maxRounds()) {
                String reason = "Maximum of " + settings.maxRounds() + " rounds exceeded";
                terminate(session, NegotiationPhase.FAILED, "Negotiation failed: " + reason + ".");
                return new RoundResult(message, null, RoundStatus.TERMINATED, session.getPhase(),
                                       session.getCurrentOffer(), reason);
            }

            applyTransitions(session, text, price);
            if (session.getPhase().isTerminal()) {
                return result(session, message, null, null);
            }
            return vendorRound(session, message);
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Re-requests the vendor reply for the latest unanswered buyer message, typically
     * after a {@link RoundStatus#COLLABORATOR_FAILED} round. Does not count a new round.
     *
     * @throws IllegalStateException when no buyer message is waiting for a reply
     */
    public RoundResult retryRound(String sessionId) {
        NegotiationSession session = store.get(sessionId);
        session.lock().lock();
        try {
            ensureOpen(session);
            if (!session.awaitingVendorReply()) {
                throw new IllegalStateException("Session " + sessionId + " has no unanswered buyer message");
            }
            log.info("[Negotiation] Retrying vendor reply. sessionId={} round={}", sessionId, session.getRoundCount());
            return vendorRound(session, null);
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Abandons a session ({@code FAILED}). Idempotent on terminal sessions.
     */
    public NegotiationSessionView close(String sessionId) {
        NegotiationSession session = store.get(sessionId);
        session.lock().lock();
        try {
            expireIfIdle(session, clock.instant());
            if (!session.getPhase().isTerminal()) {
                terminate(session, NegotiationPhase.FAILED, "Negotiation closed by buyer.");
            }
            return session.view();
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Expires every open session idle past the configured timeout.
     * Sessions busy with a round are skipped; they are not idle.
     *
     * @return ids of the sessions expired by this sweep
     */
    public List<String> sweepExpired() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        for (NegotiationSession session : store.all()) {
            if (session.getPhase().isTerminal() || !session.lock().tryLock()) {
                continue;
            }
            try {
                if (expireIfIdle(session, now)) {
                    expired.add(session.getId());
                }
            } finally {
                session.lock().unlock();
            }
        }
        if (!expired.isEmpty()) {
            log.info("[Negotiation] Expiry sweep finished. expired={} ids={}", expired.size(), expired);
        }
        return expired;
    }

    // ── queries ───────────────────────────────────────────────────────────

    public NegotiationSummary getSummary(String sessionId) {
        NegotiationSession session = store.get(sessionId);
        session.lock().lock();
        try {
            expireIfIdle(session, clock.instant());
            return new NegotiationSummary(
                session.getId(),
                session.getPhase(),
                session.getCurrentOffer(),
                session.getMessageCount(),
                session.getRoundCount(),
                session.savings(),
                currentOfferScore(session));
        } finally {
            session.lock().unlock();
        }
    }

    public NegotiationSessionView getSession(String sessionId) {
        NegotiationSession session = store.get(sessionId);
        session.lock().lock();
        try {
            expireIfIdle(session, clock.instant());
            return session.view();
        } finally {
            session.lock().unlock();
        }
    }

    /** Open sessions, most recently active first. */
    public List<NegotiationSessionView> listActive() {
        Instant now = clock.instant();
        List<NegotiationSessionView> active = new ArrayList<>();
        for (NegotiationSession session : store.all()) {
            session.lock().lock();
            try {
                expireIfIdle(session, now);
                if (!session.getPhase().isTerminal()) {
                    active.add(session.view());
                }
            } finally {
                session.lock().unlock();
            }
        }
        active.sort(Comparator.comparing(NegotiationSessionView::updatedAt).reversed());
        return active;
    }

    public NegotiationStats getStats() {
        int total = 0;
        int open = 0;
        int agreed = 0;
        int failed = 0;
        int expired = 0;
        double totalSavings = 0.0;
        for (NegotiationSession session : store.all()) {
            session.lock().lock();
            try {
                total++;
                switch (session.getPhase()) {
                    case INITIATED, ACTIVE -> open++;
                    case AGREED -> {
                        agreed++;
                        Double savings = session.savings();
                        if (savings != null) {
                            totalSavings += savings * session.getQuantity();
                        }
                    }
                    case FAILED -> failed++;
                    case EXPIRED -> expired++;
                }
            } finally {
                session.lock().unlock();
            }
        }
        double average = agreed == 0 ? 0.0 : totalSavings / agreed;
        double successRate = total == 0 ? 0.0 : 100.0 * agreed / total;
        return new NegotiationStats(total, open, agreed, failed, expired, totalSavings, average, successRate);
    }

    // ── round internals (caller holds the session lock) ───────────────────

    private RoundResult vendorRound(NegotiationSession session, NegotiationMessage buyerMessage) {
        String reply;
        try {
            reply = responder.reply(session.view(), session.getVendor()).block();
        } catch (RuntimeException e) {
            return collaboratorFailed(session, buyerMessage, e.getMessage());
        }
        if (reply == null || reply.isBlank()) {
            return collaboratorFailed(session, buyerMessage, "Vendor reply was empty");
        }

        Double price = PriceExtractor.extract(reply);
        NegotiationMessage vendorMessage = session.append(SenderKind.VENDOR, reply, price, clock.instant());
        if (price != null) {
            session.setCurrentOffer(price);
        }
        applyTransitions(session, reply, price);

        log.info("[Negotiation] Round completed. sessionId={} round={} vendorPrice={} phase={}",
                 session.getId(), session.getRoundCount(), price, session.getPhase());
        return result(session, buyerMessage, vendorMessage, null);
    }

    private RoundResult collaboratorFailed(NegotiationSession session, NegotiationMessage buyerMessage, String reason) {
        session.recordFailure(reason);
        log.warn("[Negotiation] Vendor reply failed, session stays open. sessionId={} round={} failedRounds={} reason={}",
                 session.getId(), session.getRoundCount(), session.getFailedRounds(), reason);
        return new RoundResult(buyerMessage, null, RoundStatus.COLLABORATOR_FAILED, session.getPhase(),
                               session.getCurrentOffer(), reason);
    }

    private void applyTransitions(NegotiationSession session, String text, Double messagePrice) {
        AcceptancePolicy.Signal signal = AcceptancePolicy.detect(text);
        if (signal == AcceptancePolicy.Signal.REJECT) {
            terminate(session, NegotiationPhase.FAILED, "Negotiation failed: offer rejected.");
            return;
        }
        if (signal != AcceptancePolicy.Signal.ACCEPT) {
            return;
        }
        Double price = messagePrice != null ? messagePrice : session.getCurrentOffer();
        if (price != null && AcceptancePolicy.withinTolerance(price, session.getTargetPrice(), settings.priceTolerance())) {
            session.setCurrentOffer(price);
            double savings = session.getInitialPrice() - price;
            terminate(session, NegotiationPhase.AGREED, String.format(Locale.ROOT,
                "Agreement reached at ₹%.2f per unit. Savings: ₹%.2f per unit (%.1f%%), ₹%.2f in total.",
                price, savings, 100.0 * savings / session.getInitialPrice(), savings * session.getQuantity()));
        } else {
            log.debug("[Negotiation] Acceptance ignored, price outside tolerance. sessionId={} price={} target={}",
                      session.getId(), price, session.getTargetPrice());
        }
    }

    private void terminate(NegotiationSession session, NegotiationPhase phase, String notice) {
        session.setPhase(phase);
        session.append(SenderKind.SYSTEM, notice, null, clock.instant());
        store.release(session);
        archive.archive(session.view());
        log.info("[Negotiation] Session closed. sessionId={} phase={} currentOffer={} rounds={}",
                 session.getId(), phase, session.getCurrentOffer(), session.getRoundCount());
    }

    private void ensureOpen(NegotiationSession session) {
        expireIfIdle(session, clock.instant());
        if (session.getPhase().isTerminal()) {
            throw new SessionClosedException(
                "Session " + session.getId() + " is " + session.getPhase() + " and accepts no messages");
        }
    }

    private boolean expireIfIdle(NegotiationSession session, Instant now) {
        if (session.getPhase().isTerminal() || !isIdle(session, now)) {
            return false;
        }
        terminate(session, NegotiationPhase.EXPIRED, String.format(Locale.ROOT,
            "Negotiation expired after %d minutes without activity.", settings.idleTimeout().toMinutes()));
        return true;
    }

    private boolean isIdle(NegotiationSession session, Instant now) {
        return session.getLastActivity().plus(settings.idleTimeout()).isBefore(now);
    }

    private void expireDisplaced(NegotiationSession displaced) {
        displaced.lock().lock();
        try {
            expireIfIdle(displaced, clock.instant());
        } finally {
            displaced.lock().unlock();
        }
    }

    private Double currentOfferScore(NegotiationSession session) {
        Offer baseline = session.getBaselineOffer();
        Double current = session.getCurrentOffer();
        if (baseline == null || current == null) {
            return null;
        }
        try {
            return OfferEvaluator.score(baseline.withPrice(current), evaluationSettings);
        } catch (InvalidOfferException e) {
            log.debug("[Negotiation] Current offer not scorable. sessionId={} reason={}", session.getId(), e.getMessage());
            return null;
        }
    }

    private static RoundResult result(NegotiationSession session, NegotiationMessage message,
                                      NegotiationMessage vendorReply, String reason) {
        RoundStatus status = session.getPhase().isTerminal() ? RoundStatus.TERMINATED : RoundStatus.COMPLETED;
        return new RoundResult(message, vendorReply, status, session.getPhase(), session.getCurrentOffer(), reason);
    }
}
