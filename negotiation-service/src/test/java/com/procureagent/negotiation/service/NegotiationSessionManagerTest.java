package com.procureagent.negotiation.service;

import com.procureagent.common.evaluation.EvaluationSettings;
import com.procureagent.common.evaluation.OfferEvaluator;
import com.procureagent.common.exception.DuplicateSessionException;
import com.procureagent.common.exception.SessionClosedException;
import com.procureagent.common.exception.SessionNotFoundException;
import com.procureagent.common.exception.UnknownVendorException;
import com.procureagent.common.llm.TextGenerationClient;
import com.procureagent.common.llm.TextGenerationException;
import com.procureagent.common.model.Offer;
import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationPhase;
import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.common.negotiation.SenderKind;
import com.procureagent.negotiation.config.NegotiationSettings;
import com.procureagent.negotiation.model.NegotiationStats;
import com.procureagent.negotiation.model.NegotiationSummary;
import com.procureagent.negotiation.model.RoundResult;
import com.procureagent.negotiation.model.RoundStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NegotiationSessionManagerTest {

    private static final String SKU    = "PEN-BLUE-001";
    private static final String VENDOR = "rajesh_stationery";

    private MutableClock clock;
    private List<NegotiationSessionView> archived;
    private AtomicInteger vendorCalls;
    private TextGenerationClient vendorText;
    private NegotiationSessionManager manager;

    @BeforeEach
    void setUp() {
        clock       = new MutableClock(Instant.parse("2026-01-05T09:00:00Z"));
        archived    = new CopyOnWriteArrayList<>();
        vendorCalls = new AtomicInteger();
        vendorText  = (prompt, system) -> Mono.just("Our price is ₹990 per unit");
        manager     = manager(new NegotiationSettings(6, 0.05, Duration.ofMinutes(30)));
    }

    private NegotiationSessionManager manager(NegotiationSettings settings) {
        TextGenerationClient counting = (prompt, system) -> {
            vendorCalls.incrementAndGet();
            return vendorText.generate(prompt, system);
        };
        return new NegotiationSessionManager(new NegotiationSessionStore(), VendorDirectory.builtIn(),
            new VendorResponder(counting), archived::add, settings, EvaluationSettings.defaults(), clock);
    }

    private String startDefault() {
        return manager.start(SKU, VENDOR, 1000.0, 900.0, 10);
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("new session is INITIATED with an opening system message")
        void initiated() {
            String id = startDefault();

            NegotiationSessionView view = manager.getSession(id);
            assertTrue(id.startsWith("neg-"));
            assertEquals(NegotiationPhase.INITIATED, view.phase());
            assertEquals(1, view.messages().size());
            assertEquals(SenderKind.SYSTEM, view.messages().get(0).sender());
            assertNull(view.currentOffer());
            assertEquals(0, view.roundCount());
        }

        @Test
        @DisplayName("second open session for the same item and vendor is rejected")
        void duplicate() {
            startDefault();
            assertThrows(DuplicateSessionException.class, () -> manager.start(SKU, VENDOR, 1000.0, 900.0, 10));
        }

        @Test
        @DisplayName("same item with a different vendor is allowed")
        void otherVendor() {
            String first  = startDefault();
            String second = manager.start(SKU, "modern_office", 1000.0, 900.0, 10);
            assertNotEquals(first, second);
        }

        @Test
        @DisplayName("closing a session frees its item/vendor slot")
        void slotFreedOnClose() {
            String first = startDefault();
            manager.close(first);
            assertDoesNotThrow(this::startAgain);
        }

        private void startAgain() {
            startDefault();
        }

        @Test
        @DisplayName("unknown vendor → UnknownVendorException")
        void unknownVendor() {
            assertThrows(UnknownVendorException.class, () -> manager.start(SKU, "nobody", 1000.0, 900.0, 10));
        }

        @Test
        @DisplayName("non-positive prices or quantity are rejected")
        void invalidInput() {
            assertThrows(IllegalArgumentException.class, () -> manager.start(SKU, VENDOR, 0.0, 900.0, 10));
            assertThrows(IllegalArgumentException.class, () -> manager.start(SKU, VENDOR, 1000.0, -1.0, 10));
            assertThrows(IllegalArgumentException.class, () -> manager.start(SKU, VENDOR, 1000.0, 900.0, 0));
            assertThrows(IllegalArgumentException.class, () -> manager.start(" ", VENDOR, 1000.0, 900.0, 10));
        }

        @Test
        @DisplayName("unknown session id → SessionNotFoundException")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> manager.getSession("neg-missing"));
        }
    }

    @Nested
    @DisplayName("rounds")
    class Rounds {

        @Test
        @DisplayName("buyer message gets a vendor reply and the vendor's price becomes current")
        void vendorReply() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "Could you do ₹850 per unit?");

            assertEquals(RoundStatus.COMPLETED, result.status());
            assertEquals(NegotiationPhase.ACTIVE, result.phase());
            assertEquals(850.0, result.message().extractedPrice());
            assertNotNull(result.vendorReply());
            assertEquals(SenderKind.VENDOR, result.vendorReply().sender());
            assertEquals(990.0, result.currentOffer());
            assertEquals(1, manager.getSession(id).roundCount());
        }

        @Test
        @DisplayName("buyer acceptance within tolerance → AGREED without asking the vendor")
        void buyerAccepts() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "We accept ₹940 per unit.");

            assertEquals(RoundStatus.TERMINATED, result.status());
            assertEquals(NegotiationPhase.AGREED, result.phase());
            assertEquals(940.0, result.currentOffer());
            assertNull(result.vendorReply());
            assertEquals(0, vendorCalls.get());
            assertEquals(1, archived.size());
            assertEquals(NegotiationPhase.AGREED, archived.get(0).phase());
        }

        @Test
        @DisplayName("vendor acceptance within tolerance closes the session as AGREED")
        void vendorAccepts() {
            vendorText = (prompt, system) -> Mono.just("Alright, we have a deal at ₹920 per unit.");
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "Can you come down to ₹900?");

            assertEquals(NegotiationPhase.AGREED, result.phase());
            assertEquals(920.0, result.currentOffer());
            NegotiationSessionView view = manager.getSession(id);
            assertEquals(SenderKind.SYSTEM, view.messages().get(view.messages().size() - 1).sender());
        }

        @Test
        @DisplayName("acceptance at a price outside tolerance keeps the session open")
        void acceptanceOutsideTolerance() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "I accept ₹1,200 per unit.");

            assertEquals(NegotiationPhase.ACTIVE, result.phase());
            assertEquals(RoundStatus.COMPLETED, result.status());
            assertEquals(1, vendorCalls.get());
        }

        @Test
        @DisplayName("negated acceptance is not an acceptance")
        void negatedAcceptance() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "We cannot accept ₹900 yet");

            assertEquals(NegotiationPhase.ACTIVE, result.phase());
        }

        @Test
        @DisplayName("rejection closes the session as FAILED")
        void rejection() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "No deal, we will walk away.");

            assertEquals(NegotiationPhase.FAILED, result.phase());
            assertEquals(RoundStatus.TERMINATED, result.status());
            assertEquals(0, vendorCalls.get());
        }

        @Test
        @DisplayName("buyer proposal phrased as a question goes to the vendor instead of closing the deal")
        void buyerQuestionProposal() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "Can we agree on ₹900 per unit?");

            assertEquals(NegotiationPhase.ACTIVE, result.phase());
            assertEquals(RoundStatus.COMPLETED, result.status());
            assertEquals(1, vendorCalls.get());
            assertNotNull(result.vendorReply());
        }

        @Test
        @DisplayName("vendor counter-offer that mentions a fair deal keeps the session open")
        void vendorDealWordingIsNotAcceptance() {
            vendorText = (prompt, system) ->
                Mono.just("₹940 is a fair deal given the volume, can you meet us there?");
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "Could you do ₹880 per unit?");

            assertEquals(NegotiationPhase.ACTIVE, result.phase());
            assertEquals(940.0, result.currentOffer());
            assertTrue(archived.isEmpty());
        }

        @Test
        @DisplayName("vendor counter bounded by a price is not a rejection")
        void vendorCounterWithPriceFloor() {
            vendorText = (prompt, system) -> Mono.just("We cannot proceed below ₹960, but ₹960 works for us.");
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "Could you do ₹880 per unit?");

            assertEquals(NegotiationPhase.ACTIVE, result.phase());
            assertEquals(RoundStatus.COMPLETED, result.status());
            assertEquals(960.0, result.currentOffer());
        }

        @Test
        @DisplayName("messages to a terminal session → SessionClosedException")
        void closedSession() {
            String id = startDefault();
            manager.sendMessage(id, SenderKind.BUYER, "We accept ₹940.");

            assertThrows(SessionClosedException.class,
                () -> manager.sendMessage(id, SenderKind.BUYER, "One more thing"));
        }

        @Test
        @DisplayName("exceeding the round limit fails the session")
        void maxRounds() {
            manager = manager(new NegotiationSettings(2, 0.05, Duration.ofMinutes(30)));
            String id = startDefault();

            manager.sendMessage(id, SenderKind.BUYER, "Can you improve the price?");
            manager.sendMessage(id, SenderKind.BUYER, "Still too high for us.");
            RoundResult third = manager.sendMessage(id, SenderKind.BUYER, "Last try?");

            assertEquals(RoundStatus.TERMINATED, third.status());
            assertEquals(NegotiationPhase.FAILED, third.phase());
            assertNull(third.vendorReply());
            assertTrue(third.failureReason().contains("Maximum of 2 rounds"));
            assertEquals(2, vendorCalls.get());
        }

        @Test
        @DisplayName("manual vendor messages are recorded without counting a round")
        void manualVendorMessage() {
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.VENDOR, "Revised quote: ₹970 per unit");

            assertEquals(RoundStatus.COMPLETED, result.status());
            assertEquals(970.0, result.currentOffer());
            assertNull(result.vendorReply());
            assertEquals(0, manager.getSession(id).roundCount());
            assertEquals(0, vendorCalls.get());
        }

        @Test
        @DisplayName("system sender and blank text are rejected")
        void invalidMessages() {
            String id = startDefault();
            assertThrows(IllegalArgumentException.class, () -> manager.sendMessage(id, SenderKind.SYSTEM, "hi"));
            assertThrows(IllegalArgumentException.class, () -> manager.sendMessage(id, SenderKind.BUYER, "  "));
        }
    }

    @Nested
    @DisplayName("collaborator failure")
    class CollaboratorFailure {

        @Test
        @DisplayName("failed vendor reply keeps the session ACTIVE and can be retried")
        void failureThenRetry() {
            AtomicInteger attempt = new AtomicInteger();
            vendorText = (prompt, system) -> attempt.incrementAndGet() == 1
                ? Mono.error(new TextGenerationException(TextGenerationException.Kind.SERVER_ERROR, "HTTP 503"))
                : Mono.just("We can offer ₹960 per unit");
            String id = startDefault();

            RoundResult failed = manager.sendMessage(id, SenderKind.BUYER, "Can you do ₹880?");
            assertEquals(RoundStatus.COLLABORATOR_FAILED, failed.status());
            assertEquals(NegotiationPhase.ACTIVE, failed.phase());
            assertTrue(failed.failureReason().contains("HTTP 503"));
            assertEquals(1, manager.getSession(id).failedRounds());

            RoundResult retried = manager.retryRound(id);
            assertEquals(RoundStatus.COMPLETED, retried.status());
            assertEquals(960.0, retried.currentOffer());
            assertEquals(1, manager.getSession(id).roundCount());
        }

        @Test
        @DisplayName("empty vendor reply counts as a collaborator failure")
        void emptyReply() {
            vendorText = (prompt, system) -> Mono.empty();
            String id = startDefault();

            RoundResult result = manager.sendMessage(id, SenderKind.BUYER, "Any discount?");

            assertEquals(RoundStatus.COLLABORATOR_FAILED, result.status());
            assertEquals("Vendor reply was empty", manager.getSession(id).lastFailure());
        }

        @Test
        @DisplayName("retry with no unanswered buyer message → IllegalStateException")
        void retryWithoutPendingMessage() {
            String id = startDefault();
            manager.sendMessage(id, SenderKind.BUYER, "Any discount?");

            assertThrows(IllegalStateException.class, () -> manager.retryRound(id));
        }
    }

    @Nested
    @DisplayName("expiry and close")
    class Expiry {

        @Test
        @DisplayName("idle session expires lazily on access")
        void lazyExpiry() {
            String id = startDefault();
            clock.advance(Duration.ofMinutes(31));

            assertEquals(NegotiationPhase.EXPIRED, manager.getSession(id).phase());
            assertThrows(SessionClosedException.class, () -> manager.sendMessage(id, SenderKind.BUYER, "Hello?"));
            assertEquals(1, archived.size());
        }

        @Test
        @DisplayName("activity inside the timeout keeps the session open")
        void notIdle() {
            String id = startDefault();
            clock.advance(Duration.ofMinutes(20));
            manager.sendMessage(id, SenderKind.BUYER, "Any discount?");
            clock.advance(Duration.ofMinutes(20));

            assertEquals(NegotiationPhase.ACTIVE, manager.getSession(id).phase());
        }

        @Test
        @DisplayName("sweep expires idle sessions and frees their slots")
        void sweep() {
            String idle = startDefault();
            clock.advance(Duration.ofMinutes(31));
            String fresh = manager.start(SKU, "modern_office", 1000.0, 900.0, 10);

            List<String> expired = manager.sweepExpired();

            assertEquals(List.of(idle), expired);
            assertEquals(NegotiationPhase.INITIATED, manager.getSession(fresh).phase());
            assertDoesNotThrow(() -> manager.start(SKU, VENDOR, 1000.0, 900.0, 10));
        }

        @Test
        @DisplayName("starting over an idle session expires the old one")
        void startDisplacesIdle() {
            String old = startDefault();
            clock.advance(Duration.ofMinutes(31));

            String replacement = startDefault();

            assertNotEquals(old, replacement);
            assertEquals(NegotiationPhase.EXPIRED, manager.getSession(old).phase());
            assertEquals(NegotiationPhase.INITIATED, manager.getSession(replacement).phase());
        }

        @Test
        @DisplayName("close is idempotent and archives once")
        void closeIdempotent() {
            String id = startDefault();

            NegotiationSessionView first  = manager.close(id);
            NegotiationSessionView second = manager.close(id);

            assertEquals(NegotiationPhase.FAILED, first.phase());
            assertEquals(NegotiationPhase.FAILED, second.phase());
            assertEquals(first.messages().size(), second.messages().size());
            assertEquals(1, archived.size());
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("summary reports savings and re-scores the current offer against the baseline")
        void summaryWithBaseline() {
            Offer baseline = new Offer(VENDOR, 1000.0, 5, 4.5, 4.0);
            String id = manager.startFromOffer(SKU, baseline, 900.0, 10);
            manager.sendMessage(id, SenderKind.BUYER, "Can you do better?");

            NegotiationSummary summary = manager.getSummary(id);

            assertEquals(990.0, summary.currentOffer());
            assertEquals(10.0, summary.savings(), 1e-9);
            assertEquals(1, summary.roundCount());
            assertEquals(3, summary.messageCount());
            assertEquals(OfferEvaluator.score(baseline.withPrice(990.0), EvaluationSettings.defaults()),
                         summary.currentOfferScore(), 1e-9);
        }

        @Test
        @DisplayName("summary without a baseline offer has no score")
        void summaryWithoutBaseline() {
            String id = startDefault();
            assertNull(manager.getSummary(id).currentOfferScore());
            assertNull(manager.getSummary(id).savings());
        }

        @Test
        @DisplayName("active list excludes terminal sessions")
        void listActive() {
            String open   = startDefault();
            String closed = manager.start(SKU, "modern_office", 1000.0, 900.0, 10);
            manager.close(closed);

            List<NegotiationSessionView> active = manager.listActive();

            assertEquals(1, active.size());
            assertEquals(open, active.get(0).sessionId());
        }

        @Test
        @DisplayName("stats count phases and total savings over agreements")
        void stats() {
            String agreed = startDefault();
            manager.sendMessage(agreed, SenderKind.BUYER, "We accept ₹900 per unit.");
            String failed = manager.start(SKU, "modern_office", 1000.0, 900.0, 10);
            manager.close(failed);

            NegotiationStats stats = manager.getStats();

            assertEquals(2, stats.totalSessions());
            assertEquals(1, stats.agreedSessions());
            assertEquals(1, stats.failedSessions());
            assertEquals(0, stats.activeSessions());
            assertEquals(1000.0, stats.totalSavings(), 1e-9);
            assertEquals(1000.0, stats.averageSavingsPerAgreement(), 1e-9);
            assertEquals(50.0, stats.successRatePercent(), 1e-9);
        }
    }

    @Test
    @DisplayName("concurrent buyer messages on one session are serialised")
    void concurrentRoundsSerialised() throws Exception {
        manager = manager(new NegotiationSettings(20, 0.05, Duration.ofMinutes(30)));
        AtomicInteger inFlight    = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        vendorText = (prompt, system) -> Mono.fromCallable(() -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(10);
            inFlight.decrementAndGet();
            return "Our price is ₹990 per unit";
        });
        String id = startDefault();

        int senders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(senders);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<RoundResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < senders; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return manager.sendMessage(id, SenderKind.BUYER, "Can you improve the price?");
                }));
            }
            go.countDown();
            for (Future<RoundResult> f : futures) {
                assertEquals(RoundStatus.COMPLETED, f.get(10, TimeUnit.SECONDS).status());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
        List<NegotiationMessage> messages = manager.getSession(id).messages();
        assertEquals(1 + 2 * senders, messages.size());
        for (int i = 1; i < messages.size(); i++) {
            SenderKind expected = i % 2 == 1 ? SenderKind.BUYER : SenderKind.VENDOR;
            assertEquals(expected, messages.get(i).sender(), "message " + i);
        }
        assertEquals(senders, manager.getSession(id).roundCount());
    }

    static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
