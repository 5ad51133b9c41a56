package com.procureagent.common.evaluation;

import com.procureagent.common.exception.EmptyInputException;
import com.procureagent.common.exception.InvalidConfigurationException;
import com.procureagent.common.exception.InvalidOfferException;
import com.procureagent.common.exception.NoValidOffersException;
import com.procureagent.common.model.Offer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless weighted multi-criteria scorer for competing vendor offers.
 *
 * <p><b>Formula</b> (per offer):
 * <pre>
 *   score = w_price       × (refPrice    / price)
 *         + w_delivery    × (refDelivery / deliveryDays)
 *         + w_reliability × (reliability / scaleMax)
 *         + w_pastPerf    × (pastPerf    / scaleMax)
 * </pre>
 *
 * <p>Results are ordered by descending score with a stable sort: offers with equal
 * scores keep their input order. Nothing is cached; every call scores against the
 * weights it is given.
 *
 * <p>No logging. No side-effects. Safe for concurrent use.
 */
public final class OfferEvaluator {

    private OfferEvaluator() {}

    /**
     * Scores and ranks offers with the default settings (weights 0.4/0.25/0.2/0.15,
     * refPrice 10000, refDelivery 30, scale 0–5).
     */
    public static List<EvaluationResult> evaluate(List<Offer> offers) {
        return evaluate(offers, EvaluationSettings.defaults());
    }

    public static List<EvaluationResult> evaluate(List<Offer> offers, EvaluationWeights weights) {
        return evaluate(offers, EvaluationSettings.withWeights(weights));
    }

    /**
     * Scores and ranks offers, silently excluding invalid ones.
     *
     * @return ranked results; empty when {@code offers} is empty
     * @throws InvalidConfigurationException when the settings are invalid
     * @throws NoValidOffersException        when every offer of a non-empty batch is invalid
     */
    public static List<EvaluationResult> evaluate(List<Offer> offers, EvaluationSettings settings) {
        return evaluateBatch(offers, settings).ranked();
    }

    /**
     * Same as {@link #evaluate(List, EvaluationSettings)} but also reports which offers
     * were excluded and why.
     */
    public static EvaluationBatch evaluateBatch(List<Offer> offers, EvaluationSettings settings) {
        if (settings == null) {
            throw new InvalidConfigurationException("Evaluation settings are required");
        }
        settings.validate();
        if (offers == null || offers.isEmpty()) {
            return new EvaluationBatch(List.of(), List.of());
        }

        List<Scored> scored = new ArrayList<>();
        List<RejectedOffer> rejected = new ArrayList<>();
        for (Offer offer : offers) {
            try {
                scored.add(new Scored(offer, score(offer, settings)));
            } catch (InvalidOfferException e) {
                rejected.add(new RejectedOffer(offer, e.getMessage()));
            }
        }
        if (scored.isEmpty()) {
            throw new NoValidOffersException(
                "All " + offers.size() + " offers were rejected: " + rejected.get(0).reason());
        }

        // List.sort is stable: equal scores keep input order
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        List<EvaluationResult> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored s = scored.get(i);
            ranked.add(new EvaluationResult(s.offer(), s.score(), i + 1, settings.weights()));
        }
        return new EvaluationBatch(ranked, rejected);
    }

    /**
     * Scores a single offer. Settings are assumed validated by the caller.
     *
     * @throws InvalidOfferException when price or delivery days are not strictly positive,
     *                               or a rating falls outside {@code [0, scoreScale]}
     */
    public static double score(Offer offer, EvaluationSettings settings) {
        validateOffer(offer, settings.scoreScale());
        EvaluationWeights w = settings.weights();
        return w.price()           * (settings.referencePrice() / offer.price())
             + w.delivery()        * (settings.referenceDeliveryDays() / offer.deliveryDays())
             + w.reliability()     * (offer.reliabilityScore() / settings.scoreScale())
             + w.pastPerformance() * (offer.pastPerformance() / settings.scoreScale());
    }

    /**
     * Returns the top-ranked entry with selection metadata.
     *
     * @throws EmptyInputException on an empty or null list
     */
    public static OptimalOffer selectOptimal(List<EvaluationResult> results) {
        if (results == null || results.isEmpty()) {
            throw new EmptyInputException("No evaluated offers to select from");
        }
        EvaluationResult best = results.get(0);
        for (EvaluationResult r : results) {
            if (r.rank() < best.rank()) {
                best = r;
            }
        }
        return new OptimalOffer(best, 1, results.size(), best.weights());
    }

    /**
     * Merges the terms of the {@code n} best offers into one deal.
     *
     * <ul>
     *   <li>price: cheapest participating offer</li>
     *   <li>delivery days: fastest participating offer</li>
     *   <li>reliability, past performance: the anchor (rank 1)</li>
     *   <li>terms: anchor's terms, then keys missing from it filled in rank order</li>
     * </ul>
     * Ties on price or delivery go to the better-ranked offer.
     *
     * @throws EmptyInputException           on an empty list
     * @throws InvalidConfigurationException when {@code n < 1}
     */
    public static HybridDeal combineTopOffers(List<EvaluationResult> results, int n) {
        if (n < 1) {
            throw new InvalidConfigurationException("Number of offers to combine must be >= 1, was " + n);
        }
        if (results == null || results.isEmpty()) {
            throw new EmptyInputException("No evaluated offers to combine");
        }

        List<EvaluationResult> top = results.stream()
            .sorted(Comparator.comparingInt(EvaluationResult::rank))
            .limit(n)
            .toList();
        EvaluationResult anchor = top.get(0);

        EvaluationResult cheapest = anchor;
        EvaluationResult fastest  = anchor;
        for (EvaluationResult r : top) {
            if (r.offer().price() < cheapest.offer().price()) {
                cheapest = r;
            }
            if (r.offer().deliveryDays() < fastest.offer().deliveryDays()) {
                fastest = r;
            }
        }

        Map<String, Object> terms = new LinkedHashMap<>(anchor.offer().terms());
        for (EvaluationResult r : top) {
            r.offer().terms().forEach(terms::putIfAbsent);
        }

        String anchorVendor = anchor.offer().vendorId();
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("price", cheapest.offer().vendorId());
        sources.put("deliveryDays", fastest.offer().vendorId());
        sources.put("reliabilityScore", anchorVendor);
        sources.put("pastPerformance", anchorVendor);
        sources.put("terms", anchorVendor);

        Set<String> participating = new LinkedHashSet<>();
        top.forEach(r -> participating.add(r.offer().vendorId()));

        boolean hybrid = cheapest != anchor || fastest != anchor;

        return new HybridDeal(
            cheapest.offer().price(),
            fastest.offer().deliveryDays(),
            anchor.offer().reliabilityScore(),
            anchor.offer().pastPerformance(),
            terms,
            sources,
            List.copyOf(participating),
            hybrid,
            anchor);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static void validateOffer(Offer offer, double scale) {
        if (offer == null) {
            throw new InvalidOfferException("Offer is null");
        }
        if (!(offer.price() > 0.0) || !Double.isFinite(offer.price())) {
            throw new InvalidOfferException(
                "Offer from " + offer.vendorId() + " has non-positive price " + offer.price());
        }
        if (offer.deliveryDays() <= 0) {
            throw new InvalidOfferException(
                "Offer from " + offer.vendorId() + " has non-positive delivery days " + offer.deliveryDays());
        }
        if (outOfScale(offer.reliabilityScore(), scale) || outOfScale(offer.pastPerformance(), scale)) {
            throw new InvalidOfferException(String.format(
                "Offer from %s has ratings outside [0, %.1f]. reliability=%s pastPerformance=%s",
                offer.vendorId(), scale, offer.reliabilityScore(), offer.pastPerformance()));
        }
    }

    private static boolean outOfScale(double value, double scale) {
        return !Double.isFinite(value) || value < 0.0 || value > scale;
    }

    private record Scored(Offer offer, double score) {}
}
