package com.procureagent.negotiation.controller;

import com.procureagent.common.evaluation.EvaluationBatch;
import com.procureagent.common.evaluation.EvaluationSettings;
import com.procureagent.common.evaluation.EvaluationWeights;
import com.procureagent.common.evaluation.HybridDeal;
import com.procureagent.common.evaluation.OfferEvaluator;
import com.procureagent.common.evaluation.OptimalOffer;
import com.procureagent.negotiation.dto.EvaluateOffersRequest;
import com.procureagent.negotiation.dto.NegotiateOfferRequest;
import com.procureagent.negotiation.dto.StartNegotiationResponse;
import com.procureagent.negotiation.service.NegotiationSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Scores competing vendor offers and hands the winner to the negotiation manager.
 * Requests may override the configured weights and rating scale per call.
 */
@RestController
@RequestMapping("/api/v1/offers")
public class OfferEvaluationController {

    private static final Logger log = LoggerFactory.getLogger(OfferEvaluationController.class);

    private static final int DEFAULT_TOP_N = 2;

    private final EvaluationSettings defaults;
    private final NegotiationSessionManager manager;

    public OfferEvaluationController(EvaluationSettings defaults, NegotiationSessionManager manager) {
        this.defaults = defaults;
        this.manager  = manager;
    }

    @PostMapping("/evaluate")
    public Mono<EvaluationBatch> evaluate(@RequestBody EvaluateOffersRequest request) {
        return Mono.fromCallable(() -> OfferEvaluator.evaluateBatch(request.offers(),
                                     settingsFor(request.weights(), request.scoreScale())))
            .doOnNext(batch -> log.info("Offers evaluated. ranked={} rejected={}",
                                        batch.ranked().size(), batch.rejected().size()));
    }

    @PostMapping("/optimal")
    public Mono<OptimalOffer> optimal(@RequestBody EvaluateOffersRequest request) {
        return evaluate(request)
            .map(batch -> OfferEvaluator.selectOptimal(batch.ranked()))
            .doOnNext(o -> log.info("Optimal offer selected. vendor={} score={}",
                                    o.result().offer().vendorId(), o.result().score()));
    }

    @PostMapping("/hybrid")
    public Mono<HybridDeal> hybrid(@RequestBody EvaluateOffersRequest request) {
        int n = request.topN() == null ? DEFAULT_TOP_N : request.topN();
        return evaluate(request)
            .map(batch -> OfferEvaluator.combineTopOffers(batch.ranked(), n))
            .doOnNext(d -> log.info("Hybrid deal built. n={} vendors={} hybrid={}", n, d.participatingVendors(), d.hybrid()));
    }

    /** Evaluates the offers and opens a negotiation with the optimal offer's vendor. */
    @PostMapping("/negotiate")
    public Mono<ResponseEntity<StartNegotiationResponse>> negotiate(@RequestBody NegotiateOfferRequest request) {
        log.info("Negotiate-from-offers requested. sku={} offers={} targetPrice={}",
                 request.itemSku(), request.offers() == null ? 0 : request.offers().size(), request.targetPrice());
        return Mono.fromCallable(() -> {
                EvaluationBatch batch = OfferEvaluator.evaluateBatch(request.offers(),
                    settingsFor(request.weights(), request.scoreScale()));
                OptimalOffer optimal = OfferEvaluator.selectOptimal(batch.ranked());
                String sessionId = manager.startFromOffer(request.itemSku(), optimal.result().offer(),
                    request.targetPrice(), request.quantity());
                return new StartNegotiationResponse(sessionId, manager.getSession(sessionId), optimal);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(body -> ResponseEntity.status(HttpStatus.CREATED).body(body))
            .doOnError(e -> log.error("Negotiate endpoint error. sku={}", request.itemSku(), e));
    }

    private EvaluationSettings settingsFor(EvaluationWeights weights, Double scale) {
        return new EvaluationSettings(
            weights == null ? defaults.weights() : weights,
            defaults.referencePrice(),
            defaults.referenceDeliveryDays(),
            scale == null ? defaults.scoreScale() : scale);
    }
}
