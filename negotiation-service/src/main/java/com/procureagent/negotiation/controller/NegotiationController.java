package com.procureagent.negotiation.controller;

import com.procureagent.common.negotiation.NegotiationSessionView;
import com.procureagent.negotiation.dto.SendMessageRequest;
import com.procureagent.negotiation.dto.StartNegotiationRequest;
import com.procureagent.negotiation.dto.StartNegotiationResponse;
import com.procureagent.negotiation.model.NegotiationStats;
import com.procureagent.negotiation.model.NegotiationSummary;
import com.procureagent.negotiation.model.RoundResult;
import com.procureagent.negotiation.model.Vendor;
import com.procureagent.negotiation.service.NegotiationSessionManager;
import com.procureagent.negotiation.service.VendorDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST API for buyer/vendor negotiation sessions.
 *
 * <p>The session manager blocks while a vendor reply is generated, so every call is
 * shifted onto the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/negotiations")
public class NegotiationController {

    private static final Logger log = LoggerFactory.getLogger(NegotiationController.class);

    private final NegotiationSessionManager manager;
    private final VendorDirectory vendors;

    public NegotiationController(NegotiationSessionManager manager, VendorDirectory vendors) {
        this.manager = manager;
        this.vendors = vendors;
    }

    @PostMapping
    public Mono<ResponseEntity<StartNegotiationResponse>> start(@RequestBody StartNegotiationRequest request) {
        log.info("Negotiation start requested. sku={} vendor={} initialPrice={} targetPrice={}",
                 request.itemSku(), request.vendorId(), request.initialPrice(), request.targetPrice());
        return blocking(() -> {
                String sessionId = manager.start(request.itemSku(), request.vendorId(),
                    request.initialPrice(), request.targetPrice(), request.quantity());
                return new StartNegotiationResponse(sessionId, manager.getSession(sessionId), null);
            })
            .map(body -> ResponseEntity.status(HttpStatus.CREATED).body(body))
            .doOnError(e -> log.error("Start negotiation endpoint error. sku={} vendor={}",
                                      request.itemSku(), request.vendorId(), e));
    }

    @PostMapping("/{sessionId}/messages")
    public Mono<ResponseEntity<RoundResult>> sendMessage(@PathVariable String sessionId,
                                                         @RequestBody SendMessageRequest request) {
        log.info("Negotiation message received. sessionId={} sender={}", sessionId, request.senderOrDefault());
        return blocking(() -> manager.sendMessage(sessionId, request.senderOrDefault(), request.content()))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Send message endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping("/{sessionId}/retry")
    public Mono<ResponseEntity<RoundResult>> retryRound(@PathVariable String sessionId) {
        log.info("Negotiation round retry requested. sessionId={}", sessionId);
        return blocking(() -> manager.retryRound(sessionId))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Retry round endpoint error. sessionId={}", sessionId, e));
    }

    @PostMapping("/{sessionId}/close")
    public Mono<ResponseEntity<NegotiationSessionView>> close(@PathVariable String sessionId) {
        log.info("Negotiation close requested. sessionId={}", sessionId);
        return blocking(() -> manager.close(sessionId))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Close endpoint error. sessionId={}", sessionId, e));
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<NegotiationSessionView>> session(@PathVariable String sessionId) {
        return blocking(() -> manager.getSession(sessionId)).map(ResponseEntity::ok);
    }

    @GetMapping("/{sessionId}/summary")
    public Mono<ResponseEntity<NegotiationSummary>> summary(@PathVariable String sessionId) {
        return blocking(() -> manager.getSummary(sessionId)).map(ResponseEntity::ok);
    }

    @GetMapping("/active")
    public Mono<List<NegotiationSessionView>> active() {
        log.info("Active negotiations query received");
        return blocking(manager::listActive);
    }

    @GetMapping("/stats")
    public Mono<NegotiationStats> stats() {
        log.info("Negotiation stats query received");
        return blocking(manager::getStats);
    }

    @GetMapping("/vendors")
    public Mono<List<Vendor>> vendors() {
        return Mono.just(vendors.all());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
