package com.procureagent.negotiation.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Periodically expires idle negotiation sessions.
 *
 * <p>Each tick runs {@link NegotiationSessionManager#sweepExpired()} on the bounded-elastic
 * scheduler. A failing sweep is logged and the next tick still fires.
 */
@Component
public class NegotiationExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(NegotiationExpirySweeper.class);

    private final NegotiationSessionManager manager;
    private final Duration interval;
    private Disposable loop;

    public NegotiationExpirySweeper(NegotiationSessionManager manager,
                                    @Value("${negotiation.sweep-interval:PT1M}") Duration interval) {
        this.manager  = manager;
        this.interval = interval;
    }

    @PostConstruct
    public void start() {
        log.info("Negotiation expiry sweeper started. interval={}", interval);
        loop = Flux.interval(interval, interval)
            .onBackpressureDrop()
            .concatMap(tick -> Mono.fromCallable(manager::sweepExpired)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(e -> log.error("Expiry sweep failed, will retry next tick", e))
                .onErrorResume(e -> Mono.empty()))
            .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (loop != null) {
            loop.dispose();
        }
    }
}
