package com.procureagent.history.repository;

import com.procureagent.history.model.NegotiationRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface NegotiationRecordRepository extends ReactiveCrudRepository<NegotiationRecord, Long> {

    /** Latest snapshot; a session archived more than once keeps every row. */
    Mono<NegotiationRecord> findFirstBySessionIdOrderBySavedAtDesc(String sessionId);
}
