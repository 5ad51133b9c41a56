package com.procureagent.history.repository;

import com.procureagent.history.model.DecisionRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DecisionRecordRepository extends ReactiveCrudRepository<DecisionRecord, Long> {

    Flux<DecisionRecord> findByItemSkuOrderBySavedAtDesc(String itemSku);

    Flux<DecisionRecord> findByRunId(String runId);
}
