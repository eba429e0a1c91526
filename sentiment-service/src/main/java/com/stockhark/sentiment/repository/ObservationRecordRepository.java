package com.stockhark.sentiment.repository;

import com.stockhark.sentiment.model.ObservationRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ObservationRecordRepository extends ReactiveCrudRepository<ObservationRecord, Long> {

    /** Hot listings repeat across cycles; a post contributes once per symbol. */
    Mono<Boolean> existsByPostIdAndSymbol(String postId, String symbol);

    @Query("""
        SELECT * FROM observation_record
        WHERE observed_at >= :since
        ORDER BY symbol, observed_at
        """)
    Flux<ObservationRecord> findObservedSince(LocalDateTime since);

    @Query("""
        SELECT * FROM observation_record
        WHERE symbol = :symbol
          AND observed_at >= :since
        ORDER BY observed_at
        """)
    Flux<ObservationRecord> findBySymbolObservedSince(String symbol, LocalDateTime since);

    @Modifying
    @Query("DELETE FROM observation_record WHERE observed_at < :cutoff")
    Mono<Long> deleteObservedBefore(LocalDateTime cutoff);
}
