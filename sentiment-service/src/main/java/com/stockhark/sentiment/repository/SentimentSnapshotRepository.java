package com.stockhark.sentiment.repository;

import com.stockhark.sentiment.model.SentimentSnapshot;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface SentimentSnapshotRepository extends ReactiveCrudRepository<SentimentSnapshot, Long> {

    /**
     * Newest snapshot per symbol, most-discussed first. Ties on observation count
     * fall back to confidence, then symbol, so the ranking is stable.
     *
     * <p>Only snapshots written since {@code since} qualify, and the symbol must have at
     * least {@code minMentions} observations from {@code minUniquePosts} distinct posts
     * in the same window. An observation without a post id counts as its own post.
     */
    @Query("""
        SELECT s.* FROM sentiment_snapshot s
        INNER JOIN (
            SELECT symbol, MAX(aggregated_at) AS max_aggregated_at
            FROM sentiment_snapshot
            WHERE aggregated_at >= :since
            GROUP BY symbol
        ) latest ON s.symbol = latest.symbol AND s.aggregated_at = latest.max_aggregated_at
        INNER JOIN (
            SELECT symbol
            FROM observation_record
            WHERE observed_at >= :since
            GROUP BY symbol
            HAVING COUNT(*) >= :minMentions
               AND COUNT(DISTINCT COALESCE(NULLIF(TRIM(post_id), ''), 'obs-' || CAST(id AS VARCHAR))) >= :minUniquePosts
        ) active ON s.symbol = active.symbol
        ORDER BY s.total_observations DESC, s.confidence DESC, s.symbol
        LIMIT :limit
        """)
    Flux<SentimentSnapshot> findLatestRanked(LocalDateTime since, int minMentions, int minUniquePosts, int limit);

    @Modifying
    @Query("DELETE FROM sentiment_snapshot WHERE aggregated_at < :cutoff")
    Mono<Long> deleteAggregatedBefore(LocalDateTime cutoff);
}
