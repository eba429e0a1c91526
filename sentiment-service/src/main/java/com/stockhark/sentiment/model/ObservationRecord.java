package com.stockhark.sentiment.model;

import com.stockhark.common.model.Observation;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted form of one {@link Observation}.
 *
 * Column mapping (R2DBC snake_case convention):
 *   rawSentiment → raw_sentiment
 *   observedAt   → observed_at   (post creation time, UTC)
 *   postId       → post_id
 *   collectedAt  → collected_at  (when the cycle stored it)
 */
@Data
@NoArgsConstructor
@Table("observation_record")
public class ObservationRecord {

    @Id
    private Long id;

    private String symbol;

    private double rawSentiment;

    private LocalDateTime observedAt;

    private String source;

    private String text;

    private String postId;

    private LocalDateTime collectedAt;

    public static ObservationRecord from(Observation observation, LocalDateTime collectedAt) {
        ObservationRecord r = new ObservationRecord();
        r.setSymbol(observation.symbol());
        r.setRawSentiment(observation.rawSentiment());
        r.setObservedAt(observation.timestamp());
        r.setSource(observation.source());
        r.setText(observation.text());
        r.setPostId(observation.postId());
        r.setCollectedAt(collectedAt);
        return r;
    }

    public Observation toObservation() {
        return Observation.of(symbol, rawSentiment, observedAt, source, text, postId);
    }
}
