package com.stockhark.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * One timestamped, sourced, pre-scored sentiment data point for a single symbol.
 *
 * <p>{@code rawSentiment} is trusted to lie in [-1.0, 1.0]; the upstream scorer owns
 * that guarantee. {@code timestamp} is zone-less: zone-aware values are converted by
 * dropping their offset, so elapsed-time arithmetic is always done in one reference zone.
 *
 * <p>{@code postId} is nullable. It is only used to count unique originating posts.
 */
public record Observation(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("rawSentiment") double rawSentiment,
    @JsonProperty("timestamp") LocalDateTime timestamp,
    @JsonProperty("source") String source,
    @JsonProperty("text") String text,
    @JsonProperty("postId") String postId
) {
    public Observation {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
        source = source != null ? source : "";
        text   = text != null ? text : "";
    }

    public static Observation of(String symbol, double rawSentiment, LocalDateTime timestamp,
                                 String source, String text, String postId) {
        return new Observation(symbol, rawSentiment, timestamp, source, text, postId);
    }

    /** Offset is discarded, not converted: {@code 10:00+02:00} becomes {@code 10:00}. */
    public static Observation of(String symbol, double rawSentiment, OffsetDateTime timestamp,
                                 String source, String text, String postId) {
        return new Observation(symbol, rawSentiment, timestamp.toLocalDateTime(), source, text, postId);
    }

    /** Zone is discarded, not converted. */
    public static Observation of(String symbol, double rawSentiment, ZonedDateTime timestamp,
                                 String source, String text, String postId) {
        return new Observation(symbol, rawSentiment, timestamp.toLocalDateTime(), source, text, postId);
    }

    public boolean hasPostId() {
        return postId != null && !postId.isBlank();
    }
}
