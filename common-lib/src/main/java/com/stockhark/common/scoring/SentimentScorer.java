package com.stockhark.common.scoring;

/**
 * Scores one post's sentiment.
 *
 * <p>Contract: the returned value lies in [-1.0, 1.0] (bearish to bullish). The
 * aggregation engine trusts this range and does not re-check it.
 */
public interface SentimentScorer {

    double score(String text);

    /** Short identifier, e.g. {@code "lexicon"}. Logged with collection cycles. */
    String name();
}
