package com.stockhark.common.scoring;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-lexicon sentiment scorer for financial social-media text.
 *
 * <pre>
 *   hitWeight  = (phrase has several words ? 2.0 : 1.0) × intensifierBoost
 *   boost      = min(2.0, 1.0 + 0.2 × intensifierHits)
 *   score      = (bullish − bearish) / (bullish + bearish),  0.0 without hits
 * </pre>
 *
 * <p>Matching is substring-based on lower-cased text. Stateless and thread-safe.
 */
public final class LexiconSentimentScorer implements SentimentScorer {

    static final double PHRASE_WEIGHT        = 2.0;
    static final double WORD_WEIGHT          = 1.0;
    static final double INTENSIFIER_STEP     = 0.2;
    static final double MAX_INTENSIFIER_BOOST = 2.0;

    static final List<String> BULLISH = List.of(
        "moon", "rocket", "surge", "breakout", "rally", "pump",
        "diamond hands", "hodl", "to the moon", "bull run",
        "lambo", "tendies", "stonks only go up",
        "buy", "long", "bull", "bullish", "strong", "positive",
        "growth", "gain", "rise", "green", "calls",
        "support", "bounce", "recovery", "uptrend",
        "momentum", "catalyst", "breakthrough",
        "beat earnings", "exceed expectations", "strong revenue",
        "good news", "upgrade", "outperform", "overweight",
        "price target increase", "dividend increase",
        "strong fundamentals", "solid quarter", "impressive results",
        "golden cross", "cup and handle", "higher highs", "bullish flag"
    );

    static final List<String> BEARISH = List.of(
        "crash", "dump", "panic sell", "paper hands", "rug pull",
        "dead cat bounce", "bear trap", "capitulation", "bloodbath",
        "free fall", "bag holder", "rekt",
        "sell", "short", "bear", "bearish", "weak", "negative",
        "loss", "drop", "fall", "decline", "red", "puts",
        "resistance", "breakdown", "correction", "downtrend",
        "profit taking", "selling pressure", "margin call",
        "miss earnings", "below expectations", "weak revenue",
        "bad news", "downgrade", "underperform", "underweight",
        "price target cut", "dividend cut", "guidance cut",
        "weak fundamentals", "disappointing quarter", "poor results",
        "investigation", "lawsuit",
        "death cross", "head and shoulders", "lower lows", "bearish flag"
    );

    static final List<String> INTENSIFIERS = List.of(
        "very", "extremely", "highly", "massive", "huge", "enormous",
        "incredible", "amazing", "terrible", "awful", "fantastic",
        "outstanding", "exceptional", "phenomenal", "disastrous"
    );

    @Override
    public double score(String text) {
        if (text == null || text.isBlank()) return 0.0;

        String lower = text.toLowerCase(Locale.ROOT);
        double boost = intensifierBoost(lower);

        double bullish = lexiconScore(lower, BULLISH, boost);
        double bearish = lexiconScore(lower, BEARISH, boost);

        double total = bullish + bearish;
        if (total == 0.0) return 0.0;
        return Math.max(-1.0, Math.min(1.0, (bullish - bearish) / total));
    }

    @Override
    public String name() {
        return "lexicon";
    }

    static double intensifierBoost(String lower) {
        long hits = INTENSIFIERS.stream().filter(lower::contains).count();
        return Math.min(MAX_INTENSIFIER_BOOST, 1.0 + hits * INTENSIFIER_STEP);
    }

    private static double lexiconScore(String lower, List<String> lexicon, double boost) {
        double score = 0.0;
        for (String keyword : lexicon) {
            if (lower.contains(keyword)) {
                score += (keyword.indexOf(' ') >= 0 ? PHRASE_WEIGHT : WORD_WEIGHT) * boost;
            }
        }
        return score;
    }
}
