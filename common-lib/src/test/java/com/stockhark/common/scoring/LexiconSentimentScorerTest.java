package com.stockhark.common.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexiconSentimentScorerTest {

    private final LexiconSentimentScorer scorer = new LexiconSentimentScorer();

    @Test
    @DisplayName("no lexicon hits → 0.0")
    void neutralText() {
        assertEquals(0.0, scorer.score("quarterly filing posted today"));
        assertEquals(0.0, scorer.score(""));
        assertEquals(0.0, scorer.score(null));
    }

    @Test
    @DisplayName("only bullish hits → 1.0")
    void purelyBullish() {
        assertEquals(1.0, scorer.score("huge rally incoming"));
    }

    @Test
    @DisplayName("only bearish hits → -1.0")
    void purelyBearish() {
        assertEquals(-1.0, scorer.score("total bloodbath, rekt"));
    }

    @Test
    @DisplayName("multi-word phrases weigh twice a single word")
    void phraseWeight() {
        // bullish: "diamond hands" = 2; bearish: "crash" = 1 → (2 − 1) / 3
        assertEquals(1.0 / 3.0, scorer.score("diamond hands through the crash"), 1e-12);
    }

    @Test
    @DisplayName("intensifier boost is capped at 2.0")
    void intensifierCap() {
        assertEquals(1.0, LexiconSentimentScorer.intensifierBoost("plain"));
        assertEquals(1.2, LexiconSentimentScorer.intensifierBoost("very nice"), 1e-12);
        assertEquals(2.0, LexiconSentimentScorer.intensifierBoost(
            "very extremely highly massive huge enormous incredible amazing"), 1e-12);
    }

    @Test
    @DisplayName("scores always lie in [-1, 1]")
    void bounded() {
        for (String text : new String[] {
                "moon rocket surge crash dump", "BUY BUY BUY", "sell sell short puts",
                "extremely massive huge rally but weak guidance cut"}) {
            double s = scorer.score(text);
            assertTrue(s >= -1.0 && s <= 1.0, text);
        }
    }
}
