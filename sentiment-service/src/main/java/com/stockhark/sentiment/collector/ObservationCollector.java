package com.stockhark.sentiment.collector;

import com.stockhark.common.model.Observation;
import com.stockhark.common.scoring.SentimentScorer;
import com.stockhark.common.symbol.SymbolExtractor;
import com.stockhark.sentiment.client.RedditPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw posts into {@link Observation}s: one per (post, mentioned symbol).
 *
 * <p>Each post is scored once and the score is shared by every symbol it mentions.
 * Stickied posts (moderator announcements, daily threads) are skipped.
 */
@Component
public class ObservationCollector {

    private static final Logger log = LoggerFactory.getLogger(ObservationCollector.class);

    static final String SOURCE_PREFIX = "reddit/r/";

    private final SymbolExtractor symbolExtractor;
    private final SentimentScorer sentimentScorer;

    public ObservationCollector(SymbolExtractor symbolExtractor, SentimentScorer sentimentScorer) {
        this.symbolExtractor = symbolExtractor;
        this.sentimentScorer = sentimentScorer;
    }

    public List<Observation> collect(List<RedditPost> posts) {
        List<Observation> observations = new ArrayList<>();
        int skipped = 0;

        for (RedditPost post : posts) {
            if (post.stickied()) {
                skipped++;
                continue;
            }
            String text = post.fullText();
            List<String> symbols = symbolExtractor.extract(text);
            if (symbols.isEmpty()) continue;

            double score = sentimentScorer.score(text);
            String source = SOURCE_PREFIX + post.community();
            for (String symbol : symbols) {
                observations.add(Observation.of(symbol, score, post.createdAt(), source, text, post.id()));
            }
        }

        log.debug("Posts collected. posts={} stickiedSkipped={} observations={} scorer={}",
                  posts.size(), skipped, observations.size(), sentimentScorer.name());
        return observations;
    }
}
