package com.stockhark.sentiment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stockhark.common.aggregation.BatchSentimentAggregator;
import com.stockhark.common.aggregation.SentimentAggregator;
import com.stockhark.common.config.AggregationConfig;
import com.stockhark.common.scoring.LexiconSentimentScorer;
import com.stockhark.common.scoring.SentimentScorer;
import com.stockhark.common.symbol.CashtagSymbolExtractor;
import com.stockhark.common.symbol.CombinedSymbolExtractor;
import com.stockhark.common.symbol.SymbolExtractor;
import com.stockhark.common.symbol.TickerSymbolExtractor;
import com.stockhark.common.symbol.TickerUniverse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the pure aggregation engine and its collaborators as singletons.
 * Everything downstream receives these through constructor injection.
 */
@Configuration
public class SentimentServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(SentimentServiceConfig.class);

    /** Reddit listings for a full page of posts run well past the 256 KB codec default. */
    private static final int REDDIT_MAX_IN_MEMORY_BYTES = 2 * 1024 * 1024;

    /** Observation timestamps are stored in UTC, so the reference clock must be too. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AggregationConfig aggregationConfig(AggregationProperties properties) {
        AggregationConfig config = properties.toConfig();
        log.info("Aggregation configured. {}", config);
        return config;
    }

    @Bean
    public SentimentAggregator sentimentAggregator(AggregationConfig config, Clock clock) {
        return new SentimentAggregator(config, clock);
    }

    @Bean
    public BatchSentimentAggregator batchSentimentAggregator(SentimentAggregator aggregator) {
        return new BatchSentimentAggregator(aggregator);
    }

    @Bean
    public TickerUniverse tickerUniverse(ObjectMapper objectMapper) {
        TickerUniverse universe = TickerUniverse.loadDefault(objectMapper);
        if (universe.size() == 0) {
            log.warn("Ticker universe is empty. No symbols will be extracted until ticker lists are provided");
        }
        return universe;
    }

    @Bean
    public SymbolExtractor symbolExtractor(TickerUniverse universe, CollectionProperties properties) {
        log.info("Symbol extraction configured. mode={}", properties.symbolMode());
        return new CombinedSymbolExtractor(
            new TickerSymbolExtractor(universe),
            new CashtagSymbolExtractor(universe),
            properties.symbolMode());
    }

    @Bean
    public SentimentScorer sentimentScorer() {
        return new LexiconSentimentScorer();
    }

    @Bean
    public WebClient redditWebClient(WebClient.Builder builder, RedditProperties properties) {
        return builder
            .baseUrl(properties.baseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(REDDIT_MAX_IN_MEMORY_BYTES))
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
