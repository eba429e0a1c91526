package com.stockhark.sentiment.service;

import com.stockhark.common.aggregation.SentimentAggregator;
import com.stockhark.common.model.SentimentLabel;
import com.stockhark.sentiment.collector.CollectionScheduler;
import com.stockhark.sentiment.config.CollectionProperties;
import com.stockhark.sentiment.config.RankingProperties;
import com.stockhark.sentiment.dto.SentimentResponse;
import com.stockhark.sentiment.dto.ServiceStatusDTO;
import com.stockhark.sentiment.dto.StockDetailsDTO;
import com.stockhark.sentiment.dto.StockDetailsDTO.HourlyActivity;
import com.stockhark.sentiment.dto.StockDetailsDTO.Mention;
import com.stockhark.sentiment.dto.StockDetailsDTO.SourceActivity;
import com.stockhark.sentiment.dto.TrendingStockDTO;
import com.stockhark.sentiment.model.ObservationRecord;
import com.stockhark.sentiment.repository.ObservationRecordRepository;
import com.stockhark.sentiment.repository.SentimentSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read side of the service: ranked snapshots, live per-symbol aggregation over the
 * configured window with an activity breakdown, trending symbols, and status counters.
 */
@Service
public class SentimentQueryService {

    private static final Logger log = LoggerFactory.getLogger(SentimentQueryService.class);

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;

    static final int RECENT_MENTIONS  = 10;
    static final int TOP_SOURCES      = 5;
    static final int ACTIVITY_HOURS   = 24;
    static final double TRENDING_RATIO = 1.5;

    private static final String REDDIT_PREFIX = "reddit/";
    private static final String REDDIT_SHORT_LINK = "https://redd.it/";

    private final ObservationRecordRepository observationRepository;
    private final SentimentSnapshotRepository snapshotRepository;
    private final SentimentAggregator aggregator;
    private final CollectionScheduler scheduler;
    private final CollectionProperties properties;
    private final RankingProperties ranking;
    private final Clock clock;

    public SentimentQueryService(ObservationRecordRepository observationRepository,
                                 SentimentSnapshotRepository snapshotRepository,
                                 SentimentAggregator aggregator,
                                 CollectionScheduler scheduler,
                                 CollectionProperties properties,
                                 RankingProperties ranking,
                                 Clock clock) {
        this.observationRepository = observationRepository;
        this.snapshotRepository    = snapshotRepository;
        this.aggregator            = aggregator;
        this.scheduler             = scheduler;
        this.properties            = properties;
        this.ranking               = ranking;
        this.clock                 = clock;
    }

    /**
     * Newest snapshot of every symbol that was active enough inside the window.
     * Symbols whose last snapshot or whose mentions fell out of the window drop off.
     */
    public Flux<SentimentResponse> getTopStocks(int limit) {
        int clamped = clampLimit(limit);
        LocalDateTime since = LocalDateTime.now(clock).minusHours(properties.windowHours());
        return snapshotRepository.findLatestRanked(since, ranking.minMentions(), ranking.minUniquePosts(), clamped)
            .map(SentimentResponse::from);
    }

    /**
     * Aggregates the symbol's observations inside the window at request time and attaches
     * the activity breakdown. Completes empty when the symbol has no observations in the window.
     */
    public Mono<SentimentResponse> getStock(String symbol, boolean includeDiagnostics) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime since = now.minusHours(properties.windowHours());

        return observationRepository.findBySymbolObservedSince(normalized, since)
            .collectList()
            .filter(records -> !records.isEmpty())
            .map(records -> SentimentResponse.from(
                    aggregator.aggregate(normalized,
                                         records.stream().map(ObservationRecord::toObservation).toList(),
                                         includeDiagnostics),
                    now)
                .withDetails(details(records, now)))
            .doOnNext(r -> log.debug("Live aggregation. symbol={} observations={} sentiment={}",
                                     r.symbol(), r.totalObservations(), r.finalSentiment()));
    }

    /**
     * Symbols ordered by mentions per hour over the trending look-back, then by the strength
     * of their average sentiment.
     */
    public Flux<TrendingStockDTO> getTrending() {
        LocalDateTime now = LocalDateTime.now(clock);
        int hours = ranking.trendingHours();
        LocalDateTime since = now.minusHours(hours);
        LocalDateTime halfway = now.minusHours(hours / 2);

        return observationRepository.findObservedSince(since)
            .collectList()
            .flatMapMany(records -> Flux.fromIterable(trending(records, hours, halfway)));
    }

    public Mono<ServiceStatusDTO> getStatus() {
        return Mono.zip(observationRepository.count(), snapshotRepository.count())
            .map(counts -> new ServiceStatusDTO("UP", counts.getT1(), counts.getT2(), scheduler.status()));
    }

    static int clampLimit(int limit) {
        return Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));
    }

    // ── details ──────────────────────────────────────────────────────────

    static StockDetailsDTO details(List<ObservationRecord> records, LocalDateTime now) {
        List<Mention> recent = records.stream()
            .sorted(Comparator.comparing(ObservationRecord::getObservedAt).reversed()
                .thenComparing(ObservationRecord::getSource, Comparator.nullsLast(Comparator.<String>naturalOrder())))
            .limit(RECENT_MENTIONS)
            .map(r -> new Mention(
                r.getObservedAt(),
                round(r.getRawSentiment(), 3),
                SentimentLabel.classify(r.getRawSentiment()).displayName(),
                r.getSource(),
                postUrl(r)))
            .toList();

        List<SourceActivity> sources = records.stream()
            .filter(r -> r.getSource() != null)
            .collect(Collectors.groupingBy(ObservationRecord::getSource))
            .entrySet().stream()
            .map(e -> new SourceActivity(e.getKey(), e.getValue().size(), round(average(e.getValue()), 3)))
            .sorted(Comparator.comparingLong(SourceActivity::mentions).reversed()
                .thenComparing(SourceActivity::source))
            .limit(TOP_SOURCES)
            .toList();

        LocalDateTime activityStart = now.minusHours(ACTIVITY_HOURS);
        Map<LocalDateTime, List<ObservationRecord>> byHour = records.stream()
            .filter(r -> !r.getObservedAt().isBefore(activityStart))
            .collect(Collectors.groupingBy(r -> r.getObservedAt().truncatedTo(ChronoUnit.HOURS),
                                           TreeMap::new, Collectors.toList()));
        List<HourlyActivity> hourly = byHour.entrySet().stream()
            .map(e -> new HourlyActivity(e.getKey(), e.getValue().size(), round(average(e.getValue()), 3)))
            .toList();

        return new StockDetailsDTO(recent, sources, hourly);
    }

    static String postUrl(ObservationRecord record) {
        String postId = record.getPostId();
        if (postId == null || postId.isBlank() || record.getSource() == null
                || !record.getSource().startsWith(REDDIT_PREFIX)) {
            return null;
        }
        return REDDIT_SHORT_LINK + postId;
    }

    // ── trending ─────────────────────────────────────────────────────────

    List<TrendingStockDTO> trending(List<ObservationRecord> records, int hours, LocalDateTime halfway) {
        return records.stream()
            .collect(Collectors.groupingBy(ObservationRecord::getSymbol))
            .entrySet().stream()
            .filter(e -> e.getValue().size() >= ranking.trendingMinMentions())
            .map(e -> trendOf(e.getKey(), e.getValue(), hours, halfway))
            .sorted(Comparator.comparingDouble(TrendingStockDTO::mentionVelocity).reversed()
                .thenComparing(Comparator.comparingDouble((TrendingStockDTO t) -> Math.abs(t.avgSentiment())).reversed())
                .thenComparing(TrendingStockDTO::symbol))
            .limit(ranking.trendingLimit())
            .toList();
    }

    private static TrendingStockDTO trendOf(String symbol, List<ObservationRecord> mentions,
                                            int hours, LocalDateTime halfway) {
        Map<Boolean, Long> split = mentions.stream()
            .collect(Collectors.partitioningBy(r -> !r.getObservedAt().isBefore(halfway), Collectors.counting()));
        long recent = split.get(true);
        long older  = Math.max(1, split.get(false));
        double ratio = (double) recent / older;
        return new TrendingStockDTO(
            symbol,
            mentions.size(),
            round(average(mentions), 3),
            round((double) mentions.size() / hours, 2),
            round(ratio, 2),
            ratio > TRENDING_RATIO);
    }

    private static double average(List<ObservationRecord> records) {
        return records.stream().mapToDouble(ObservationRecord::getRawSentiment).average().orElse(0.0);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
