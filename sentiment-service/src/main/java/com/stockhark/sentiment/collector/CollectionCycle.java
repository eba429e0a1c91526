package com.stockhark.sentiment.collector;

import com.stockhark.common.aggregation.BatchSentimentAggregator;
import com.stockhark.common.model.Observation;
import com.stockhark.sentiment.client.RedditClient;
import com.stockhark.sentiment.config.CollectionProperties;
import com.stockhark.sentiment.exception.CollectionException;
import com.stockhark.sentiment.model.ObservationRecord;
import com.stockhark.sentiment.model.SentimentSnapshot;
import com.stockhark.sentiment.repository.ObservationRecordRepository;
import com.stockhark.sentiment.repository.SentimentSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One end-to-end collection pass:
 * <pre>
 *   fetch communities → extract + score → store new observations
 *     → reload window → aggregate per symbol → store snapshots
 *     → purge rows older than the retention period
 * </pre>
 *
 * <p>Community fetch failures are already absorbed by {@link RedditClient}; anything that
 * fails after that is surfaced as a {@link CollectionException}.
 */
@Component
public class CollectionCycle {

    private static final Logger log = LoggerFactory.getLogger(CollectionCycle.class);

    private final RedditClient redditClient;
    private final ObservationCollector collector;
    private final ObservationRecordRepository observationRepository;
    private final SentimentSnapshotRepository snapshotRepository;
    private final BatchSentimentAggregator batchAggregator;
    private final CollectionProperties properties;
    private final Clock clock;

    public CollectionCycle(RedditClient redditClient,
                           ObservationCollector collector,
                           ObservationRecordRepository observationRepository,
                           SentimentSnapshotRepository snapshotRepository,
                           BatchSentimentAggregator batchAggregator,
                           CollectionProperties properties,
                           Clock clock) {
        this.redditClient          = redditClient;
        this.collector             = collector;
        this.observationRepository = observationRepository;
        this.snapshotRepository    = snapshotRepository;
        this.batchAggregator       = batchAggregator;
        this.properties            = properties;
        this.clock                 = clock;
    }

    public Mono<CycleResult> run() {
        return Mono.defer(() -> {
            LocalDateTime startedAt = LocalDateTime.now(clock);
            return Flux.fromIterable(properties.communities())
                .concatMap(community -> redditClient.fetchHot(community, properties.postsPerCommunity()))
                .collectList()
                .map(collector::collect)
                .flatMap(observations -> storeNew(observations, startedAt))
                .flatMap(stored -> aggregateWindow(startedAt)
                    .flatMap(snapshots -> purgeExpired(startedAt)
                        .map(purged -> new CycleResult(stored, snapshots, purged, startedAt))))
                .doOnSuccess(r -> log.info(
                    "Collection cycle completed. observationsStored={} snapshotsWritten={} rowsPurged={} startedAt={}",
                    r.observationsStored(), r.snapshotsWritten(), r.rowsPurged(), r.startedAt()))
                .onErrorMap(e -> !(e instanceof CollectionException),
                            e -> new CollectionException("Collection cycle failed: " + e.getMessage(), e));
        });
    }

    private Mono<Long> storeNew(List<Observation> observations, LocalDateTime collectedAt) {
        return Flux.fromIterable(observations)
            .filterWhen(this::isNew)
            .map(o -> ObservationRecord.from(o, collectedAt))
            .concatMap(observationRepository::save)
            .count();
    }

    private Mono<Boolean> isNew(Observation observation) {
        if (!observation.hasPostId()) return Mono.just(true);
        return observationRepository.existsByPostIdAndSymbol(observation.postId(), observation.symbol())
            .map(exists -> !exists);
    }

    private Mono<Long> aggregateWindow(LocalDateTime now) {
        LocalDateTime since = now.minusHours(properties.windowHours());
        return observationRepository.findObservedSince(since)
            .map(ObservationRecord::toObservation)
            .collectList()
            .map(batchAggregator::aggregateMany)
            .flatMapMany(results -> Flux.fromIterable(results.values()))
            .map(result -> SentimentSnapshot.from(result, now))
            .concatMap(snapshotRepository::save)
            .count();
    }

    /** Deletes observations and snapshots older than the retention period. */
    private Mono<Long> purgeExpired(LocalDateTime now) {
        LocalDateTime cutoff = now.minusDays(properties.retentionDays());
        return observationRepository.deleteObservedBefore(cutoff)
            .defaultIfEmpty(0L)
            .flatMap(observations -> snapshotRepository.deleteAggregatedBefore(cutoff)
                .defaultIfEmpty(0L)
                .map(snapshots -> {
                    if (observations + snapshots > 0) {
                        log.info("Expired rows purged. observations={} snapshots={} cutoff={}",
                                 observations, snapshots, cutoff);
                    }
                    return observations + snapshots;
                }));
    }

    /** Outcome of one pass. */
    public record CycleResult(long observationsStored, long snapshotsWritten, long rowsPurged,
                              LocalDateTime startedAt) {}
}
