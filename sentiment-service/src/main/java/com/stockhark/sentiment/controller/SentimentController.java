package com.stockhark.sentiment.controller;

import com.stockhark.sentiment.collector.CollectionCycle.CycleResult;
import com.stockhark.sentiment.collector.CollectionScheduler;
import com.stockhark.sentiment.dto.SentimentResponse;
import com.stockhark.sentiment.dto.ServiceStatusDTO;
import com.stockhark.sentiment.dto.TrendingStockDTO;
import com.stockhark.sentiment.service.SentimentQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sentiment")
public class SentimentController {

    private static final Logger log = LoggerFactory.getLogger(SentimentController.class);

    private final SentimentQueryService queryService;
    private final CollectionScheduler scheduler;
    private final Clock clock;

    public SentimentController(SentimentQueryService queryService, CollectionScheduler scheduler, Clock clock) {
        this.queryService = queryService;
        this.scheduler    = scheduler;
        this.clock        = clock;
    }

    @GetMapping("/stocks")
    public Flux<SentimentResponse> stocks(@RequestParam(defaultValue = "20") int limit) {
        log.info("Top stocks query received. limit={}", limit);
        return queryService.getTopStocks(limit)
            .doOnError(e -> log.error("Top stocks endpoint error. limit={}", limit, e));
    }

    @GetMapping("/stocks/{symbol}")
    public Mono<ResponseEntity<SentimentResponse>> stock(
            @PathVariable String symbol,
            @RequestParam(defaultValue = "false") boolean debug) {
        log.info("Stock sentiment query received. symbol={} debug={}", symbol, debug);
        return queryService.getStock(symbol, debug)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Stock sentiment endpoint error. symbol={}", symbol, e));
    }

    @GetMapping("/trending")
    public Flux<TrendingStockDTO> trending() {
        return queryService.getTrending()
            .doOnError(e -> log.error("Trending endpoint error", e));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<ServiceStatusDTO>> status() {
        return queryService.getStatus()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Status endpoint error", e));
    }

    /** 202 with the cycle outcome, or 409 when a cycle is already running. */
    @PostMapping("/collect")
    public Mono<ResponseEntity<CycleResult>> collect() {
        return scheduler.triggerNow()
            .map(result -> ResponseEntity.status(HttpStatus.ACCEPTED).body(result))
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).build())
            .doOnError(e -> log.error("Collect endpoint error", e));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(Map.<String, Object>of(
            "status", "UP",
            "service", "sentiment-service",
            "collectionRunning", scheduler.isRunning(),
            "timestamp", Instant.now(clock).toString())));
    }
}
