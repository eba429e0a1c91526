package com.stockhark.sentiment.collector;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/** Read-only view of {@link CollectionScheduler} progress. */
public record CollectionStatus(
    @JsonProperty("running") boolean running,
    @JsonProperty("cycleInProgress") boolean cycleInProgress,
    @JsonProperty("lastCollection") LocalDateTime lastCollection,
    @JsonProperty("totalCollections") long totalCollections,
    @JsonProperty("totalObservationsCollected") long totalObservationsCollected,
    @JsonProperty("failedCollections") long failedCollections,
    @JsonProperty("intervalMinutes") long intervalMinutes
) {}
