package com.stockhark.sentiment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockhark.sentiment.collector.CollectionStatus;

public record ServiceStatusDTO(
    @JsonProperty("status") String status,
    @JsonProperty("storedObservations") long storedObservations,
    @JsonProperty("storedSnapshots") long storedSnapshots,
    @JsonProperty("collection") CollectionStatus collection
) {}
