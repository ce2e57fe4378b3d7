package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record OpenPosition(
    @JsonProperty("symbol")       String symbol,
    @JsonProperty("scoreAtEntry") double scoreAtEntry,
    @JsonProperty("openedAt")     Instant openedAt
) {}
