package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ExitResponse(
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("positionClosed") boolean positionClosed,
    @JsonProperty("cooldownUntil")  Instant cooldownUntil
) {}
