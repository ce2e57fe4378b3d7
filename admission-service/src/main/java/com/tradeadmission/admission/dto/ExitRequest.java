package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request body for POST /api/v1/admission/exits.
 *
 * <p>{@code exitedAt} defaults to now; {@code cooldownMinutes} defaults to the
 * configured cooldown duration.
 */
public record ExitRequest(
    @JsonProperty("symbol")          String symbol,
    @JsonProperty("exitedAt")        Instant exitedAt,
    @JsonProperty("cooldownMinutes") Long cooldownMinutes
) {}
