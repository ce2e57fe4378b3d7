package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit entry for one rejected candidate in one cycle. Immutable; appended once,
 * never rewritten.
 *
 * <p>{@code detail} refines the reason where one code covers several causes
 * (e.g. {@code displacement_min_hold} under {@link BlockReason#MAX_POSITIONS_REACHED});
 * {@code null} otherwise.
 */
public record BlockRecord(
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("reason")         BlockReason reason,
    @JsonProperty("candidateScore") double candidateScore,
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("detail")         String detail
) {}
