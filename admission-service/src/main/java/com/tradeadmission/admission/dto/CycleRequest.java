package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /api/v1/admission/cycle.
 * {@code traceId} is optional; one is generated when absent.
 */
public record CycleRequest(
    @JsonProperty("traceId")    String traceId,
    @JsonProperty("candidates") List<CandidateRequest> candidates
) {}
