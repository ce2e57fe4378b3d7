package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a 400 response. {@code setting} names the offending field, when known.
 */
public record ErrorResponse(
    @JsonProperty("error")   String error,
    @JsonProperty("setting") String setting,
    @JsonProperty("message") String message
) {}
