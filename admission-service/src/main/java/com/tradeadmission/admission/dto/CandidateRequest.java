package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.model.Candidate;
import com.tradeadmission.common.model.RegimeLabel;

import java.time.Instant;

/**
 * One candidate in a POST /api/v1/admission/cycle body.
 *
 * <p>A missing {@code baseEntryScore} maps to {@code NaN} so the candidate is rejected
 * as {@code order_validation_failed} instead of silently scoring zero.
 */
public record CandidateRequest(
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("signals")        SignalsRequest signals,
    @JsonProperty("regime")         String regime,
    @JsonProperty("sectorMomentum") Double sectorMomentum,
    @JsonProperty("baseEntryScore") Double baseEntryScore,
    @JsonProperty("estimatedEv")    Double estimatedEv,
    @JsonProperty("timestamp")      Instant timestamp
) {

    public Candidate toCandidate(Instant receivedAt) {
        return new Candidate(
            symbol != null ? symbol.trim() : null,
            signals != null ? signals.toVector() : null,
            RegimeLabel.fromLabel(regime),
            sectorMomentum != null ? sectorMomentum : 0.0,
            baseEntryScore != null ? baseEntryScore : Double.NaN,
            estimatedEv,
            timestamp != null ? timestamp : receivedAt);
    }
}
