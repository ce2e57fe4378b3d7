package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A {@link Candidate} together with every intermediate of its scoring: the regime
 * weights used, the gate breakdown, the bounded delta and the resulting final score.
 *
 * <p>{@code finalScore} is always {@code baseEntryScore + delta}; it is carried here for
 * ranking, not stored anywhere else.
 */
public record ScoredCandidate(
    @JsonProperty("candidate")  Candidate candidate,
    @JsonProperty("weights")    WeightVector weights,
    @JsonProperty("gate")       GateBreakdown gate,
    @JsonProperty("delta")      double delta,
    @JsonProperty("finalScore") double finalScore
) {

    public String symbol() {
        return candidate != null ? candidate.symbol() : null;
    }
}
