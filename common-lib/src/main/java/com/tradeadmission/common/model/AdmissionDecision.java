package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-candidate outcome of an admission cycle, handed downstream to order placement.
 *
 * <p>{@code reason} is set only for {@link AdmissionOutcome#REJECT};
 * {@code evictedSymbol} only for {@link AdmissionOutcome#DISPLACE}.
 */
public record AdmissionDecision(
    @JsonProperty("symbol")        String symbol,
    @JsonProperty("outcome")       AdmissionOutcome outcome,
    @JsonProperty("finalScore")    double finalScore,
    @JsonProperty("reason")        BlockReason reason,
    @JsonProperty("evictedSymbol") String evictedSymbol,
    @JsonProperty("detail")        String detail
) {

    public static AdmissionDecision admit(String symbol, double finalScore) {
        return new AdmissionDecision(symbol, AdmissionOutcome.ADMIT, finalScore, null, null, null);
    }

    public static AdmissionDecision displace(String symbol, double finalScore,
                                             String evictedSymbol, String detail) {
        return new AdmissionDecision(symbol, AdmissionOutcome.DISPLACE, finalScore, null, evictedSymbol, detail);
    }

    public static AdmissionDecision reject(String symbol, double finalScore,
                                           BlockReason reason, String detail) {
        return new AdmissionDecision(symbol, AdmissionOutcome.REJECT, finalScore, reason, null, detail);
    }

    public boolean admitted() {
        return outcome == AdmissionOutcome.ADMIT || outcome == AdmissionOutcome.DISPLACE;
    }
}
