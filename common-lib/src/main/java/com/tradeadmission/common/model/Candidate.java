package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One trade opportunity for one cycle, as delivered by the external signal source.
 *
 * <p>Optional context is normalised at construction: missing signals become
 * {@link RawSignalVector#NEUTRAL}, a missing regime becomes {@link RegimeLabel#UNKNOWN},
 * a non-finite sector momentum becomes {@code 0.0} and a non-finite EV estimate is
 * dropped. {@code symbol} and {@code baseEntryScore} are required and deliberately
 * left as given — the admission controller rejects them if malformed.
 */
public record Candidate(
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("signals")        RawSignalVector signals,
    @JsonProperty("regime")         RegimeLabel regime,
    @JsonProperty("sectorMomentum") double sectorMomentum,
    @JsonProperty("baseEntryScore") double baseEntryScore,
    @JsonProperty("estimatedEv")    Double estimatedEv,   // null = no estimate available
    @JsonProperty("timestamp")      Instant timestamp
) {

    public Candidate {
        signals        = signals != null ? signals : RawSignalVector.NEUTRAL;
        regime         = regime != null ? regime : RegimeLabel.UNKNOWN;
        sectorMomentum = RawSignalVector.neutralIfNotFinite(sectorMomentum);
        estimatedEv    = (estimatedEv != null && Double.isFinite(estimatedEv)) ? estimatedEv : null;
    }

    public boolean hasEstimatedEv() {
        return estimatedEv != null;
    }
}
