package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.model.RawSignalVector;

/**
 * Raw signal components as posted by the upstream signal producer. Every field is
 * optional; a missing component is neutral.
 */
public record SignalsRequest(
    @JsonProperty("trend")         Double trend,
    @JsonProperty("momentum")      Double momentum,
    @JsonProperty("volatility")    Double volatility,
    @JsonProperty("regime")        Double regime,
    @JsonProperty("sector")        Double sector,
    @JsonProperty("reversal")      Double reversal,
    @JsonProperty("breakout")      Double breakout,
    @JsonProperty("meanReversion") Double meanReversion
) {

    public RawSignalVector toVector() {
        return RawSignalVector.of(trend, momentum, volatility, regime, sector, reversal, breakout, meanReversion);
    }
}
