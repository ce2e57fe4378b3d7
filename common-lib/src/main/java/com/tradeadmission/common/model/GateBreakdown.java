package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The three sub-gate values for one candidate and the bounded composite they produce.
 * {@code composite} is always within [{@code GateStack.GATE_MIN}, 1.0].
 */
public record GateBreakdown(
    @JsonProperty("volatilityGate")   double volatilityGate,
    @JsonProperty("regimeGate")       double regimeGate,
    @JsonProperty("sectorMultiplier") double sectorMultiplier,
    @JsonProperty("composite")        double composite
) {}
