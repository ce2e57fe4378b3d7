package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-signal weights, keyed like {@link RawSignalVector}.
 *
 * <p>Every component must be finite and non-negative. Weights are configuration,
 * not market data, so a bad value is rejected at construction instead of
 * being silently neutralised.
 */
public record WeightVector(
    @JsonProperty("trend")         double trend,
    @JsonProperty("momentum")      double momentum,
    @JsonProperty("volatility")    double volatility,
    @JsonProperty("regime")        double regime,
    @JsonProperty("sector")        double sector,
    @JsonProperty("reversal")      double reversal,
    @JsonProperty("breakout")      double breakout,
    @JsonProperty("meanReversion") double meanReversion
) {

    public WeightVector {
        requireWeight("trend", trend);
        requireWeight("momentum", momentum);
        requireWeight("volatility", volatility);
        requireWeight("regime", regime);
        requireWeight("sector", sector);
        requireWeight("reversal", reversal);
        requireWeight("breakout", breakout);
        requireWeight("meanReversion", meanReversion);
    }

    public double get(SignalKey key) {
        return switch (key) {
            case TREND          -> trend;
            case MOMENTUM       -> momentum;
            case VOLATILITY     -> volatility;
            case REGIME         -> regime;
            case SECTOR         -> sector;
            case REVERSAL       -> reversal;
            case BREAKOUT       -> breakout;
            case MEAN_REVERSION -> meanReversion;
        };
    }

    /**
     * Returns a copy with the given key scaled by {@code factor}.
     * Used by the regime table to apply boosts and damps.
     */
    public WeightVector scaled(SignalKey key, double factor) {
        return new WeightVector(
            key == SignalKey.TREND          ? trend * factor         : trend,
            key == SignalKey.MOMENTUM       ? momentum * factor      : momentum,
            key == SignalKey.VOLATILITY     ? volatility * factor    : volatility,
            key == SignalKey.REGIME         ? regime * factor        : regime,
            key == SignalKey.SECTOR         ? sector * factor        : sector,
            key == SignalKey.REVERSAL       ? reversal * factor      : reversal,
            key == SignalKey.BREAKOUT       ? breakout * factor      : breakout,
            key == SignalKey.MEAN_REVERSION ? meanReversion * factor : meanReversion);
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(
                "weight '" + name + "' must be finite and non-negative, was " + value);
        }
    }
}
