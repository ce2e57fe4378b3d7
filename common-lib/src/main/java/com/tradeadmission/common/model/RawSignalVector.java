package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed-shape vector of independently computed directional signals for one candidate.
 *
 * <p>Values are practically within [-1, 1] but not bounded here. Any missing
 * ({@code null}) or non-finite component resolves to exactly {@code 0.0}, the
 * neutral "no opinion" value — a data-quality gap never becomes an error.
 */
public record RawSignalVector(
    @JsonProperty("trend")         double trend,
    @JsonProperty("momentum")      double momentum,
    @JsonProperty("volatility")    double volatility,
    @JsonProperty("regime")        double regime,
    @JsonProperty("sector")        double sector,
    @JsonProperty("reversal")      double reversal,
    @JsonProperty("breakout")      double breakout,
    @JsonProperty("meanReversion") double meanReversion
) {

    public static final RawSignalVector NEUTRAL = new RawSignalVector(0, 0, 0, 0, 0, 0, 0, 0);

    public RawSignalVector {
        trend         = neutralIfNotFinite(trend);
        momentum      = neutralIfNotFinite(momentum);
        volatility    = neutralIfNotFinite(volatility);
        regime        = neutralIfNotFinite(regime);
        sector        = neutralIfNotFinite(sector);
        reversal      = neutralIfNotFinite(reversal);
        breakout      = neutralIfNotFinite(breakout);
        meanReversion = neutralIfNotFinite(meanReversion);
    }

    /**
     * Builds a vector from nullable components as delivered by the upstream signal source.
     * Every {@code null} becomes {@code 0.0}.
     */
    public static RawSignalVector of(Double trend, Double momentum, Double volatility,
                                     Double regime, Double sector, Double reversal,
                                     Double breakout, Double meanReversion) {
        return new RawSignalVector(
            orNeutral(trend), orNeutral(momentum), orNeutral(volatility),
            orNeutral(regime), orNeutral(sector), orNeutral(reversal),
            orNeutral(breakout), orNeutral(meanReversion));
    }

    /** Total lookup by key; never throws. */
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

    private static double orNeutral(Double value) {
        return value != null ? value : 0.0;
    }

    static double neutralIfNotFinite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
